package com.codeheadsystems.pds.server.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.pds.server.exception.DatabaseException;
import com.codeheadsystems.pds.server.exception.UserAlreadyExistsException;
import com.codeheadsystems.pds.server.store.Account;
import com.codeheadsystems.pds.server.store.InviteCode;
import com.codeheadsystems.pds.server.store.InviteCodeUse;
import com.codeheadsystems.pds.server.store.SeqEvent;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryDatabaseTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private InMemoryDatabase database;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    database = new InMemoryDatabase();
    executor = Executors.newFixedThreadPool(2);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private void register(Database db, String email, String handle, String did) {
    db.transaction(stores -> {
      stores.accounts().registerUser(email, handle, did, "hash", NOW);
      return null;
    });
  }

  private void createCode(Database db, String code, int uses) {
    db.transaction(stores -> {
      stores.invites().createCode(new InviteCode(code, uses, false, "admin", "admin", NOW));
      return null;
    });
  }

  // ── Accounts ─────────────────────────────────────────────────────────────

  @Test
  void registerUser_committed_visibleByHandleDidAndEmail() {
    register(database, "a@x.com", "alice.example", "did:plc:alice");

    Optional<Account> byHandle = database.read(s -> s.accounts().getAccount("alice.example", false));
    Optional<Account> byDid = database.read(s -> s.accounts().getAccount("did:plc:alice", false));
    Optional<Account> byEmail = database.read(s -> s.accounts().getAccountByEmail("a@x.com", false));

    assertThat(byHandle).isPresent();
    assertThat(byHandle.get().did()).isEqualTo("did:plc:alice");
    assertThat(byDid).contains(byHandle.get());
    assertThat(byEmail).contains(byHandle.get());
  }

  @Test
  void registerUser_duplicateHandle_throws() {
    register(database, "a@x.com", "alice.example", "did:plc:alice");

    assertThatThrownBy(() -> register(database, "b@x.com", "alice.example", "did:plc:bob"))
        .isInstanceOf(UserAlreadyExistsException.class);
    assertThat(database.<Optional<Account>>read(s -> s.accounts().getAccount("did:plc:bob", true))).isEmpty();
  }

  @Test
  void registerUser_duplicateEmail_throwsAndReleasesOtherClaims() {
    register(database, "a@x.com", "alice.example", "did:plc:alice");

    assertThatThrownBy(() -> register(database, "a@x.com", "bob.example", "did:plc:bob"))
        .isInstanceOf(UserAlreadyExistsException.class);

    // the failed attempt's did and handle claims were rolled back
    register(database, "b@x.com", "bob.example", "did:plc:bob");
    assertThat(database.<Optional<Account>>read(s -> s.accounts().getAccount("bob.example", false))).isPresent();
  }

  @Test
  void registerUser_sameTransactionTwice_throws() {
    assertThatThrownBy(() -> database.transaction(stores -> {
      stores.accounts().registerUser("a@x.com", "alice.example", "did:plc:alice", "hash", NOW);
      stores.accounts().registerUser("b@x.com", "alice.example", "did:plc:bob", "hash", NOW);
      return null;
    })).isInstanceOf(UserAlreadyExistsException.class);
    assertThat(database.<Optional<Account>>read(s -> s.accounts().getAccount("alice.example", true))).isEmpty();
  }

  @Test
  void transaction_failure_leavesNothing() {
    assertThatThrownBy(() -> database.transaction(stores -> {
      stores.accounts().registerUser("a@x.com", "alice.example", "did:plc:alice", "hash", NOW);
      stores.invites().recordUse(new InviteCodeUse("CODE", "did:plc:alice", NOW));
      stores.sequencer().sequence(new SeqEvent(null, "did:plc:alice", "append", new byte[]{1}, NOW, null));
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

    assertThat(database.<Optional<Account>>read(s -> s.accounts().getAccount("did:plc:alice", true))).isEmpty();
    assertThat(database.<Integer>read(s -> s.invites().countUses("CODE"))).isZero();
    assertThat(database.<List<SeqEvent>>read(s -> s.sequencer().listAfter(0, 10))).isEmpty();
    register(database, "a@x.com", "alice.example", "did:plc:alice");
  }

  @Test
  void transaction_readsOwnWrites() {
    Boolean seen = database.transaction(stores -> {
      stores.accounts().registerUser("a@x.com", "alice.example", "did:plc:alice", "hash", NOW);
      stores.invites().recordUse(new InviteCodeUse("CODE", "did:plc:alice", NOW));
      return stores.accounts().getAccount("alice.example", false).isPresent()
          && stores.accounts().getAccountByEmail("a@x.com", false).isPresent()
          && stores.invites().countUses("CODE") == 1;
    });
    assertThat(seen).isTrue();
  }

  @Test
  void registerUser_concurrentClaimRolledBack_secondSucceeds() throws Exception {
    CountDownLatch claimed = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<?> first = executor.submit(() -> database.transaction(stores -> {
      stores.accounts().registerUser("a@x.com", "alice.example", "did:plc:alice", "hash", NOW);
      claimed.countDown();
      await(release);
      throw new IllegalStateException("abandoned");
    }));
    assertThat(claimed.await(5, TimeUnit.SECONDS)).isTrue();

    Future<?> second = executor.submit(() -> register(database, "b@x.com", "alice.example", "did:plc:bob"));
    Thread.sleep(100);
    assertThat(second.isDone()).isFalse();

    release.countDown();
    second.get(5, TimeUnit.SECONDS);
    assertThat(first).failsWithin(5, TimeUnit.SECONDS);
    assertThat(database.<Optional<Account>>read(s -> s.accounts().getAccount("alice.example", false)).map(Account::did))
        .contains("did:plc:bob");
  }

  @Test
  void registerUser_concurrentClaimCommitted_secondConflicts() throws Exception {
    CountDownLatch claimed = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<?> first = executor.submit(() -> database.transaction(stores -> {
      stores.accounts().registerUser("a@x.com", "alice.example", "did:plc:alice", "hash", NOW);
      claimed.countDown();
      await(release);
      return null;
    }));
    assertThat(claimed.await(5, TimeUnit.SECONDS)).isTrue();

    Future<Boolean> second = executor.submit(() -> database.transaction(stores -> {
      try {
        stores.accounts().registerUser("b@x.com", "alice.example", "did:plc:bob", "hash", NOW);
        return false;
      } catch (UserAlreadyExistsException e) {
        // the conflicting row is visible by the time the conflict is reported
        return stores.accounts().getAccount("alice.example", true).isPresent();
      }
    }));
    release.countDown();
    first.get(5, TimeUnit.SECONDS);

    assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void updateTakedown_hidesAccountUnlessSoftDeletedIncluded() {
    register(database, "a@x.com", "alice.example", "did:plc:alice");

    assertThat(database.<Boolean>transaction(s -> s.accounts().updateTakedown("did:plc:alice", "ticket-1"))).isTrue();

    assertThat(database.<Optional<Account>>read(s -> s.accounts().getAccount("alice.example", false))).isEmpty();
    assertThat(database.<Optional<Account>>read(s -> s.accounts().getAccount("alice.example", true)))
        .hasValueSatisfying(a -> assertThat(a.isTakenDown()).isTrue());
    assertThat(database.<Boolean>transaction(s -> s.accounts().updateTakedown("did:plc:nobody", "x"))).isFalse();
  }

  // ── Invites ──────────────────────────────────────────────────────────────

  @Test
  void createCode_duplicate_throws() {
    createCode(database, "CODE", 1);
    assertThatThrownBy(() -> createCode(database, "CODE", 1)).isInstanceOf(DatabaseException.class);
  }

  @Test
  void disable_marksCodeDisabled() {
    createCode(database, "CODE", 1);

    assertThat(database.<Boolean>transaction(s -> s.invites().disable("CODE"))).isTrue();
    assertThat(database.<Optional<InviteCode>>read(s -> s.invites().findCode("CODE", false)))
        .hasValueSatisfying(c -> assertThat(c.disabled()).isTrue());
    assertThat(database.<Boolean>transaction(s -> s.invites().disable("MISSING"))).isFalse();
  }

  @Test
  void recordUse_listedInOrder() {
    database.transaction(s -> {
      s.invites().recordUse(new InviteCodeUse("CODE", "did:plc:a", NOW));
      s.invites().recordUse(new InviteCodeUse("CODE", "did:plc:b", NOW.plusSeconds(1)));
      s.invites().recordUse(new InviteCodeUse("OTHER", "did:plc:c", NOW));
      return null;
    });

    assertThat(database.<List<InviteCodeUse>>read(s -> s.invites().listUses("CODE")))
        .extracting(InviteCodeUse::usedBy)
        .containsExactly("did:plc:a", "did:plc:b");
  }

  @Test
  void findCode_forUpdate_skipsRowLockedElsewhere() throws Exception {
    createCode(database, "CODE", 5);
    CountDownLatch locked = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<?> holder = executor.submit(() -> database.transaction(s -> {
      s.invites().findCode("CODE", true);
      locked.countDown();
      await(release);
      return null;
    }));
    assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(database.<Optional<InviteCode>>transaction(s -> s.invites().findCode("CODE", true))).isEmpty();
    assertThat(database.<Optional<InviteCode>>transaction(s -> s.invites().findCode("CODE", false))).isPresent();
    assertThat(database.<Optional<InviteCode>>read(s -> s.invites().findCode("CODE", true))).isPresent();

    release.countDown();
    holder.get(5, TimeUnit.SECONDS);
    assertThat(database.<Optional<InviteCode>>transaction(s -> s.invites().findCode("CODE", true))).isPresent();
  }

  @Test
  void findCode_forUpdate_waitModeBlocksUntilHolderCommits() throws Exception {
    InMemoryDatabase waiting = new InMemoryDatabase(InMemoryDatabase.LockMode.WAIT);
    createCode(waiting, "CODE", 5);
    CountDownLatch locked = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<?> holder = executor.submit(() -> waiting.transaction(s -> {
      s.invites().findCode("CODE", true);
      s.invites().recordUse(new InviteCodeUse("CODE", "did:plc:a", NOW));
      locked.countDown();
      await(release);
      return null;
    }));
    assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

    Future<Integer> reader = executor.submit(() -> waiting.transaction(s -> {
      s.invites().findCode("CODE", true);
      return s.invites().countUses("CODE");
    }));
    Thread.sleep(100);
    assertThat(reader.isDone()).isFalse();

    release.countDown();
    holder.get(5, TimeUnit.SECONDS);
    assertThat(reader.get(5, TimeUnit.SECONDS)).isEqualTo(1);
  }

  @Test
  void supportsRowLocking_onlyInsideTransactions() {
    assertThat(database.<Boolean>transaction(Stores::supportsRowLocking)).isTrue();
    assertThat(database.<Boolean>read(Stores::supportsRowLocking)).isFalse();
  }

  // ── Sequencer ────────────────────────────────────────────────────────────

  @Test
  void sequence_assignsIncreasingSeqs() {
    List<Long> seqs = database.transaction(s -> List.of(
        s.sequencer().sequence(new SeqEvent(null, "did:plc:a", "append", new byte[]{1}, NOW, null)),
        s.sequencer().sequence(new SeqEvent(null, "did:plc:b", "append", new byte[]{2}, NOW, null))));

    assertThat(seqs.get(1)).isGreaterThan(seqs.get(0));
    List<SeqEvent> after = database.read(s -> s.sequencer().listAfter(seqs.get(0), 10));
    assertThat(after).extracting(SeqEvent::did).containsExactly("did:plc:b");
    assertThat(after.get(0).seq()).isEqualTo(seqs.get(1));
    assertThat(database.<List<SeqEvent>>read(s -> s.sequencer().listAfter(0, 1))).hasSize(1);
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}

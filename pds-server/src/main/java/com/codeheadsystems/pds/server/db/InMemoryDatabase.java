package com.codeheadsystems.pds.server.db;

import com.codeheadsystems.pds.identity.cbor.Cid;
import com.codeheadsystems.pds.server.exception.DatabaseException;
import com.codeheadsystems.pds.server.exception.UserAlreadyExistsException;
import com.codeheadsystems.pds.server.store.Account;
import com.codeheadsystems.pds.server.store.AccountStore;
import com.codeheadsystems.pds.server.store.InviteCode;
import com.codeheadsystems.pds.server.store.InviteCodeUse;
import com.codeheadsystems.pds.server.store.InviteStore;
import com.codeheadsystems.pds.server.store.RefreshTokenPayload;
import com.codeheadsystems.pds.server.store.RefreshTokenStore;
import com.codeheadsystems.pds.server.store.RepoRoot;
import com.codeheadsystems.pds.server.store.RepoStore;
import com.codeheadsystems.pds.server.store.SeqEvent;
import com.codeheadsystems.pds.server.store.SequenceStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link Database}.
 * <p>
 * Each transaction stages its writes and applies them when the unit of work returns; a
 * unit of work that throws leaves no trace. Within a transaction, reads see the
 * transaction's own staged writes on top of committed state.
 * <p>
 * Handles, emails and DIDs are claimed at insert time. A claim held by a transaction that
 * has not finished yet makes the inserting transaction wait for that outcome, so a
 * conflicting row is always committed and visible by the time
 * {@link UserAlreadyExistsException} is thrown.
 * <p>
 * Invite code rows can be locked for the rest of a transaction. With
 * {@link LockMode#SKIP_LOCKED} a row locked elsewhere reads as absent; with
 * {@link LockMode#WAIT} the reader blocks until the holder finishes.
 * <p>
 * All state is lost on restart. Suitable for development and testing only.
 */
public class InMemoryDatabase implements Database {
  private static final Logger log = LoggerFactory.getLogger(InMemoryDatabase.class);

  private static final Duration CLAIM_WAIT = Duration.ofSeconds(30);

  /**
   * What {@link InviteStore#findCode(String, boolean)} does when the row is locked by
   * another transaction.
   */
  public enum LockMode {
    SKIP_LOCKED,
    WAIT
  }

  private final LockMode lockMode;

  private final ConcurrentHashMap<String, Account> accounts = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> didByHandle = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> didByEmail = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, CompletableFuture<Boolean>> handleClaims = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, CompletableFuture<Boolean>> emailClaims = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, CompletableFuture<Boolean>> didClaims = new ConcurrentHashMap<>();

  private final ConcurrentHashMap<String, InviteCode> inviteCodes = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, List<InviteCodeUse>> inviteUses = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, ReentrantLock> inviteLocks = new ConcurrentHashMap<>();

  private final ConcurrentHashMap<Cid, byte[]> blocks = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, RepoRoot> roots = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, RefreshTokenPayload> refreshTokens = new ConcurrentHashMap<>();
  private final ConcurrentSkipListMap<Long, SeqEvent> events = new ConcurrentSkipListMap<>();
  private final AtomicLong lastSeq = new AtomicLong();

  private final Object commitLock = new Object();

  /**
   * Instantiates a new In memory database that skips locked invite rows.
   */
  public InMemoryDatabase() {
    this(LockMode.SKIP_LOCKED);
  }

  /**
   * Instantiates a new In memory database.
   *
   * @param lockMode how locked invite rows are treated
   */
  public InMemoryDatabase(final LockMode lockMode) {
    this.lockMode = lockMode;
    log.warn("InMemoryDatabase in use: all accounts are lost on restart. Not for production use.");
  }

  @Override
  public <T> T transaction(final UnitOfWork<T> work) {
    return run(work, true);
  }

  @Override
  public <T> T read(final UnitOfWork<T> work) {
    return run(work, false);
  }

  private <T> T run(final UnitOfWork<T> work, final boolean locking) {
    final InMemoryTransaction txn = new InMemoryTransaction(locking);
    boolean committed = false;
    try {
      final T result = work.execute(txn);
      txn.commit();
      committed = true;
      return result;
    } finally {
      if (!committed) {
        txn.rollback();
      }
      txn.close(committed);
    }
  }

  private boolean awaitOutcome(final CompletableFuture<Boolean> owner) {
    try {
      return owner.get(CLAIM_WAIT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DatabaseException("Interrupted waiting for a concurrent registration", e);
    } catch (ExecutionException | TimeoutException e) {
      throw new DatabaseException("Concurrent registration did not finish", e);
    }
  }

  private class InMemoryTransaction
      implements Stores, AccountStore, InviteStore, RepoStore, RefreshTokenStore, SequenceStore {

    private final boolean locking;
    private final CompletableFuture<Boolean> outcome = new CompletableFuture<>();
    private final List<Runnable> rollbackActions = new ArrayList<>();
    private final List<ReentrantLock> heldLocks = new ArrayList<>();

    private final Map<String, Account> stagedAccounts = new LinkedHashMap<>();
    private final Map<String, InviteCode> stagedCodes = new LinkedHashMap<>();
    private final List<InviteCodeUse> stagedUses = new ArrayList<>();
    private final Map<Cid, byte[]> stagedBlocks = new LinkedHashMap<>();
    private final Map<String, RepoRoot> stagedRoots = new LinkedHashMap<>();
    private final Map<String, RefreshTokenPayload> stagedTokens = new LinkedHashMap<>();
    private final Map<Long, SeqEvent> stagedEvents = new LinkedHashMap<>();

    InMemoryTransaction(final boolean locking) {
      this.locking = locking;
    }

    void commit() {
      synchronized (commitLock) {
        stagedAccounts.values().forEach(account -> {
          accounts.put(account.did(), account);
          didByHandle.put(account.handle(), account.did());
          didByEmail.put(account.email(), account.did());
        });
        inviteCodes.putAll(stagedCodes);
        stagedUses.forEach(use ->
            inviteUses.computeIfAbsent(use.code(), k -> new CopyOnWriteArrayList<>()).add(use));
        stagedBlocks.forEach(blocks::putIfAbsent);
        roots.putAll(stagedRoots);
        refreshTokens.putAll(stagedTokens);
        events.putAll(stagedEvents);
      }
    }

    void rollback() {
      rollbackActions.forEach(Runnable::run);
    }

    void close(final boolean committed) {
      for (ReentrantLock lock : heldLocks) {
        lock.unlock();
      }
      heldLocks.clear();
      outcome.complete(committed);
    }

    private void claim(final ConcurrentHashMap<String, CompletableFuture<Boolean>> index, final String key) {
      while (true) {
        final CompletableFuture<Boolean> owner = index.putIfAbsent(key, outcome);
        if (owner == null) {
          rollbackActions.add(() -> index.remove(key, outcome));
          return;
        }
        if (owner == outcome || awaitOutcome(owner)) {
          throw new UserAlreadyExistsException();
        }
        // the owner rolled back and released its claim
      }
    }

    // ── Stores ───────────────────────────────────────────────────────────────

    @Override
    public AccountStore accounts() {
      return this;
    }

    @Override
    public InviteStore invites() {
      return this;
    }

    @Override
    public RepoStore repos() {
      return this;
    }

    @Override
    public RefreshTokenStore refreshTokens() {
      return this;
    }

    @Override
    public SequenceStore sequencer() {
      return this;
    }

    @Override
    public boolean supportsRowLocking() {
      return locking;
    }

    // ── Accounts ─────────────────────────────────────────────────────────────

    @Override
    public void registerUser(final String email, final String handle, final String did,
                             final String passwordHash, final Instant now) {
      claim(didClaims, did);
      claim(handleClaims, handle);
      claim(emailClaims, email);
      stagedAccounts.put(did, new Account(did, handle, email, passwordHash, now, null));
    }

    @Override
    public Optional<Account> getAccount(final String handleOrDid, final boolean includeSoftDeleted) {
      final Optional<Account> account;
      if (handleOrDid.startsWith("did:")) {
        account = lookupByDid(handleOrDid);
      } else {
        account = stagedAccounts.values().stream()
            .filter(a -> a.handle().equals(handleOrDid))
            .findFirst()
            .or(() -> Optional.ofNullable(didByHandle.get(handleOrDid)).flatMap(this::lookupByDid));
      }
      return account.filter(a -> includeSoftDeleted || !a.isTakenDown());
    }

    @Override
    public Optional<Account> getAccountByEmail(final String email, final boolean includeSoftDeleted) {
      return stagedAccounts.values().stream()
          .filter(a -> a.email().equals(email))
          .findFirst()
          .or(() -> Optional.ofNullable(didByEmail.get(email)).flatMap(this::lookupByDid))
          .filter(a -> includeSoftDeleted || !a.isTakenDown());
    }

    @Override
    public boolean updateTakedown(final String did, final String takedownRef) {
      return lookupByDid(did)
          .map(a -> {
            stagedAccounts.put(did, new Account(a.did(), a.handle(), a.email(), a.passwordHash(),
                a.createdAt(), takedownRef));
            return true;
          })
          .orElse(false);
    }

    private Optional<Account> lookupByDid(final String did) {
      final Account staged = stagedAccounts.get(did);
      return staged != null ? Optional.of(staged) : Optional.ofNullable(accounts.get(did));
    }

    // ── Invites ──────────────────────────────────────────────────────────────

    @Override
    public void createCode(final InviteCode code) {
      if (inviteCodes.containsKey(code.code()) || stagedCodes.containsKey(code.code())) {
        throw new DatabaseException("Invite code already exists: " + code.code(), null);
      }
      stagedCodes.put(code.code(), code);
    }

    @Override
    public boolean disable(final String code) {
      return findCode(code, false)
          .map(c -> {
            stagedCodes.put(code, new InviteCode(c.code(), c.availableUses(), true, c.forUser(),
                c.createdBy(), c.createdAt()));
            return true;
          })
          .orElse(false);
    }

    @Override
    public Optional<InviteCode> findCode(final String code, final boolean forUpdate) {
      if (forUpdate && locking) {
        final ReentrantLock lock = inviteLocks.computeIfAbsent(code, k -> new ReentrantLock());
        if (lockMode == LockMode.WAIT) {
          lock.lock();
        } else if (!lock.tryLock()) {
          log.debug("Invite code {} is locked by a concurrent transaction; skipping", code);
          return Optional.empty();
        }
        heldLocks.add(lock);
      }
      final InviteCode staged = stagedCodes.get(code);
      return staged != null ? Optional.of(staged) : Optional.ofNullable(inviteCodes.get(code));
    }

    @Override
    public int countUses(final String code) {
      return listUses(code).size();
    }

    @Override
    public void recordUse(final InviteCodeUse use) {
      stagedUses.add(use);
    }

    @Override
    public List<InviteCodeUse> listUses(final String code) {
      final List<InviteCodeUse> uses = new ArrayList<>(inviteUses.getOrDefault(code, List.of()));
      stagedUses.stream().filter(use -> use.code().equals(code)).forEach(uses::add);
      return uses;
    }

    // ── Repos ────────────────────────────────────────────────────────────────

    @Override
    public void putBlocks(final String did, final Map<Cid, byte[]> newBlocks) {
      newBlocks.forEach((cid, bytes) -> stagedBlocks.putIfAbsent(cid, bytes.clone()));
    }

    @Override
    public Optional<byte[]> getBlock(final Cid cid) {
      final byte[] staged = stagedBlocks.get(cid);
      final byte[] bytes = staged != null ? staged : blocks.get(cid);
      return Optional.ofNullable(bytes).map(byte[]::clone);
    }

    @Override
    public void createRoot(final String did, final Cid root, final String rev, final Instant now) {
      if (getRoot(did).isPresent()) {
        throw new DatabaseException("Repo root already exists for " + did, null);
      }
      stagedRoots.put(did, new RepoRoot(did, root.toString(), rev, now));
    }

    @Override
    public Optional<RepoRoot> getRoot(final String did) {
      final RepoRoot staged = stagedRoots.get(did);
      return staged != null ? Optional.of(staged) : Optional.ofNullable(roots.get(did));
    }

    // ── Refresh tokens ───────────────────────────────────────────────────────

    @Override
    public void grant(final RefreshTokenPayload payload) {
      stagedTokens.put(payload.id(), payload);
    }

    @Override
    public Optional<RefreshTokenPayload> find(final String id) {
      final RefreshTokenPayload staged = stagedTokens.get(id);
      return staged != null ? Optional.of(staged) : Optional.ofNullable(refreshTokens.get(id));
    }

    // ── Sequencer ────────────────────────────────────────────────────────────

    @Override
    public long sequence(final SeqEvent event) {
      final long seq = lastSeq.incrementAndGet();
      stagedEvents.put(seq, event.withSeq(seq));
      return seq;
    }

    @Override
    public List<SeqEvent> listAfter(final long afterSeq, final int limit) {
      final TreeMap<Long, SeqEvent> visible = new TreeMap<>(events.tailMap(afterSeq, false));
      stagedEvents.forEach((seq, event) -> {
        if (seq > afterSeq) {
          visible.put(seq, event);
        }
      });
      return visible.values().stream().limit(limit).toList();
    }
  }
}

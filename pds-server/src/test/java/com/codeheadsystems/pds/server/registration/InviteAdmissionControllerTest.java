package com.codeheadsystems.pds.server.registration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.pds.server.db.Stores;
import com.codeheadsystems.pds.server.exception.RegistrationError;
import com.codeheadsystems.pds.server.exception.RegistrationException;
import com.codeheadsystems.pds.server.store.InviteCode;
import com.codeheadsystems.pds.server.store.InviteStore;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InviteAdmissionControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private Stores stores;
  @Mock private InviteStore invites;

  private final InviteAdmissionController controller = new InviteAdmissionController();

  @BeforeEach
  void setUp() {
    when(stores.invites()).thenReturn(invites);
  }

  private static InviteCode code(int availableUses, boolean disabled) {
    return new InviteCode("CODE-1", availableUses, disabled, "admin", "admin", NOW);
  }

  @Test
  void checkAvailable_usesRemaining_passes() {
    when(invites.findCode("CODE-1", false)).thenReturn(Optional.of(code(2, false)));
    when(invites.countUses("CODE-1")).thenReturn(1);

    assertThatCode(() -> controller.checkAvailable(stores, "CODE-1", false)).doesNotThrowAnyException();
  }

  @Test
  void checkAvailable_unknown_invalidInviteCode() {
    when(invites.findCode("CODE-1", false)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> controller.checkAvailable(stores, "CODE-1", false))
        .isInstanceOf(RegistrationException.class)
        .hasMessage("Provided invite code not available")
        .extracting(t -> ((RegistrationException) t).getError())
        .isEqualTo(RegistrationError.INVALID_INVITE_CODE);
  }

  @Test
  void checkAvailable_disabled_invalidInviteCode() {
    when(invites.findCode("CODE-1", false)).thenReturn(Optional.of(code(5, true)));

    assertThatThrownBy(() -> controller.checkAvailable(stores, "CODE-1", false))
        .isInstanceOf(RegistrationException.class)
        .extracting(t -> ((RegistrationException) t).getError())
        .isEqualTo(RegistrationError.INVALID_INVITE_CODE);
  }

  @Test
  void checkAvailable_usedUp_invalidInviteCode() {
    when(invites.findCode("CODE-1", false)).thenReturn(Optional.of(code(1, false)));
    when(invites.countUses("CODE-1")).thenReturn(1);

    assertThatThrownBy(() -> controller.checkAvailable(stores, "CODE-1", false))
        .isInstanceOf(RegistrationException.class)
        .extracting(t -> ((RegistrationException) t).getError())
        .isEqualTo(RegistrationError.INVALID_INVITE_CODE);
  }

  @Test
  void checkAvailable_lockRequested_locksWhenSupported() {
    when(stores.supportsRowLocking()).thenReturn(true);
    when(invites.findCode("CODE-1", true)).thenReturn(Optional.of(code(1, false)));
    when(invites.countUses("CODE-1")).thenReturn(0);

    controller.checkAvailable(stores, "CODE-1", true);

    verify(invites).findCode("CODE-1", true);
  }

  @Test
  void checkAvailable_lockRequested_plainReadWhenUnsupported() {
    when(stores.supportsRowLocking()).thenReturn(false);
    when(invites.findCode("CODE-1", false)).thenReturn(Optional.of(code(1, false)));
    when(invites.countUses("CODE-1")).thenReturn(0);

    controller.checkAvailable(stores, "CODE-1", true);

    verify(invites).findCode("CODE-1", false);
  }

  @Test
  void checkAvailable_lockedElsewhere_invalidInviteCode() {
    when(stores.supportsRowLocking()).thenReturn(true);
    when(invites.findCode("CODE-1", true)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> controller.checkAvailable(stores, "CODE-1", true))
        .isInstanceOf(RegistrationException.class)
        .hasMessage("Provided invite code not available");
  }
}

package com.codeheadsystems.pds.server.repo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class TidTest {

  @Test
  void toString_zero_allLowestCharacter() {
    assertThat(new Tid(0, 0).toString()).isEqualTo("2222222222222");
  }

  @Test
  void toString_timestampThenClockId() {
    assertThat(new Tid(1, 0).toString()).isEqualTo("2222222222322");
    assertThat(new Tid(0, 1).toString()).isEqualTo("2222222222223");
    assertThat(new Tid(32, 0).toString()).isEqualTo("2222222223222");
  }

  @Test
  void next_isThirteenSortableCharacters() {
    String tid = Tid.next(Instant.now()).toString();
    assertThat(tid).hasSize(13).matches("[2-7a-z]{13}");
  }

  @Test
  void next_sameInstant_strictlyIncreasing() {
    Instant now = Instant.now();
    Tid first = Tid.next(now);
    Tid second = Tid.next(now);

    assertThat(second).isGreaterThan(first);
    assertThat(second.toString()).isGreaterThan(first.toString());
  }

  @Test
  void next_clockStepsBack_stillIncreasing() {
    Tid first = Tid.next(Instant.now());
    Tid second = Tid.next(Instant.now().minusSeconds(3600));

    assertThat(second).isGreaterThan(first);
  }

  @Test
  void constructor_clockIdOutOfRange_throws() {
    assertThatThrownBy(() -> new Tid(0, 1024)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Tid(-1, 0)).isInstanceOf(IllegalArgumentException.class);
  }
}

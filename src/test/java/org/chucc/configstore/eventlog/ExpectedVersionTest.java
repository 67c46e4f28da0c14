package org.chucc.configstore.eventlog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ExpectedVersionTest {

  @Test
  void any_matchesEveryVersion() {
    assertThat(ExpectedVersion.ANY.isAny()).isTrue();
    assertThat(ExpectedVersion.ANY.matches(0)).isTrue();
    assertThat(ExpectedVersion.ANY.matches(42)).isTrue();
    assertThat(ExpectedVersion.ANY).hasToString("ANY");
  }

  @Test
  void exact_matchesOnlyItsVersion() {
    ExpectedVersion expected = ExpectedVersion.exact(3);

    assertThat(expected.matches(3)).isTrue();
    assertThat(expected.matches(2)).isFalse();
    assertThat(expected).hasToString("3");
  }

  @Test
  void exact_rejectsNegativeVersion() {
    assertThatThrownBy(() -> ExpectedVersion.exact(-2))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

package com.scholary.syncmap.syncmap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TimeFormatsTest {

  @Test
  void toSeconds_shouldUseMillisecondPrecision() {
    assertThat(TimeFormats.toSeconds(0.0)).isEqualTo("0.000");
    assertThat(TimeFormats.toSeconds(2.5)).isEqualTo("2.500");
    assertThat(TimeFormats.toSeconds(61.2346)).isEqualTo("61.235");
  }

  @Test
  void toSrt_shouldFormatTimesCorrectly() {
    // 3661.5 seconds = 1 hour, 1 minute, 1.5 seconds
    assertThat(TimeFormats.toSrt(3661.5)).isEqualTo("01:01:01,500");
    assertThat(TimeFormats.toSrt(5.2)).isEqualTo("00:00:05,200");
  }

  @Test
  void toClock_shouldUseDotSeparator() {
    assertThat(TimeFormats.toClock(3665.75)).isEqualTo("01:01:05.750");
  }

  @Test
  void toClock_shouldCarryRoundedMilliseconds() {
    assertThat(TimeFormats.toClock(59.9996)).isEqualTo("00:01:00.000");
  }

  @Test
  void parseClock_shouldAcceptBothSeparatorsAndShortForms() {
    assertThat(TimeFormats.parseClock("01:01:01,500")).isCloseTo(3661.5, within(1e-9));
    assertThat(TimeFormats.parseClock("00:00:05.2")).isCloseTo(5.2, within(1e-9));
    assertThat(TimeFormats.parseClock("02:03.45")).isCloseTo(123.45, within(1e-9));
    assertThat(TimeFormats.parseClock(" 00:00:07 ")).isCloseTo(7.0, within(1e-9));
  }

  @Test
  void parseClock_shouldRejectGarbage() {
    assertThatThrownBy(() -> TimeFormats.parseClock("soon"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("soon");
  }

  @Test
  void parseSeconds_shouldRejectNegativeAndNonNumericValues() {
    assertThat(TimeFormats.parseSeconds("1.250")).isEqualTo(1.25);
    assertThatThrownBy(() -> TimeFormats.parseSeconds("-1"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TimeFormats.parseSeconds("abc"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TimeFormats.parseSeconds(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

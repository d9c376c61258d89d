package com.scholary.syncmap.syncmap;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between time values in seconds and their textual forms.
 *
 * <p>All clock values are rounded to the millisecond.
 */
public final class TimeFormats {

  private static final Pattern CLOCK =
      Pattern.compile("^(?:(\\d+):)?(\\d{1,2}):(\\d{1,2})(?:[,.](\\d{1,3}))?$");

  private TimeFormats() {}

  /** Format: SS.mmm (seconds with millisecond precision, e.g. "2.500"). */
  public static String toSeconds(double seconds) {
    return String.format(Locale.ROOT, "%.3f", seconds);
  }

  /** Format: HH:MM:SS,mmm (SubRip). */
  public static String toSrt(double seconds) {
    return formatClock(seconds, ',');
  }

  /** Format: HH:MM:SS.mmm (WebVTT, SMIL). */
  public static String toClock(double seconds) {
    return formatClock(seconds, '.');
  }

  private static String formatClock(double seconds, char millisSeparator) {
    long totalMillis = Math.round(seconds * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;
    return String.format(
        Locale.ROOT, "%02d:%02d:%02d%c%03d", hours, minutes, secs, millisSeparator, millis);
  }

  /**
   * Parse a clock value such as {@code 01:02:03,456}, {@code 01:02:03.456} or {@code 02:03.4}.
   *
   * @throws IllegalArgumentException if the value is not a clock value
   */
  public static double parseClock(String value) {
    Matcher matcher = CLOCK.matcher(value == null ? "" : value.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Not a clock value: '" + value + "'");
    }
    long hours = matcher.group(1) == null ? 0 : Long.parseLong(matcher.group(1));
    long minutes = Long.parseLong(matcher.group(2));
    long secs = Long.parseLong(matcher.group(3));
    double fraction = 0;
    if (matcher.group(4) != null) {
      // "4" means 400 ms, "45" means 450 ms
      fraction = Double.parseDouble("0." + matcher.group(4));
    }
    return hours * 3600 + minutes * 60 + secs + fraction;
  }

  /**
   * Parse a plain seconds value such as {@code 12.345}.
   *
   * @throws IllegalArgumentException if the value is not a non-negative number
   */
  public static double parseSeconds(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Time value cannot be null");
    }
    try {
      double seconds = Double.parseDouble(value.trim());
      if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
        throw new IllegalArgumentException("Not a valid time value: '" + value + "'");
      }
      return seconds;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a valid time value: '" + value + "'", e);
    }
  }
}

package com.scholary.syncmap.syncmap;

/**
 * Where a fragment sits in the audio: {@code begin} and {@code end} in seconds from the start
 * of the audio file.
 *
 * <p>Zero-length intervals are allowed; forced alignment produces them for fragments that were
 * not heard. Rendered as {@code "begin end"} with millisecond precision, the form the
 * one-line-per-fragment formats use.
 */
public record TimeRange(double begin, double end) {

  public TimeRange {
    if (begin < 0) {
      throw new IllegalArgumentException("Fragment cannot begin at a negative time: " + begin);
    }
    if (end < begin) {
      throw new IllegalArgumentException(
          String.format("Fragment ends (%s) before it begins (%s)", end, begin));
    }
  }

  /** Length of the interval in seconds. */
  public double duration() {
    return end - begin;
  }

  @Override
  public String toString() {
    return TimeFormats.toSeconds(begin) + " " + TimeFormats.toSeconds(end);
  }
}

package com.scholary.syncmap.format;

import java.util.Locale;

/**
 * Sync map formats known to the registry.
 */
public enum SyncMapFormat {
  CSV("csv"),
  JSON("json"),
  SMIL("smil"),
  SRT("srt"),
  SSV("ssv"),
  TSV("tsv"),
  TXT("txt"),
  VTT("vtt");

  private final String code;

  SyncMapFormat(String code) {
    this.code = code;
  }

  /** The lowercase identifier used in parameters and requests, e.g. {@code "srt"}. */
  public String code() {
    return code;
  }

  /**
   * Resolve a format from its code, ignoring case.
   *
   * @throws IllegalArgumentException if the code is blank or unknown
   */
  public static SyncMapFormat fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("Sync map format is null or blank");
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (SyncMapFormat format : values()) {
      if (format.code.equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("Sync map format '" + code + "' is not allowed");
  }

  @Override
  public String toString() {
    return code;
  }
}

package com.scholary.syncmap.syncmap;

/**
 * Exception thrown when a codec cannot parse its input or render a sync map.
 *
 * <p>The message names the offending line or value where one is known.
 */
public class SyncMapFormatException extends RuntimeException {

  public SyncMapFormatException(String message) {
    super(message);
  }

  public SyncMapFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}

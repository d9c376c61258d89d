package com.scholary.syncmap.syncmap;

/**
 * Exception thrown when a sync map codec is built without a parameter its format requires.
 *
 * <p>For example, SMIL output cannot be produced without the audio and page references.
 */
public class SyncMapMissingParameterException extends RuntimeException {

  private final String parameterName;

  public SyncMapMissingParameterException(String parameterName) {
    super("Missing required parameter '" + parameterName + "'");
    this.parameterName = parameterName;
  }

  public SyncMapMissingParameterException(String parameterName, String message) {
    super(message);
    this.parameterName = parameterName;
  }

  public String getParameterName() {
    return parameterName;
  }
}

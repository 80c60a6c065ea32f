package com.flamingo.ai.docextract.exception;

/**
 * Exception raised inside a recognition adapter when its external engine fails.
 *
 * <p>Never escapes the adapter: it is converted into a failed recognition result at the adapter
 * boundary.
 */
public class RecognitionServiceException extends RuntimeException {

  private final String engineId;

  public RecognitionServiceException(String engineId, String message) {
    super(message);
    this.engineId = engineId;
  }

  public RecognitionServiceException(String engineId, String message, Throwable cause) {
    super(message, cause);
    this.engineId = engineId;
  }

  public String getEngineId() {
    return engineId;
  }
}

package com.flamingo.ai.docextract.exception;

/** Exception thrown when a document cannot be turned into content units. */
public class DocumentExtractionException extends RuntimeException {

  private final String mimeType;
  private final String userMessage;

  public DocumentExtractionException(String mimeType, String message) {
    super(message);
    this.mimeType = mimeType;
    this.userMessage = "Failed to read document";
  }

  public DocumentExtractionException(String mimeType, String message, Throwable cause) {
    super(message, cause);
    this.mimeType = mimeType;
    this.userMessage = "Failed to read document";
  }

  public DocumentExtractionException(String mimeType, String message, String userMessage) {
    super(message);
    this.mimeType = mimeType;
    this.userMessage = userMessage;
  }

  public String getMimeType() {
    return mimeType;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

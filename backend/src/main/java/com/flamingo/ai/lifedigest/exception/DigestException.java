package com.flamingo.ai.lifedigest.exception;

/** Exception thrown when a digester fails for a file. */
public class DigestException extends RuntimeException {

  private final String filePath;
  private final String digester;
  private final String userMessage;

  public DigestException(String filePath, String digester, String message) {
    super(message);
    this.filePath = filePath;
    this.digester = digester;
    this.userMessage = "Failed to process file";
  }

  public DigestException(String filePath, String digester, String message, Throwable cause) {
    super(message, cause);
    this.filePath = filePath;
    this.digester = digester;
    this.userMessage = "Failed to process file";
  }

  protected DigestException(
      String filePath, String digester, String message, String userMessage) {
    super(message);
    this.filePath = filePath;
    this.digester = digester;
    this.userMessage = userMessage;
  }

  public String getFilePath() {
    return filePath;
  }

  public String getDigester() {
    return digester;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

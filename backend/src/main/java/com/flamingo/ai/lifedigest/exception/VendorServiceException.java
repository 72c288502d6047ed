package com.flamingo.ai.lifedigest.exception;

/** Exception thrown when an external AI service (HAID, LLM) fails or returns unusable output. */
public class VendorServiceException extends RuntimeException {

  private final String service;
  private final String userMessage;

  public VendorServiceException(String service, String message) {
    super(message);
    this.service = service;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public VendorServiceException(String service, String message, Throwable cause) {
    super(message, cause);
    this.service = service;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public String getService() {
    return service;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

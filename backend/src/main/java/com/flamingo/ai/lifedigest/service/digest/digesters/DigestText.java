package com.flamingo.ai.lifedigest.service.digest.digesters;

/** Limits on text handed to the chat models. */
final class DigestText {

  static final int MAX_SUMMARY_INPUT_CHARS = 24000;
  static final int MAX_TAGS_INPUT_CHARS = 12000;

  private DigestText() {}

  static String truncate(String text, int maxChars) {
    return text.length() <= maxChars ? text : text.substring(0, maxChars);
  }
}

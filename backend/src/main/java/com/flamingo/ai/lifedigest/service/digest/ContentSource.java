package com.flamingo.ai.lifedigest.service.digest;

/** One piece of searchable text of a file and where it came from. */
public record ContentSource(String sourceType, String text) {}

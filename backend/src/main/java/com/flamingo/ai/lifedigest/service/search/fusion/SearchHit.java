package com.flamingo.ai.lifedigest.service.search.fusion;

/**
 * One entry of a ranked result list handed to fusion. Rank is the list position; {@code score} is
 * the retriever's own score and is kept only for display.
 */
public record SearchHit(String id, String filePath, String snippet, double score) {}

package com.flamingo.ai.lifedigest.service.search.fusion;

/**
 * RRF parameters.
 *
 * @param k rank damping constant
 * @param keywordWeight weight applied to keyword ranks
 * @param semanticWeight weight applied to vector ranks
 */
public record FusionOptions(int k, double keywordWeight, double semanticWeight) {

  public static final int DEFAULT_K = 60;

  public static FusionOptions defaults() {
    return new FusionOptions(DEFAULT_K, 0.5, 0.5);
  }
}

package com.flamingo.ai.lifedigest.service.digest;

/**
 * Options for {@link DigestCoordinator#processFile}.
 *
 * @param reset re-run digesters even when their output is complete
 * @param digester when set, only this digester runs and it runs unconditionally
 */
public record ProcessOptions(boolean reset, String digester) {

  public static ProcessOptions defaults() {
    return new ProcessOptions(false, null);
  }

  public static ProcessOptions forceAll() {
    return new ProcessOptions(true, null);
  }

  public boolean hasDigesterFilter() {
    return digester != null && !digester.isBlank();
  }
}

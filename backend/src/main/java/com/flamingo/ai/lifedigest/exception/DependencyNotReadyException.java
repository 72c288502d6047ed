package com.flamingo.ai.lifedigest.exception;

import com.flamingo.ai.lifedigest.domain.enums.DigestStatus;

/**
 * Thrown by a digester whose upstream digest has not completed yet. Recorded like any failure; the
 * file is retried later, when the dependency may have completed.
 */
public class DependencyNotReadyException extends DigestException {

  private final String dependency;
  private final DigestStatus dependencyStatus;

  public DependencyNotReadyException(
      String filePath, String digester, String dependency, DigestStatus dependencyStatus) {
    super(
        filePath,
        digester,
        String.format(
            "Dependency '%s' of digester '%s' is not ready (status: %s)",
            dependency,
            digester,
            dependencyStatus == null ? "missing" : dependencyStatus.name().toLowerCase()),
        "Waiting for another step to finish");
    this.dependency = dependency;
    this.dependencyStatus = dependencyStatus;
  }

  public String getDependency() {
    return dependency;
  }

  /** Returns the observed status of the dependency, or null when it has no record. */
  public DigestStatus getDependencyStatus() {
    return dependencyStatus;
  }
}

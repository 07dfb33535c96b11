package io.intellixity.discover.server.service;

/** The requested feature is not enabled for the organization. Reported as not found. */
public final class FeatureDisabledException extends RuntimeException {
  public FeatureDisabledException(String organization, String feature) {
    super("Feature " + feature + " is not enabled for organization " + organization);
  }
}

package io.intellixity.discover.server.service;

/** Per-organization feature flags. */
@FunctionalInterface
public interface FeatureGate {
  String DISCOVER = "discover";

  boolean isEnabled(String organization, String feature);
}

package io.intellixity.discover.validate;

import java.util.Set;

/**
 * Hook invoked with the requested project ids as soon as they are well formed.
 * <p>
 * Implementations deny by throwing; the exception propagates immediately and short-circuits the
 * remaining field validation.
 */
@FunctionalInterface
public interface ProjectAccessCheck {
  void check(Set<Long> requestedProjects);

  ProjectAccessCheck ALLOW_ALL = projects -> {};
}

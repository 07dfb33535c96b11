package io.intellixity.discover.governance;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup of organizations, members, teams and projects.
 * <p>
 * Backed by the application's persistence layer; this module only reads it.
 */
public interface OrganizationDirectory {

  /** Projects of the organization currently visible (not pending deletion). */
  List<ProjectRef> visibleProjects(String organization);

  /** Membership of {@code member} in the organization, if any. */
  Optional<Membership> membership(String organization, String member);

  /** Ids of projects owned by any of the given teams of the organization. */
  Set<Long> teamProjects(String organization, Set<String> teams);

  record ProjectRef(long id, String slug) {}

  record Membership(MemberRole role, Set<String> teams) {
    public Membership {
      role = role == null ? MemberRole.MEMBER : role;
      teams = Set.copyOf(teams == null ? Set.of() : teams);
    }
  }
}

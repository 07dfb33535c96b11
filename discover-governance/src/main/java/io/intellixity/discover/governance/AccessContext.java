package io.intellixity.discover.governance;

import java.util.*;

/**
 * Per-request view of what a member may query inside one organization.
 * <p>
 * Built once per request (see {@link AccessContextResolver}) and read-only afterwards.
 *
 * @param organization   organization slug
 * @param member         member identity
 * @param role           member role in the organization
 * @param visibleProjects the organization's visible projects, id to slug
 * @param teamProjects   project ids reachable through the member's teams
 */
public record AccessContext(String organization,
                            String member,
                            MemberRole role,
                            Map<Long, String> visibleProjects,
                            Set<Long> teamProjects) {
  public AccessContext {
    Objects.requireNonNull(organization, "organization");
    Objects.requireNonNull(member, "member");
    Objects.requireNonNull(role, "role");
    visibleProjects = Collections.unmodifiableMap(new LinkedHashMap<>(visibleProjects == null ? Map.of() : visibleProjects));
    teamProjects = Set.copyOf(teamProjects == null ? Set.of() : teamProjects);
  }

  /** Slug of a visible project, or null. */
  public String projectSlug(Long projectId) {
    return visibleProjects.get(projectId);
  }
}

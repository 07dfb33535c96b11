package io.intellixity.discover.governance;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Organization role of a member. Global-access roles see every visible project of the organization;
 * other roles see only projects reachable through their teams.
 */
public record MemberRole(String id, boolean globalAccess) {
  public static final MemberRole MEMBER = new MemberRole("member", false);
  public static final MemberRole ADMIN = new MemberRole("admin", true);
  public static final MemberRole MANAGER = new MemberRole("manager", true);
  public static final MemberRole OWNER = new MemberRole("owner", true);

  private static final Map<String, MemberRole> KNOWN = Map.of(
      MEMBER.id, MEMBER,
      ADMIN.id, ADMIN,
      MANAGER.id, MANAGER,
      OWNER.id, OWNER
  );

  public MemberRole {
    Objects.requireNonNull(id, "id");
  }

  /** Known role by id; unknown ids resolve to a project-scoped role of that name. */
  public static MemberRole of(String id) {
    if (id == null || id.isBlank()) return MEMBER;
    String key = id.trim().toLowerCase(Locale.ROOT);
    MemberRole known = KNOWN.get(key);
    return known != null ? known : new MemberRole(key, false);
  }
}

package io.intellixity.discover.governance;

import io.intellixity.discover.governance.internal.ExpiringLruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Cache-backed resolver turning (organization, member) into an {@link AccessContext}.
 * <p>
 * Contexts are cached LRU with expire-after-write; freshness of role and team changes is bounded by the TTL.
 * Non-members are not cached.
 */
public final class AccessContextResolver {
  private static final Logger log = LoggerFactory.getLogger(AccessContextResolver.class);

  private final OrganizationDirectory directory;
  private final ExpiringLruCache<Key, AccessContext> contexts;

  public AccessContextResolver(OrganizationDirectory directory, int maxEntries, long ttlMillis) {
    this(directory, maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public AccessContextResolver(OrganizationDirectory directory, int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.contexts = new ExpiringLruCache<>(maxEntries, ttlMillis, nowMillis);
  }

  /**
   * @throws AccessDeniedException when the member does not belong to the organization
   */
  public AccessContext resolve(String organization, String member) {
    Objects.requireNonNull(organization, "organization");
    Objects.requireNonNull(member, "member");
    AccessContext ctx = contexts.computeIfAbsent(new Key(organization, member), k -> load(organization, member));
    if (ctx == null) throw new AccessDeniedException();
    return ctx;
  }

  /** Drops the cached context of a member, e.g. after a role or team change. */
  public void invalidate(String organization, String member) {
    contexts.remove(new Key(organization, member));
  }

  private AccessContext load(String organization, String member) {
    OrganizationDirectory.Membership m = directory.membership(organization, member).orElse(null);
    if (m == null) {
      log.debug("discover.access no_membership org={} member={}", organization, member);
      return null;
    }
    Map<Long, String> visible = new LinkedHashMap<>();
    for (OrganizationDirectory.ProjectRef p : directory.visibleProjects(organization)) {
      visible.put(p.id(), p.slug());
    }
    Set<Long> teamProjects = m.role().globalAccess() ? Set.of() : directory.teamProjects(organization, m.teams());
    log.debug("discover.access loaded org={} member={} role={} visible={} teamProjects={}",
        organization, member, m.role().id(), visible.size(), teamProjects.size());
    return new AccessContext(organization, member, m.role(), visible, teamProjects);
  }

  private record Key(String organization, String member) {}
}

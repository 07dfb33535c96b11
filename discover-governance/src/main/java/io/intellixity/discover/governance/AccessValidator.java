package io.intellixity.discover.governance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/** Decides whether a member may query a set of projects. Pure function of its inputs. */
public final class AccessValidator {
  private static final Logger log = LoggerFactory.getLogger(AccessValidator.class);

  /**
   * Requested projects must all be visible in the organization and, for project-scoped roles, all be
   * reachable through the member's teams. Any miss denies the whole request; the set is never narrowed.
   */
  public void validate(AccessContext ctx, Collection<Long> requestedProjects) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(requestedProjects, "requestedProjects");

    if (!ctx.visibleProjects().keySet().containsAll(requestedProjects)) {
      deny(ctx, "not_visible");
    }
    if (ctx.role().globalAccess()) return;
    if (!ctx.teamProjects().containsAll(requestedProjects)) {
      deny(ctx, "not_in_team");
    }
  }

  private static void deny(AccessContext ctx, String reason) {
    if (log.isDebugEnabled()) {
      log.debug("discover.access denied org={} member={} role={} reason={}",
          ctx.organization(), ctx.member(), ctx.role().id(), reason);
    }
    throw new AccessDeniedException();
  }
}

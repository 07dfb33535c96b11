package io.intellixity.discover.governance;

/**
 * The member may not query the requested projects, or is not a member of the organization.
 * <p>
 * The message never names the offending project.
 */
public final class AccessDeniedException extends RuntimeException {
  public AccessDeniedException() {
    super("You do not have permission to perform this action.");
  }
}

package io.worktrack.backend.security;

import io.worktrack.backend.exception.PermissionDeniedException;

/** Role checks shared by the services. Throws {@link PermissionDeniedException} on failure. */
public final class AccessGuard {

  private AccessGuard() {}

  public static void requireManagerOrAdmin(ActingUser actor, String action) {
    if (!actor.isManagerOrAdmin()) {
      throw new PermissionDeniedException(
          "Only managers and admins can " + action + " (role: " + actor.role() + ")");
    }
  }

  public static void requireAdmin(ActingUser actor, String action) {
    if (!actor.isAdmin()) {
      throw new PermissionDeniedException(
          "Only admins can " + action + " (role: " + actor.role() + ")");
    }
  }
}

package io.worktrack.backend.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of the caller performing an operation, supplied by the identity collaborator.
 *
 * @param userId the acting user's account ID (recorded as created_by/updated_by/verified_by)
 * @param role one of {@link Roles#ADMIN}, {@link Roles#MANAGER}, {@link Roles#TECHNICIAN}
 * @param technicianId the technician record linked to this account; null for office staff
 */
public record ActingUser(UUID userId, String role, UUID technicianId) {

  public ActingUser {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(role, "role");
  }

  public static ActingUser admin(UUID userId) {
    return new ActingUser(userId, Roles.ADMIN, null);
  }

  public static ActingUser manager(UUID userId) {
    return new ActingUser(userId, Roles.MANAGER, null);
  }

  public static ActingUser technician(UUID userId, UUID technicianId) {
    return new ActingUser(userId, Roles.TECHNICIAN, technicianId);
  }

  public boolean isAdmin() {
    return Roles.ADMIN.equals(role);
  }

  /** Managers and admins share the supervisory permissions (verify, reject, assign). */
  public boolean isManagerOrAdmin() {
    return Roles.ADMIN.equals(role) || Roles.MANAGER.equals(role);
  }

  /** Returns true if this user is the technician identified by {@code technicianId}. */
  public boolean isTechnician(UUID technicianId) {
    return this.technicianId != null && this.technicianId.equals(technicianId);
  }
}

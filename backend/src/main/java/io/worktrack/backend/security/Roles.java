package io.worktrack.backend.security;

/**
 * Centralized role constants used for authorization checks across the lifecycle and payroll
 * services.
 *
 * <p>Roles are issued by the external identity provider and arrive on every call as part of the
 * {@link ActingUser}. Managers and admins may verify, reject and assign; technicians act on their
 * own entries only.
 */
public final class Roles {

  public static final String ADMIN = "admin";
  public static final String MANAGER = "manager";
  public static final String TECHNICIAN = "technician";

  private Roles() {}
}

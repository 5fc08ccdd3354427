package io.tenderbridge.backend.security;

import java.util.UUID;

/**
 * The user on whose behalf an operation runs. {@code companyId} is null for users without a company
 * affiliation; {@code userId} is null only for {@link #system()}.
 */
public record Actor(UUID userId, UUID companyId, String role) {

  private static final Actor SYSTEM = new Actor(null, null, Roles.SYSTEM);

  public static Actor system() {
    return SYSTEM;
  }

  public boolean isSystem() {
    return Roles.SYSTEM.equals(role);
  }

  public boolean isAdmin() {
    return Roles.ADMIN.equals(role);
  }

  public boolean hasCompany() {
    return companyId != null;
  }

  public boolean hasRoleAtLeast(String required) {
    return Roles.level(role) >= Roles.level(required);
  }

  /** "USER" for people, "SYSTEM" for scheduled jobs; used in event payloads. */
  public String actorType() {
    return isSystem() ? "SYSTEM" : "USER";
  }
}

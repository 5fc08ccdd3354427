package io.tenderbridge.backend.security;

import java.util.Map;

/** Role names carried in the JWT {@code role} claim, ordered by privilege level. */
public final class Roles {

  public static final String ADMIN = "admin";
  public static final String COMPANY_ADMIN = "company_admin";
  public static final String TENDER_MANAGER = "tender_manager";
  public static final String EVALUATOR = "evaluator";
  public static final String USER = "user";

  /** Pseudo-role for scheduler-initiated changes; never issued in a token. */
  public static final String SYSTEM = "system";

  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";

  static final Map<String, Integer> LEVELS =
      Map.of(ADMIN, 100, COMPANY_ADMIN, 80, TENDER_MANAGER, 60, EVALUATOR, 40, USER, 20);

  private Roles() {}

  public static int level(String role) {
    return role == null ? 0 : LEVELS.getOrDefault(role, 0);
  }
}

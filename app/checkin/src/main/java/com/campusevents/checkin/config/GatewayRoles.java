package com.campusevents.checkin.config;

import java.util.LinkedHashSet;
import java.util.Set;

/** ゲートウェイが転送する X-User-Roles (カンマ区切り) の解釈。 */
public final class GatewayRoles {

  public static final String STAFF = "STAFF";
  public static final String ADMIN = "ADMIN";
  private static final String ROLE_PREFIX = "ROLE_";

  private GatewayRoles() {}

  /** 既知のロールだけを返す。未知の値は無視する。 */
  public static Set<String> parse(String forwardedRoles) {
    final Set<String> roles = new LinkedHashSet<>();
    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return roles;
    }
    for (String role : forwardedRoles.split(",")) {
      String normalized = role.trim();
      if (normalized.startsWith(ROLE_PREFIX)) {
        normalized = normalized.substring(ROLE_PREFIX.length());
      }
      if (STAFF.equals(normalized) || ADMIN.equals(normalized)) {
        roles.add(normalized);
      }
    }
    return roles;
  }

  public static boolean isAdmin(String forwardedRoles) {
    return parse(forwardedRoles).contains(ADMIN);
  }
}

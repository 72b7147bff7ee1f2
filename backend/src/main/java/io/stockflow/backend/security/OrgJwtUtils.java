package io.stockflow.backend.security;

import java.util.Map;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads organization claims from the nested {@code o} object: {@code { "o": { "id": "org_xxx",
 * "rol": "admin" } }}.
 */
public final class OrgJwtUtils {

  private static final String ORG_CLAIM = "o";

  public static String extractOrgId(Jwt jwt) {
    return extractNestedClaim(jwt, "id");
  }

  public static String extractOrgRole(Jwt jwt) {
    return extractNestedClaim(jwt, "rol");
  }

  private static String extractNestedClaim(Jwt jwt, String key) {
    Object orgClaim = jwt.getClaim(ORG_CLAIM);
    if (orgClaim instanceof Map<?, ?> map && map.get(key) instanceof String value) {
      return value;
    }
    return null;
  }

  private OrgJwtUtils() {}
}

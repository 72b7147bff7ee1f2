package io.stockflow.backend.security;

/**
 * Role constants shared by authentication and {@code @PreAuthorize} expressions.
 *
 * <p>Org roles come from the {@code o.rol} token claim. Spring authorities are the {@code ROLE_}
 * prefixed versions.
 */
public final class Roles {

  // Org-level roles ("o.rol" values)
  public static final String SUPER_ADMIN = "super_admin";
  public static final String ADMIN = "admin";
  public static final String MANAGER = "manager";
  public static final String EMPLOYEE = "employee";
  public static final String CONTADOR = "contador";

  // Spring Security granted authorities
  public static final String AUTHORITY_SUPER_ADMIN = "ROLE_SUPER_ADMIN";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_MANAGER = "ROLE_MANAGER";
  public static final String AUTHORITY_EMPLOYEE = "ROLE_EMPLOYEE";
  public static final String AUTHORITY_CONTADOR = "ROLE_CONTADOR";
  public static final String AUTHORITY_INTERNAL = "ROLE_INTERNAL_SERVICE";

  private Roles() {}
}

package io.stockflow.backend.multitenancy;

import io.stockflow.backend.exception.MissingTenantContextException;
import java.util.UUID;

/**
 * Per-request tenant identity. Bound by {@link TenantFilter} for the duration of the filter chain
 * and cleared when the request completes.
 */
public final class RequestScopes {

  private static final ThreadLocal<UUID> TENANT_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> ORG_ID = new ThreadLocal<>();

  /** Returns the tenant id. Throws if no tenant is bound to the current request. */
  public static UUID requireTenantId() {
    UUID tenantId = TENANT_ID.get();
    if (tenantId == null) {
      throw new MissingTenantContextException();
    }
    return tenantId;
  }

  public static UUID getTenantIdOrNull() {
    return TENANT_ID.get();
  }

  /** Returns the external organization id from the token, or null if not bound. */
  public static String getOrgIdOrNull() {
    return ORG_ID.get();
  }

  static void bind(UUID tenantId, String orgId) {
    TENANT_ID.set(tenantId);
    ORG_ID.set(orgId);
  }

  static void clear() {
    TENANT_ID.remove();
    ORG_ID.remove();
  }

  private RequestScopes() {}
}

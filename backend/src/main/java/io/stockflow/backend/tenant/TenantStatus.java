package io.stockflow.backend.tenant;

/** Operational status of a tenant. SUSPENDED tenants keep their data but lose write access. */
public enum TenantStatus {
  ACTIVE,
  SUSPENDED
}

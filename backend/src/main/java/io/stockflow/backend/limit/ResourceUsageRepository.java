package io.stockflow.backend.limit;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Count queries over the tables owned by the inventory, invoicing and HR modules. Those modules
 * map their own entities; billing only needs the counts.
 */
@Repository
public class ResourceUsageRepository {

  private final JdbcClient jdbc;

  public ResourceUsageRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  /** Non-deactivated users, either accountants only or everyone else. */
  public long countUsers(UUID tenantId, boolean accountants) {
    return jdbc.sql(
            """
            SELECT COUNT(*) FROM users
            WHERE tenant_id = ?
              AND status <> 'INACTIVE'
              AND (role = 'CONTADOR') = ?
            """)
        .params(tenantId, accountants)
        .query(Long.class)
        .single();
  }

  /** Invitations that will consume a seat once accepted. */
  public long countPendingInvitations(UUID tenantId, boolean accountants) {
    return jdbc.sql(
            """
            SELECT COUNT(*) FROM invitations
            WHERE tenant_id = ?
              AND status = 'PENDING'
              AND (role = 'CONTADOR') = ?
            """)
        .params(tenantId, accountants)
        .query(Long.class)
        .single();
  }

  public long countProducts(UUID tenantId) {
    return countByTenant("products", tenantId);
  }

  public long countWarehouses(UUID tenantId) {
    return countByTenant("warehouses", tenantId);
  }

  public long countEmployees(UUID tenantId) {
    return countByTenant("employees", tenantId);
  }

  public long countInvoicesSince(UUID tenantId, Instant since) {
    return jdbc.sql("SELECT COUNT(*) FROM invoices WHERE tenant_id = ? AND created_at >= ?")
        .params(tenantId, Timestamp.from(since))
        .query(Long.class)
        .single();
  }

  private long countByTenant(String table, UUID tenantId) {
    return jdbc.sql("SELECT COUNT(*) FROM " + table + " WHERE tenant_id = ?")
        .param(tenantId)
        .query(Long.class)
        .single();
  }
}

package io.stockflow.backend.limit;

import io.stockflow.backend.exception.PlanLimitExceededException;
import io.stockflow.backend.exception.ResourceNotFoundException;
import io.stockflow.backend.plan.PlanCatalog;
import io.stockflow.backend.plan.PlanLimits;
import io.stockflow.backend.tenant.Tenant;
import io.stockflow.backend.tenant.TenantRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compares a tenant's current usage with its plan quota. The check is a plain read: two concurrent
 * creators can both pass it and leave the tenant one unit over quota.
 */
@Service
public class LimitEnforcementService {

  private static final Logger log = LoggerFactory.getLogger(LimitEnforcementService.class);

  private final TenantRepository tenantRepository;
  private final ResourceUsageRepository usageRepository;
  private final Clock clock;

  public LimitEnforcementService(
      TenantRepository tenantRepository, ResourceUsageRepository usageRepository, Clock clock) {
    this.tenantRepository = tenantRepository;
    this.usageRepository = usageRepository;
    this.clock = clock;
  }

  /**
   * @throws PlanLimitExceededException when {@code current >= limit} and the limit is not
   *     unlimited
   */
  @Transactional(readOnly = true)
  public void checkLimit(UUID tenantId, LimitType type) {
    Tenant tenant = requireTenant(tenantId);
    int limit = limitOf(tenant, type);
    if (PlanLimits.isUnlimited(limit)) {
      log.debug("Unlimited {} for tenant {}, allowing request", type.resource(), tenantId);
      return;
    }
    long current = currentCount(tenantId, type);
    log.debug("Checking {} limit for tenant {}: {}/{}", type.resource(), tenantId, current, limit);
    if (current >= limit) {
      log.info("{} limit reached for tenant {} ({}/{})", type.resource(), tenantId, current, limit);
      throw new PlanLimitExceededException(type.resource(), current, limit);
    }
  }

  /** Current usage and quota for every limit type. */
  @Transactional(readOnly = true)
  public Map<LimitType, LimitUsage> getUsageSummary(UUID tenantId) {
    Tenant tenant = requireTenant(tenantId);
    var summary = new EnumMap<LimitType, LimitUsage>(LimitType.class);
    for (LimitType type : LimitType.values()) {
      int limit = limitOf(tenant, type);
      long current = currentCount(tenantId, type);
      long remaining =
          PlanLimits.isUnlimited(limit) ? PlanLimits.UNLIMITED : Math.max(0, limit - current);
      summary.put(type, new LimitUsage(current, limit, remaining));
    }
    return summary;
  }

  /** The quota for {@code type}; accountant seats come from the catalog, not the tenant row. */
  static int limitOf(Tenant tenant, LimitType type) {
    return switch (type) {
      case USERS -> {
        if (tenant.getPlan() == null || PlanLimits.isUnlimited(tenant.getMaxUsers())) {
          yield tenant.getMaxUsers();
        }
        yield tenant.getMaxUsers() - PlanCatalog.limitsOf(tenant.getPlan()).maxContadores();
      }
      case PRODUCTS -> tenant.getMaxProducts();
      case INVOICES -> tenant.getMaxInvoices();
      case WAREHOUSES -> tenant.getMaxWarehouses();
      case CONTADORES ->
          tenant.getPlan() == null ? 0 : PlanCatalog.limitsOf(tenant.getPlan()).maxContadores();
      case EMPLOYEES -> tenant.getMaxEmployees();
    };
  }

  private long currentCount(UUID tenantId, LimitType type) {
    return switch (type) {
      case USERS ->
          usageRepository.countUsers(tenantId, false)
              + usageRepository.countPendingInvitations(tenantId, false);
      case CONTADORES ->
          usageRepository.countUsers(tenantId, true)
              + usageRepository.countPendingInvitations(tenantId, true);
      case PRODUCTS -> usageRepository.countProducts(tenantId);
      case INVOICES -> usageRepository.countInvoicesSince(tenantId, startOfMonth());
      case WAREHOUSES -> usageRepository.countWarehouses(tenantId);
      case EMPLOYEES -> usageRepository.countEmployees(tenantId);
    };
  }

  private Instant startOfMonth() {
    return LocalDate.now(clock.withZone(ZoneOffset.UTC))
        .withDayOfMonth(1)
        .atStartOfDay(ZoneOffset.UTC)
        .toInstant();
  }

  private Tenant requireTenant(UUID tenantId) {
    return tenantRepository
        .findById(tenantId)
        .orElseThrow(() -> ResourceNotFoundException.tenant(tenantId));
  }

  public record LimitUsage(long current, int limit, long remaining) {}
}

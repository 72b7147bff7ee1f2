package io.stockflow.backend.billing;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import io.stockflow.backend.tenant.Tenant;
import io.stockflow.backend.tenant.TenantRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Operator listings across all tenants. */
@Service
public class SubscriptionAdminService {

  private final SubscriptionRepository subscriptionRepository;
  private final TenantRepository tenantRepository;
  private final Clock clock;

  public SubscriptionAdminService(
      SubscriptionRepository subscriptionRepository,
      TenantRepository tenantRepository,
      Clock clock) {
    this.subscriptionRepository = subscriptionRepository;
    this.tenantRepository = tenantRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<SubscriptionSummary> getSubscriptions(SubscriptionStatus status) {
    var subscriptions =
        status == null
            ? subscriptionRepository.findAllByOrderByEndDateAsc()
            : subscriptionRepository.findByStatusOrderByEndDateAsc(status);
    return summarize(subscriptions);
  }

  /** ACTIVE subscriptions ending between now and {@code days} days from now. */
  @Transactional(readOnly = true)
  public List<SubscriptionSummary> getExpiringSubscriptions(int days) {
    Instant now = clock.instant();
    return summarize(
        subscriptionRepository.findByStatusAndEndDateBetween(
            SubscriptionStatus.ACTIVE, now, now.plus(Duration.ofDays(days))));
  }

  private List<SubscriptionSummary> summarize(List<Subscription> subscriptions) {
    var tenantIds = subscriptions.stream().map(Subscription::getTenantId).distinct().toList();
    Map<UUID, Tenant> tenants =
        tenantRepository.findAllById(tenantIds).stream()
            .collect(Collectors.toMap(Tenant::getId, Function.identity()));
    return subscriptions.stream()
        .map(s -> SubscriptionSummary.from(s, tenants.get(s.getTenantId())))
        .toList();
  }

  public record SubscriptionSummary(
      UUID subscriptionId,
      UUID tenantId,
      String tenantName,
      SubscriptionPlan plan,
      SubscriptionStatus status,
      SubscriptionPeriod periodType,
      Instant startDate,
      Instant endDate,
      boolean hasPaymentSource) {

    static SubscriptionSummary from(Subscription subscription, Tenant tenant) {
      return new SubscriptionSummary(
          subscription.getId(),
          subscription.getTenantId(),
          tenant != null ? tenant.getName() : null,
          subscription.getPlan(),
          subscription.getStatus(),
          subscription.getPeriodType(),
          subscription.getStartDate(),
          subscription.getEndDate(),
          tenant != null && tenant.hasPaymentSource());
    }
  }
}

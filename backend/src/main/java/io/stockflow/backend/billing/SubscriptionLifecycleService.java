package io.stockflow.backend.billing;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.event.SubscriptionActivatedEvent;
import io.stockflow.backend.event.SubscriptionExpiredEvent;
import io.stockflow.backend.event.SubscriptionPlanChangedEvent;
import io.stockflow.backend.event.SubscriptionSuspendedEvent;
import io.stockflow.backend.exception.InvalidStateException;
import io.stockflow.backend.exception.ResourceNotFoundException;
import io.stockflow.backend.plan.PlanCatalog;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import io.stockflow.backend.tenant.Tenant;
import io.stockflow.backend.tenant.TenantRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Subscription state machine. Each transition updates the subscription and the tenant's plan,
 * quotas and operational status in one transaction, then publishes an event that the notification
 * layer handles after commit.
 *
 * <pre>
 *   (none) --activate--> ACTIVE --suspend--> SUSPENDED --reactivate--> ACTIVE
 *   ACTIVE --extend / changePlan--> ACTIVE
 *   ACTIVE --expire--> EXPIRED
 *   any --activate--> ACTIVE
 * </pre>
 */
@Service
public class SubscriptionLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionLifecycleService.class);

  private final SubscriptionRepository subscriptionRepository;
  private final TenantRepository tenantRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public SubscriptionLifecycleService(
      SubscriptionRepository subscriptionRepository,
      TenantRepository tenantRepository,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.subscriptionRepository = subscriptionRepository;
    this.tenantRepository = tenantRepository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Starts a new period on {@code plan} from now, creating the subscription if the tenant has none.
   * Allowed from every state, including SUSPENDED and EXPIRED.
   */
  @Transactional
  public Subscription activate(UUID tenantId, SubscriptionPlan plan, SubscriptionPeriod period) {
    Tenant tenant = requireTenant(tenantId);
    Instant now = clock.instant();

    var subscription =
        subscriptionRepository
            .findByTenantId(tenantId)
            .map(
                existing -> {
                  existing.start(plan, period, now);
                  return existing;
                })
            .orElseGet(() -> new Subscription(tenantId, plan, period, now));
    subscription = subscriptionRepository.save(subscription);

    tenant.applyPlan(plan, PlanCatalog.limitsOf(plan));
    tenant.activate();
    tenantRepository.save(tenant);

    log.info(
        "Activated plan {} ({}) for tenant {} until {}",
        plan,
        period,
        tenantId,
        subscription.getEndDate());
    eventPublisher.publishEvent(
        new SubscriptionActivatedEvent(
            tenantId,
            subscription.getId(),
            plan,
            period,
            subscription.getEndDate(),
            false,
            now));
    return subscription;
  }

  /**
   * Renews an ACTIVE subscription by one period. The new end date is {@code max(endDate, now) +
   * periodDays}.
   */
  @Transactional
  public Subscription extend(UUID tenantId, SubscriptionPeriod period) {
    var subscription = requireSubscription(tenantId);
    if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
      throw InvalidStateException.subscriptionNotActive("Renewal", subscription.getStatus());
    }
    Instant now = clock.instant();
    Instant previousEnd = subscription.getEndDate();
    subscription.extend(period, now);
    subscription = subscriptionRepository.save(subscription);

    log.info(
        "Extended subscription {} for tenant {} by {}: {} -> {}",
        subscription.getId(),
        tenantId,
        period,
        previousEnd,
        subscription.getEndDate());
    eventPublisher.publishEvent(
        new SubscriptionActivatedEvent(
            tenantId,
            subscription.getId(),
            subscription.getPlan(),
            period,
            subscription.getEndDate(),
            true,
            now));
    return subscription;
  }

  /** ACTIVE to SUSPENDED. Suspending twice is an error so double suspensions surface. */
  @Transactional
  public Subscription suspend(UUID tenantId, String reason) {
    var subscription = requireSubscription(tenantId);
    switch (subscription.getStatus()) {
      case SUSPENDED ->
          throw new InvalidStateException(
              "Subscription already suspended",
              "Subscription for tenant " + tenantId + " is already suspended");
      case EXPIRED ->
          throw new InvalidStateException(
              "Subscription expired",
              "Subscription for tenant " + tenantId + " has expired and cannot be suspended");
      case ACTIVE -> {}
    }
    Tenant tenant = requireTenant(tenantId);
    Instant now = clock.instant();

    subscription.suspend(reason, now);
    subscription = subscriptionRepository.save(subscription);
    tenant.suspend();
    tenantRepository.save(tenant);

    log.info("Suspended subscription for tenant {}: {}", tenantId, reason);
    eventPublisher.publishEvent(
        new SubscriptionSuspendedEvent(
            tenantId, subscription.getId(), subscription.getPlan(), reason, now));
    return subscription;
  }

  /** SUSPENDED to ACTIVE, only while the paid period has not ended. */
  @Transactional
  public Subscription reactivate(UUID tenantId) {
    var subscription = requireSubscription(tenantId);
    if (subscription.getStatus() != SubscriptionStatus.SUSPENDED) {
      throw new InvalidStateException(
          "Subscription not suspended",
          "Only suspended subscriptions can be reactivated (current status: "
              + subscription.getStatus()
              + ")");
    }
    Instant now = clock.instant();
    if (subscription.hasLapsed(now)) {
      throw new InvalidStateException(
          "Subscription expired",
          "Subscription ended on "
              + subscription.getEndDate()
              + "; activate a new plan instead of reactivating");
    }
    Tenant tenant = requireTenant(tenantId);

    subscription.reactivate(now);
    subscription = subscriptionRepository.save(subscription);
    tenant.activate();
    tenantRepository.save(tenant);

    log.info("Reactivated subscription for tenant {}", tenantId);
    return subscription;
  }

  /** Moves an ACTIVE subscription to another plan. The billing period is left untouched. */
  @Transactional
  public Subscription changePlan(UUID tenantId, SubscriptionPlan newPlan) {
    var subscription = requireSubscription(tenantId);
    if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
      throw InvalidStateException.subscriptionNotActive("Plan change", subscription.getStatus());
    }
    Tenant tenant = requireTenant(tenantId);
    Instant now = clock.instant();
    SubscriptionPlan previousPlan = subscription.getPlan();

    subscription.changePlan(newPlan, now);
    subscription = subscriptionRepository.save(subscription);
    tenant.applyPlan(newPlan, PlanCatalog.limitsOf(newPlan));
    tenantRepository.save(tenant);

    log.info("Changed plan for tenant {}: {} -> {}", tenantId, previousPlan, newPlan);
    eventPublisher.publishEvent(
        new SubscriptionPlanChangedEvent(
            tenantId, subscription.getId(), previousPlan, newPlan, now));
    return subscription;
  }

  /**
   * ACTIVE to EXPIRED for a subscription whose end date has passed, suspending the tenant. Returns
   * false when the subscription no longer qualifies, e.g. it was renewed since it was selected.
   */
  @Transactional
  public boolean expire(UUID subscriptionId) {
    var subscription =
        subscriptionRepository
            .findById(subscriptionId)
            .orElseThrow(() -> new ResourceNotFoundException("Subscription", subscriptionId));
    Instant now = clock.instant();
    if (subscription.getStatus() != SubscriptionStatus.ACTIVE || !subscription.hasLapsed(now)) {
      log.debug(
          "Subscription {} no longer eligible for expiry (status={}, endDate={})",
          subscriptionId,
          subscription.getStatus(),
          subscription.getEndDate());
      return false;
    }
    Tenant tenant = requireTenant(subscription.getTenantId());

    subscription.expire(now);
    subscriptionRepository.save(subscription);
    tenant.suspend();
    tenantRepository.save(tenant);

    log.info(
        "Expired subscription {} for tenant {} (ended {})",
        subscriptionId,
        subscription.getTenantId(),
        subscription.getEndDate());
    eventPublisher.publishEvent(
        new SubscriptionExpiredEvent(
            subscription.getTenantId(),
            subscriptionId,
            subscription.getPlan(),
            subscription.getEndDate(),
            now));
    return true;
  }

  private Tenant requireTenant(UUID tenantId) {
    return tenantRepository
        .findById(tenantId)
        .orElseThrow(() -> ResourceNotFoundException.tenant(tenantId));
  }

  private Subscription requireSubscription(UUID tenantId) {
    return subscriptionRepository
        .findByTenantId(tenantId)
        .orElseThrow(() -> ResourceNotFoundException.subscriptionForTenant(tenantId));
  }
}

package io.stockflow.backend.billing;

import io.stockflow.backend.plan.PlanCatalog;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One per tenant. {@code endDate} is the single source of truth for expiry and is only ever set to
 * a start instant plus {@link PlanCatalog#periodDays(SubscriptionPeriod)}. Mutators do not check
 * preconditions; {@link SubscriptionLifecycleService} owns the transition rules.
 */
@Entity
@Table(name = "subscriptions")
public class Subscription {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, unique = true)
  private UUID tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "plan", nullable = false, length = 20)
  private SubscriptionPlan plan;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SubscriptionStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "period_type", nullable = false, length = 20)
  private SubscriptionPeriod periodType;

  @Column(name = "start_date", nullable = false)
  private Instant startDate;

  @Column(name = "end_date", nullable = false)
  private Instant endDate;

  @Column(name = "suspended_at")
  private Instant suspendedAt;

  @Column(name = "suspended_reason", length = 500)
  private String suspendedReason;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Subscription() {}

  public Subscription(
      UUID tenantId, SubscriptionPlan plan, SubscriptionPeriod periodType, Instant now) {
    this.tenantId = tenantId;
    this.createdAt = now;
    start(plan, periodType, now);
  }

  /** Starts a fresh period at {@code now}, whatever the previous state was. */
  public void start(SubscriptionPlan plan, SubscriptionPeriod periodType, Instant now) {
    this.plan = plan;
    this.periodType = periodType;
    this.status = SubscriptionStatus.ACTIVE;
    this.startDate = now;
    this.endDate = now.plus(periodLength(periodType));
    this.suspendedAt = null;
    this.suspendedReason = null;
    this.updatedAt = now;
  }

  /**
   * Adds one period. A lapsed subscription restarts from {@code now} instead of compounding on its
   * stale end date.
   */
  public void extend(SubscriptionPeriod periodType, Instant now) {
    Instant base = endDate.isAfter(now) ? endDate : now;
    this.periodType = periodType;
    this.endDate = base.plus(periodLength(periodType));
    this.status = SubscriptionStatus.ACTIVE;
    this.updatedAt = now;
  }

  public void suspend(String reason, Instant now) {
    this.status = SubscriptionStatus.SUSPENDED;
    this.suspendedAt = now;
    this.suspendedReason = reason;
    this.updatedAt = now;
  }

  public void reactivate(Instant now) {
    this.status = SubscriptionStatus.ACTIVE;
    this.suspendedAt = null;
    this.suspendedReason = null;
    this.updatedAt = now;
  }

  public void changePlan(SubscriptionPlan plan, Instant now) {
    this.plan = plan;
    this.updatedAt = now;
  }

  public void expire(Instant now) {
    this.status = SubscriptionStatus.EXPIRED;
    this.updatedAt = now;
  }

  public boolean hasLapsed(Instant now) {
    return endDate.isBefore(now);
  }

  private static Duration periodLength(SubscriptionPeriod periodType) {
    return Duration.ofDays(PlanCatalog.periodDays(periodType));
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public SubscriptionPlan getPlan() {
    return plan;
  }

  public SubscriptionStatus getStatus() {
    return status;
  }

  public SubscriptionPeriod getPeriodType() {
    return periodType;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getEndDate() {
    return endDate;
  }

  public Instant getSuspendedAt() {
    return suspendedAt;
  }

  public String getSuspendedReason() {
    return suspendedReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public enum SubscriptionStatus {
    ACTIVE,
    SUSPENDED,
    EXPIRED
  }
}

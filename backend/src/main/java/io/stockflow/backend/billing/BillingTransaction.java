package io.stockflow.backend.billing;

import io.stockflow.backend.integration.payment.GatewayTransaction;
import io.stockflow.backend.integration.payment.PaymentStatus;
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
import java.time.Instant;
import java.util.UUID;

/**
 * Ledger row for one charge attempt. Once APPROVED the row only accepts the subscription link
 * written by {@link #markApplied(UUID, Instant)}; later gateway reports cannot move it out of
 * APPROVED.
 */
@Entity
@Table(name = "billing_transactions")
public class BillingTransaction {

  private static final int MAX_REASON_LENGTH = 1000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "gateway_transaction_id", unique = true)
  private String gatewayTransactionId;

  @Column(name = "reference", nullable = false)
  private String reference;

  @Column(name = "tenant_id", nullable = false)
  private UUID tenantId;

  @Column(name = "subscription_id")
  private UUID subscriptionId;

  @Enumerated(EnumType.STRING)
  @Column(name = "plan", nullable = false, length = 20)
  private SubscriptionPlan plan;

  @Enumerated(EnumType.STRING)
  @Column(name = "period", nullable = false, length = 20)
  private SubscriptionPeriod period;

  @Column(name = "amount_in_cents", nullable = false)
  private long amountInCents;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PaymentStatus status;

  @Column(name = "payment_method_type", length = 50)
  private String paymentMethodType;

  @Column(name = "failure_reason", length = 1000)
  private String failureReason;

  @Column(name = "is_recurring", nullable = false)
  private boolean recurring;

  /** For recurring attempts: the subscription end date this charge renews. */
  @Column(name = "billing_period_end")
  private Instant billingPeriodEnd;

  /** Set once the approval has been turned into an activation or renewal. */
  @Column(name = "applied_at")
  private Instant appliedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BillingTransaction() {}

  private BillingTransaction(
      UUID tenantId,
      UUID subscriptionId,
      SubscriptionPlan plan,
      SubscriptionPeriod period,
      long amountInCents,
      String currency,
      String reference,
      boolean recurring,
      Instant now) {
    this.tenantId = tenantId;
    this.subscriptionId = subscriptionId;
    this.plan = plan;
    this.period = period;
    this.amountInCents = amountInCents;
    this.currency = currency;
    this.reference = reference;
    this.recurring = recurring;
    this.status = PaymentStatus.PENDING;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** A customer-present checkout, recorded as reported by the gateway. */
  public static BillingTransaction checkout(
      UUID tenantId,
      UUID subscriptionId,
      SubscriptionPlan plan,
      SubscriptionPeriod period,
      GatewayTransaction gatewayTransaction,
      Instant now) {
    var row =
        new BillingTransaction(
            tenantId,
            subscriptionId,
            plan,
            period,
            gatewayTransaction.amountInCents(),
            gatewayTransaction.currency(),
            gatewayTransaction.reference(),
            false,
            now);
    row.applyGatewayState(gatewayTransaction, now);
    return row;
  }

  /** A PENDING renewal written before the gateway is called. */
  public static BillingTransaction recurringClaim(
      UUID tenantId,
      UUID subscriptionId,
      SubscriptionPlan plan,
      SubscriptionPeriod period,
      long amountInCents,
      String currency,
      String reference,
      Instant billingPeriodEnd,
      Instant now) {
    var row =
        new BillingTransaction(
            tenantId,
            subscriptionId,
            plan,
            period,
            amountInCents,
            currency,
            reference,
            true,
            now);
    row.billingPeriodEnd = billingPeriodEnd;
    return row;
  }

  /**
   * Merges the gateway's view of the transaction. Returns false without changes when the row is
   * already APPROVED.
   */
  public boolean applyGatewayState(GatewayTransaction gatewayTransaction, Instant now) {
    if (status == PaymentStatus.APPROVED) {
      return false;
    }
    if (gatewayTransactionId == null) {
      this.gatewayTransactionId = gatewayTransaction.id();
    }
    this.status = gatewayTransaction.status();
    if (gatewayTransaction.paymentMethodType() != null) {
      this.paymentMethodType = gatewayTransaction.paymentMethodType();
    }
    this.failureReason =
        gatewayTransaction.status() == PaymentStatus.APPROVED
            ? null
            : abbreviate(gatewayTransaction.statusMessage());
    this.updatedAt = now;
    return true;
  }

  /** Records a failure that produced no gateway report, e.g. a timeout or a refused connection. */
  public void recordFailure(PaymentStatus status, String reason, Instant now) {
    if (this.status == PaymentStatus.APPROVED) {
      return;
    }
    this.status = status;
    this.failureReason = abbreviate(reason);
    this.updatedAt = now;
  }

  /** Links the subscription the approval was applied to and marks the row as applied. */
  public void markApplied(UUID subscriptionId, Instant now) {
    this.subscriptionId = subscriptionId;
    this.appliedAt = now;
    this.updatedAt = now;
  }

  public boolean isApplied() {
    return appliedAt != null;
  }

  public UUID getId() {
    return id;
  }

  public String getGatewayTransactionId() {
    return gatewayTransactionId;
  }

  public String getReference() {
    return reference;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getSubscriptionId() {
    return subscriptionId;
  }

  public SubscriptionPlan getPlan() {
    return plan;
  }

  public SubscriptionPeriod getPeriod() {
    return period;
  }

  public long getAmountInCents() {
    return amountInCents;
  }

  public String getCurrency() {
    return currency;
  }

  public PaymentStatus getStatus() {
    return status;
  }

  public String getPaymentMethodType() {
    return paymentMethodType;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public boolean isRecurring() {
    return recurring;
  }

  public Instant getBillingPeriodEnd() {
    return billingPeriodEnd;
  }

  public Instant getAppliedAt() {
    return appliedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  private static String abbreviate(String reason) {
    return reason == null || reason.length() <= MAX_REASON_LENGTH
        ? reason
        : reason.substring(0, MAX_REASON_LENGTH - 3) + "...";
  }
}

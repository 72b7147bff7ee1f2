package io.stockflow.backend.billing;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.config.BillingConfig.BillingProperties;
import io.stockflow.backend.exception.InvalidStateException;
import io.stockflow.backend.exception.ResourceConflictException;
import io.stockflow.backend.exception.ResourceNotFoundException;
import io.stockflow.backend.integration.payment.CreatePaymentSourceRequest;
import io.stockflow.backend.integration.payment.CreateTransactionRequest;
import io.stockflow.backend.integration.payment.GatewayTransaction;
import io.stockflow.backend.integration.payment.PaymentGateway;
import io.stockflow.backend.integration.payment.PaymentGatewayTimeoutException;
import io.stockflow.backend.integration.payment.PaymentStatus;
import io.stockflow.backend.limit.ResourceUsageRepository;
import io.stockflow.backend.plan.PlanCatalog;
import io.stockflow.backend.plan.PlanLimits;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import io.stockflow.backend.tenant.Tenant;
import io.stockflow.backend.tenant.TenantRepository;
import io.stockflow.backend.tenant.TenantStatus;
import io.stockflow.backend.user.User;
import io.stockflow.backend.user.UserRepository;
import io.stockflow.backend.user.UserRole;
import io.stockflow.backend.user.UserStatus;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant-facing billing operations: status and plan listings, checkout configuration, payment
 * verification, stored cards and recurring charges. Methods that call the gateway are not
 * transactional; ledger writes and state transitions commit in their own transactions around
 * the remote call.
 */
@Service
public class SubscriptionBillingService {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionBillingService.class);

  private static final Duration ONE_DAY = Duration.ofDays(1);

  private final TenantRepository tenantRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final UserRepository userRepository;
  private final ResourceUsageRepository usageRepository;
  private final BillingLedgerService ledgerService;
  private final PaymentSettlementService settlementService;
  private final PaymentGateway paymentGateway;
  private final BillingProperties billingProperties;
  private final Clock clock;

  public SubscriptionBillingService(
      TenantRepository tenantRepository,
      SubscriptionRepository subscriptionRepository,
      UserRepository userRepository,
      ResourceUsageRepository usageRepository,
      BillingLedgerService ledgerService,
      PaymentSettlementService settlementService,
      PaymentGateway paymentGateway,
      BillingProperties billingProperties,
      Clock clock) {
    this.tenantRepository = tenantRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.userRepository = userRepository;
    this.usageRepository = usageRepository;
    this.ledgerService = ledgerService;
    this.settlementService = settlementService;
    this.paymentGateway = paymentGateway;
    this.billingProperties = billingProperties;
    this.clock = clock;
  }

  // --- Read side ---

  @Transactional(readOnly = true)
  public SubscriptionStatusResponse getSubscriptionStatus(UUID tenantId) {
    Tenant tenant = requireTenant(tenantId);
    var subscription = subscriptionRepository.findByTenantId(tenantId).orElse(null);

    int maxContadores =
        tenant.getPlan() == null ? 0 : PlanCatalog.limitsOf(tenant.getPlan()).maxContadores();
    int maxRegularUsers =
        PlanLimits.isUnlimited(tenant.getMaxUsers())
            ? PlanLimits.UNLIMITED
            : Math.max(0, tenant.getMaxUsers() - maxContadores);

    long users =
        usageRepository.countUsers(tenantId, false)
            + usageRepository.countPendingInvitations(tenantId, false);
    long contadores =
        usageRepository.countUsers(tenantId, true)
            + usageRepository.countPendingInvitations(tenantId, true);
    long warehouses = usageRepository.countWarehouses(tenantId);

    return new SubscriptionStatusResponse(
        tenantId,
        tenant.getPlan(),
        subscription != null ? subscription.getStatus() : null,
        tenant.getStatus(),
        subscription != null ? subscription.getPeriodType() : null,
        subscription != null ? subscription.getStartDate() : null,
        subscription != null ? subscription.getEndDate() : null,
        new Limits(
            tenant.getMaxUsers(),
            tenant.getMaxProducts(),
            tenant.getMaxInvoices(),
            tenant.getMaxWarehouses(),
            tenant.getMaxEmployees()),
        new Usage(
            new UsageCount(users, maxRegularUsers),
            new UsageCount(contadores, maxContadores),
            new UsageCount(warehouses, tenant.getMaxWarehouses())),
        tenant.hasPaymentSource(),
        subscription != null ? daysRemaining(subscription.getEndDate()) : null);
  }

  public List<PlanOffer> getPlans() {
    return Arrays.stream(SubscriptionPlan.values())
        .map(SubscriptionBillingService::toOffer)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<BillingTransactionResponse> getBillingHistory(UUID tenantId) {
    requireTenant(tenantId);
    return ledgerService.history(tenantId).stream().map(BillingTransactionResponse::from).toList();
  }

  // --- Checkout ---

  /** Everything the hosted checkout widget needs to charge {@code plan} for one period. */
  public CheckoutConfigResponse getCheckoutConfig(
      UUID tenantId, SubscriptionPlan plan, SubscriptionPeriod period) {
    requireTenant(tenantId);
    requirePurchasable(plan);
    log.info(
        "Generating checkout config for tenant {}: plan={}, period={}", tenantId, plan, period);

    long price = PlanCatalog.price(plan, period);
    long amountInCents = PlanCatalog.amountInCents(plan, period);
    String reference = newReference(tenantId);
    String integrityHash =
        paymentGateway.integrityHash(reference, amountInCents, PlanCatalog.CURRENCY, null);
    var acceptance = paymentGateway.getMerchantAcceptance();

    return new CheckoutConfigResponse(
        paymentGateway.publicKey(),
        reference,
        amountInCents,
        PlanCatalog.CURRENCY,
        integrityHash,
        billingProperties.frontendUrl() + "/billing?success=true",
        acceptance.acceptanceToken(),
        acceptance.personalDataAuthToken(),
        plan,
        period,
        PlanCatalog.limitsOf(plan).displayName(),
        PlanCatalog.formatPrice(price));
  }

  /**
   * Fetches the transaction the widget reported, records it in the ledger and, once approved,
   * activates or renews the subscription.
   */
  public SubscriptionStatusResponse verifyPayment(
      UUID tenantId, String transactionId, SubscriptionPlan plan, SubscriptionPeriod period) {
    requireTenant(tenantId);
    log.info(
        "Verifying payment for tenant {}: transaction={}, plan={}, period={}",
        tenantId,
        transactionId,
        plan,
        period);
    requirePurchasable(plan);

    GatewayTransaction transaction = paymentGateway.getTransaction(transactionId);
    requireMatchingCheckout(tenantId, transaction, plan, period);

    UUID subscriptionId =
        subscriptionRepository.findByTenantId(tenantId).map(Subscription::getId).orElse(null);
    var entry =
        ledgerService.recordCheckout(tenantId, subscriptionId, plan, period, transaction);

    if (entry.transaction().getStatus() == PaymentStatus.APPROVED) {
      settlementService.settle(entry.transaction().getId(), transaction.customerEmail());
    } else {
      log.info(
          "Transaction {} for tenant {} is {}: {}",
          transactionId,
          tenantId,
          transaction.rawStatus(),
          transaction.statusMessage());
    }
    return getSubscriptionStatus(tenantId);
  }

  // --- Stored cards ---

  public PaymentSourceResponse createPaymentSource(
      UUID tenantId, String cardToken, String acceptanceToken, String personalAuthToken) {
    Tenant tenant = requireTenant(tenantId);
    var source =
        paymentGateway.createPaymentSource(
            new CreatePaymentSourceRequest(
                cardToken, billingEmail(tenant), acceptanceToken, personalAuthToken));
    tenant.attachPaymentSource(source.id());
    tenantRepository.save(tenant);
    log.info("Stored payment source {} for tenant {}", source.id(), tenantId);
    return new PaymentSourceResponse(source.id(), source.status());
  }

  public void removePaymentSource(UUID tenantId) {
    Tenant tenant = requireTenant(tenantId);
    if (!tenant.hasPaymentSource()) {
      throw new InvalidStateException(
          "No payment source", "Tenant " + tenantId + " has no stored payment method");
    }
    paymentGateway.voidPaymentSource(tenant.getPaymentSourceId());
    tenant.detachPaymentSource();
    tenantRepository.save(tenant);
    log.info("Removed payment source for tenant {}", tenantId);
  }

  // --- Recurring ---

  /** Operator entry point for a renewal charge. 409 when the period was already charged. */
  public SubscriptionStatusResponse chargeRecurring(UUID tenantId) {
    var result = attemptRecurringCharge(tenantId);
    if (result.outcome() == RecurringChargeResult.Outcome.ALREADY_CLAIMED) {
      Instant periodEnd =
          subscriptionRepository
              .findByTenantId(tenantId)
              .map(Subscription::getEndDate)
              .orElseThrow(() -> ResourceNotFoundException.subscriptionForTenant(tenantId));
      throw ResourceConflictException.renewalAlreadyClaimed(tenantId, periodEnd);
    }
    return getSubscriptionStatus(tenantId);
  }

  /**
   * Charges the stored card for one more period of the current plan. A PENDING ledger claim is
   * committed before the gateway is called; the claim's uniqueness per subscription and period end
   * stops concurrent runs from charging twice.
   */
  public RecurringChargeResult attemptRecurringCharge(UUID tenantId) {
    Tenant tenant = requireTenant(tenantId);
    var subscription =
        subscriptionRepository
            .findByTenantId(tenantId)
            .orElseThrow(() -> ResourceNotFoundException.subscriptionForTenant(tenantId));
    if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
      throw InvalidStateException.subscriptionNotActive(
          "Recurring charge", subscription.getStatus());
    }
    if (!tenant.hasPaymentSource()) {
      throw new InvalidStateException(
          "No payment source", "Tenant " + tenantId + " has no stored payment method");
    }

    SubscriptionPlan plan = subscription.getPlan();
    SubscriptionPeriod period = subscription.getPeriodType();
    long amountInCents = PlanCatalog.amountInCents(plan, period);
    String reference = newReference(tenantId);

    BillingTransaction claim;
    try {
      claim =
          ledgerService.claimRecurring(
              tenantId,
              subscription.getId(),
              plan,
              period,
              amountInCents,
              PlanCatalog.CURRENCY,
              reference,
              subscription.getEndDate());
    } catch (DataIntegrityViolationException e) {
      log.info(
          "Renewal for subscription {} (period ending {}) already claimed, skipping",
          subscription.getId(),
          subscription.getEndDate());
      return RecurringChargeResult.alreadyClaimed(subscription.getId());
    }

    GatewayTransaction transaction;
    try {
      var acceptance = paymentGateway.getMerchantAcceptance();
      transaction =
          paymentGateway.createTransaction(
              CreateTransactionRequest.recurring(
                  amountInCents,
                  PlanCatalog.CURRENCY,
                  billingEmail(tenant),
                  reference,
                  acceptance.acceptanceToken(),
                  tenant.getPaymentSourceId()));
    } catch (PaymentGatewayTimeoutException e) {
      ledgerService.recordFailure(
          claim.getId(), PaymentStatus.PENDING, "Gateway timeout, outcome unknown");
      throw e;
    } catch (RuntimeException e) {
      ledgerService.recordFailure(claim.getId(), PaymentStatus.ERROR, e.getMessage());
      throw e;
    }

    var entry = ledgerService.completeRecurring(claim.getId(), transaction);
    PaymentStatus status = entry.transaction().getStatus();
    if (status == PaymentStatus.APPROVED) {
      settlementService.settle(claim.getId(), null);
    }
    log.info(
        "Recurring charge {} for tenant {} finished with status {}",
        transaction.id(),
        tenantId,
        status);
    return RecurringChargeResult.charged(
        subscription.getId(), status, transaction.statusMessage());
  }

  // --- Helpers ---

  private Tenant requireTenant(UUID tenantId) {
    return tenantRepository
        .findById(tenantId)
        .orElseThrow(() -> ResourceNotFoundException.tenant(tenantId));
  }

  /** {@code SF-<first 8 chars of tenant id>-<epoch millis>}. */
  String newReference(UUID tenantId) {
    return "SF-" + tenantId.toString().substring(0, 8) + "-" + clock.millis();
  }

  private static void requirePurchasable(SubscriptionPlan plan) {
    if (!PlanCatalog.isPurchasable(plan)) {
      throw new InvalidStateException(
          "Plan not purchasable", plan + " is the base plan and cannot be bought online");
    }
  }

  /**
   * Rejects a transaction that was not produced by this tenant's checkout for the claimed plan, so
   * a cheaper payment cannot be used to unlock a more expensive plan.
   */
  private void requireMatchingCheckout(
      UUID tenantId,
      GatewayTransaction transaction,
      SubscriptionPlan plan,
      SubscriptionPeriod period) {
    String expectedPrefix = "SF-" + tenantId.toString().substring(0, 8) + "-";
    if (transaction.reference() == null || !transaction.reference().startsWith(expectedPrefix)) {
      throw new InvalidStateException(
          "Transaction mismatch",
          "Transaction " + transaction.id() + " was not created for this organization");
    }
    long expected = PlanCatalog.amountInCents(plan, period);
    if (transaction.amountInCents() != expected) {
      throw new InvalidStateException(
          "Transaction mismatch",
          "Transaction amount %d does not match %s %s price %d"
              .formatted(transaction.amountInCents(), plan, period, expected));
    }
    if (!PlanCatalog.CURRENCY.equals(transaction.currency())) {
      throw new InvalidStateException(
          "Transaction mismatch",
          "Transaction currency %s is not %s"
              .formatted(transaction.currency(), PlanCatalog.CURRENCY));
    }
  }

  private String billingEmail(Tenant tenant) {
    if (tenant.getBillingEmail() != null && !tenant.getBillingEmail().isBlank()) {
      return tenant.getBillingEmail();
    }
    return userRepository
        .findByTenantIdAndRoleAndStatus(tenant.getId(), UserRole.ADMIN, UserStatus.ACTIVE)
        .stream()
        .findFirst()
        .map(User::getEmail)
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "No billing contact",
                    "Tenant " + tenant.getId() + " has no billing email or active admin"));
  }

  private Long daysRemaining(Instant endDate) {
    Duration left = Duration.between(clock.instant(), endDate);
    if (left.isNegative() || left.isZero()) {
      return 0L;
    }
    long days = left.toDays();
    return left.minus(ONE_DAY.multipliedBy(days)).isZero() ? days : days + 1;
  }

  private static PlanOffer toOffer(SubscriptionPlan plan) {
    PlanLimits limits = PlanCatalog.limitsOf(plan);
    var prices = new EnumMap<SubscriptionPeriod, PeriodPrice>(SubscriptionPeriod.class);
    for (SubscriptionPeriod period : SubscriptionPeriod.values()) {
      long total = PlanCatalog.price(plan, period);
      prices.put(
          period,
          new PeriodPrice(
              total,
              PlanCatalog.amountInCents(plan, period),
              PlanCatalog.monthlyEquivalent(plan, period),
              PlanCatalog.periodDiscount(period).multiply(BigDecimal.valueOf(100)).intValue()));
    }
    return new PlanOffer(
        plan,
        limits.displayName(),
        limits.description(),
        limits.features(),
        limits.monthlyPrice(),
        PlanCatalog.isPurchasable(plan),
        new Limits(
            limits.maxUsers(),
            limits.maxProducts(),
            limits.maxInvoices(),
            limits.maxWarehouses(),
            limits.maxEmployees()),
        prices);
  }

  // --- Response records ---

  public record SubscriptionStatusResponse(
      UUID tenantId,
      SubscriptionPlan plan,
      SubscriptionStatus status,
      TenantStatus tenantStatus,
      SubscriptionPeriod periodType,
      Instant startDate,
      Instant endDate,
      Limits limits,
      Usage usage,
      boolean hasPaymentSource,
      Long daysRemaining) {}

  public record Limits(
      int maxUsers, int maxProducts, int maxInvoices, int maxWarehouses, int maxEmployees) {}

  public record Usage(UsageCount users, UsageCount contadores, UsageCount warehouses) {}

  public record UsageCount(long current, int limit) {}

  public record PlanOffer(
      SubscriptionPlan plan,
      String displayName,
      String description,
      List<String> features,
      long priceMonthly,
      boolean purchasable,
      Limits limits,
      Map<SubscriptionPeriod, PeriodPrice> prices) {}

  /**
   * @param discount percentage off the undiscounted total
   */
  public record PeriodPrice(long total, long totalInCents, long monthly, int discount) {}

  public record CheckoutConfigResponse(
      String publicKey,
      String reference,
      long amountInCents,
      String currency,
      String integrityHash,
      String redirectUrl,
      String acceptanceToken,
      String personalDataAuthToken,
      SubscriptionPlan plan,
      SubscriptionPeriod period,
      String displayName,
      String priceFormatted) {}

  public record PaymentSourceResponse(String paymentSourceId, String status) {}

  public record BillingTransactionResponse(
      UUID id,
      String gatewayTransactionId,
      String reference,
      SubscriptionPlan plan,
      SubscriptionPeriod period,
      long amountInCents,
      String currency,
      PaymentStatus status,
      String paymentMethodType,
      String failureReason,
      boolean recurring,
      Instant createdAt) {

    static BillingTransactionResponse from(BillingTransaction row) {
      return new BillingTransactionResponse(
          row.getId(),
          row.getGatewayTransactionId(),
          row.getReference(),
          row.getPlan(),
          row.getPeriod(),
          row.getAmountInCents(),
          row.getCurrency(),
          row.getStatus(),
          row.getPaymentMethodType(),
          row.getFailureReason(),
          row.isRecurring(),
          row.getCreatedAt());
    }
  }
}

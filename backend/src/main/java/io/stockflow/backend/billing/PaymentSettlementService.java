package io.stockflow.backend.billing;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.integration.payment.PaymentStatus;
import io.stockflow.backend.tenant.TenantRepository;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns an APPROVED ledger row into exactly one subscription transition. The row is locked, the
 * transition runs and the row is marked applied in the same transaction, so repeated webhooks or a
 * webhook racing the checkout verification cannot activate or extend twice.
 */
@Service
public class PaymentSettlementService {

  private static final Logger log = LoggerFactory.getLogger(PaymentSettlementService.class);

  private final BillingTransactionRepository transactionRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final TenantRepository tenantRepository;
  private final SubscriptionLifecycleService lifecycleService;
  private final Clock clock;

  public PaymentSettlementService(
      BillingTransactionRepository transactionRepository,
      SubscriptionRepository subscriptionRepository,
      TenantRepository tenantRepository,
      SubscriptionLifecycleService lifecycleService,
      Clock clock) {
    this.transactionRepository = transactionRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.tenantRepository = tenantRepository;
    this.lifecycleService = lifecycleService;
    this.clock = clock;
  }

  /**
   * Applies the approval recorded in {@code billingTransactionId}. Renewals extend an ACTIVE
   * subscription; checkouts extend when the tenant is already active on the same plan. Anything
   * else, including a renewal approved after the subscription was suspended or expired, starts a
   * new period on the paid plan. Returns empty when the row is not approved or was applied before.
   *
   * @param customerEmail payer email reported by the gateway, stored as the tenant's billing
   *     contact when present
   */
  @Transactional
  public Optional<Subscription> settle(UUID billingTransactionId, String customerEmail) {
    var row = transactionRepository.findForUpdate(billingTransactionId).orElse(null);
    if (row == null) {
      log.warn("Settlement requested for unknown ledger row {}", billingTransactionId);
      return Optional.empty();
    }
    if (row.getStatus() != PaymentStatus.APPROVED || row.isApplied()) {
      log.debug(
          "Ledger row {} not settled (status={}, applied={})",
          row.getId(),
          row.getStatus(),
          row.isApplied());
      return Optional.empty();
    }

    UUID tenantId = row.getTenantId();
    var current = subscriptionRepository.findByTenantId(tenantId).orElse(null);
    boolean active = current != null && current.getStatus() == SubscriptionStatus.ACTIVE;
    boolean extendCurrent = active && (row.isRecurring() || current.getPlan() == row.getPlan());
    if (row.isRecurring() && !active) {
      log.info(
          "Renewal {} approved after subscription of tenant {} left ACTIVE ({}); reactivating",
          row.getReference(),
          tenantId,
          current == null ? "none" : current.getStatus());
    }
    Subscription subscription =
        extendCurrent
            ? lifecycleService.extend(tenantId, row.getPeriod())
            : lifecycleService.activate(tenantId, row.getPlan(), row.getPeriod());

    row.markApplied(subscription.getId(), clock.instant());
    transactionRepository.save(row);

    if (customerEmail != null && !customerEmail.isBlank()) {
      tenantRepository
          .findById(tenantId)
          .ifPresent(
              tenant -> {
                tenant.updateBillingEmail(customerEmail);
                tenantRepository.save(tenant);
              });
    }

    log.info(
        "Settled ledger row {} ({}) for tenant {}: subscription {} now ends {}",
        row.getId(),
        row.getGatewayTransactionId(),
        tenantId,
        subscription.getId(),
        subscription.getEndDate());
    return Optional.of(subscription);
  }
}

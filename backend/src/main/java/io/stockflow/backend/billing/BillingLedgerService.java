package io.stockflow.backend.billing;

import io.stockflow.backend.exception.ResourceNotFoundException;
import io.stockflow.backend.integration.payment.GatewayTransaction;
import io.stockflow.backend.integration.payment.PaymentStatus;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes and merges ledger rows. Every charge attempt is recorded here before its outcome is acted
 * on; gateway reports for an already known transaction id update the existing row.
 */
@Service
public class BillingLedgerService {

  private static final Logger log = LoggerFactory.getLogger(BillingLedgerService.class);

  private final BillingTransactionRepository transactionRepository;
  private final Clock clock;

  public BillingLedgerService(BillingTransactionRepository transactionRepository, Clock clock) {
    this.transactionRepository = transactionRepository;
    this.clock = clock;
  }

  /**
   * A ledger row after a merge, with the status it had before. {@code previousStatus} is null when
   * the row was created by this call.
   */
  public record LedgerEntry(BillingTransaction transaction, PaymentStatus previousStatus) {

    public boolean isNewlyApproved() {
      return transaction.getStatus() == PaymentStatus.APPROVED
          && previousStatus != PaymentStatus.APPROVED;
    }
  }

  /** Records a checkout transaction, merging into the existing row if the id is already known. */
  @Transactional
  public LedgerEntry recordCheckout(
      UUID tenantId,
      UUID subscriptionId,
      SubscriptionPlan plan,
      SubscriptionPeriod period,
      GatewayTransaction gatewayTransaction) {
    Instant now = clock.instant();
    var existing = transactionRepository.findByGatewayTransactionId(gatewayTransaction.id());
    if (existing.isPresent()) {
      return merge(existing.get(), gatewayTransaction, now);
    }
    var row =
        transactionRepository.save(
            BillingTransaction.checkout(
                tenantId, subscriptionId, plan, period, gatewayTransaction, now));
    log.info(
        "Recorded checkout transaction {} for tenant {}: {} {} -> {}",
        gatewayTransaction.id(),
        tenantId,
        plan,
        period,
        row.getStatus());
    return new LedgerEntry(row, null);
  }

  /**
   * Applies a gateway report to the row with the same transaction id. A row that never received a
   * gateway id is matched by reference instead and bound to the reported id.
   */
  @Transactional
  public Optional<LedgerEntry> applyGatewayUpdate(GatewayTransaction gatewayTransaction) {
    return transactionRepository
        .findByGatewayTransactionId(gatewayTransaction.id())
        .or(() -> findUnboundRow(gatewayTransaction))
        .map(row -> merge(row, gatewayTransaction, clock.instant()));
  }

  /**
   * Inserts the PENDING row for a renewal of {@code billingPeriodEnd}. A second claim for the same
   * subscription and period while an earlier one is PENDING or APPROVED violates {@code
   * ux_billing_transactions_recurring_period} and fails with {@link
   * org.springframework.dao.DataIntegrityViolationException}. DECLINED and ERROR claims do not
   * block a retry.
   */
  @Transactional
  public BillingTransaction claimRecurring(
      UUID tenantId,
      UUID subscriptionId,
      SubscriptionPlan plan,
      SubscriptionPeriod period,
      long amountInCents,
      String currency,
      String reference,
      Instant billingPeriodEnd) {
    var claim =
        BillingTransaction.recurringClaim(
            tenantId,
            subscriptionId,
            plan,
            period,
            amountInCents,
            currency,
            reference,
            billingPeriodEnd,
            clock.instant());
    claim = transactionRepository.saveAndFlush(claim);
    log.info(
        "Claimed recurring charge {} for subscription {} (period ending {})",
        reference,
        subscriptionId,
        billingPeriodEnd);
    return claim;
  }

  @Transactional
  public LedgerEntry completeRecurring(UUID claimId, GatewayTransaction gatewayTransaction) {
    return merge(requireRow(claimId), gatewayTransaction, clock.instant());
  }

  /** Marks a claim whose gateway call failed without a transaction report. */
  @Transactional
  public void recordFailure(UUID transactionId, PaymentStatus status, String reason) {
    var row = requireRow(transactionId);
    row.recordFailure(status, reason, clock.instant());
    transactionRepository.save(row);
    log.warn("Ledger row {} marked {}: {}", transactionId, status, reason);
  }

  @Transactional(readOnly = true)
  public boolean hasRecurringAttemptSince(UUID subscriptionId, Instant since) {
    return transactionRepository.existsRecurringSince(subscriptionId, since);
  }

  @Transactional(readOnly = true)
  public List<BillingTransaction> history(UUID tenantId) {
    return transactionRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
  }

  private LedgerEntry merge(
      BillingTransaction row, GatewayTransaction gatewayTransaction, Instant now) {
    PaymentStatus previous = row.getStatus();
    if (row.applyGatewayState(gatewayTransaction, now)) {
      row = transactionRepository.save(row);
      log.info(
          "Ledger row {} ({}) updated: {} -> {}",
          row.getId(),
          gatewayTransaction.id(),
          previous,
          row.getStatus());
    } else {
      log.debug(
          "Ledger row {} already APPROVED, ignoring gateway status {}",
          row.getId(),
          gatewayTransaction.rawStatus());
    }
    return new LedgerEntry(row, previous);
  }

  private Optional<BillingTransaction> findUnboundRow(GatewayTransaction gatewayTransaction) {
    if (gatewayTransaction.reference() == null || gatewayTransaction.reference().isBlank()) {
      return Optional.empty();
    }
    return transactionRepository.findUnboundByReference(gatewayTransaction.reference()).stream()
        .findFirst()
        .filter(
            row -> {
              if (row.getAmountInCents() != gatewayTransaction.amountInCents()) {
                log.warn(
                    "Gateway transaction {} matches reference {} but charged {} instead of {}",
                    gatewayTransaction.id(),
                    row.getReference(),
                    gatewayTransaction.amountInCents(),
                    row.getAmountInCents());
                return false;
              }
              log.info(
                  "Binding gateway transaction {} to ledger row {} by reference {}",
                  gatewayTransaction.id(),
                  row.getId(),
                  row.getReference());
              return true;
            });
  }

  private BillingTransaction requireRow(UUID transactionId) {
    return transactionRepository
        .findById(transactionId)
        .orElseThrow(() -> new ResourceNotFoundException("BillingTransaction", transactionId));
  }
}

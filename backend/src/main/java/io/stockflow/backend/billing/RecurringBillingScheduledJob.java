package io.stockflow.backend.billing;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.config.BillingConfig.BillingProperties;
import io.stockflow.backend.event.RecurringChargeFailedEvent;
import io.stockflow.backend.integration.payment.PaymentGatewayTimeoutException;
import io.stockflow.backend.integration.payment.PaymentStatus;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily renewal run. Charges the stored card of every ACTIVE subscription ending within the renewal
 * window. One tenant's failure never stops the run.
 *
 * <p>A gateway timeout leaves the claim PENDING and is counted as pending without a failure
 * notification: the charge may still go through, and the webhook for it settles the claim. The
 * {@code attempted} count covers gateway calls only; candidates skipped by the lookback or by a
 * concurrent claim are counted in {@code skipped}.
 */
@Component
public class RecurringBillingScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(RecurringBillingScheduledJob.class);

  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionBillingService billingService;
  private final BillingLedgerService ledgerService;
  private final ApplicationEventPublisher eventPublisher;
  private final BillingProperties billingProperties;
  private final Clock clock;

  public RecurringBillingScheduledJob(
      SubscriptionRepository subscriptionRepository,
      SubscriptionBillingService billingService,
      BillingLedgerService ledgerService,
      ApplicationEventPublisher eventPublisher,
      BillingProperties billingProperties,
      Clock clock) {
    this.subscriptionRepository = subscriptionRepository;
    this.billingService = billingService;
    this.ledgerService = ledgerService;
    this.eventPublisher = eventPublisher;
    this.billingProperties = billingProperties;
    this.clock = clock;
  }

  @Scheduled(cron = "${stockflow.billing.recurring-cron:0 0 6 * * *}")
  public void runScheduled() {
    execute();
  }

  /** Runs one pass; also triggered manually from the operator API. */
  public RecurringBillingSummary execute() {
    log.info("Recurring billing job started");
    Instant now = clock.instant();
    var candidates =
        subscriptionRepository.findRenewalCandidates(
            SubscriptionStatus.ACTIVE, now, now.plus(billingProperties.renewalWindow()));

    int succeeded = 0;
    int failed = 0;
    int pending = 0;
    int skipped = 0;

    for (Subscription subscription : candidates) {
      Instant since = subscription.getEndDate().minus(billingProperties.recurringLookback());
      if (ledgerService.hasRecurringAttemptSince(subscription.getId(), since)) {
        log.debug("Subscription {} already has a renewal attempt, skipping", subscription.getId());
        skipped++;
        continue;
      }

      try {
        var result = billingService.attemptRecurringCharge(subscription.getTenantId());
        if (result.outcome() == RecurringChargeResult.Outcome.ALREADY_CLAIMED) {
          skipped++;
        } else if (result.status() == PaymentStatus.APPROVED) {
          succeeded++;
        } else if (result.status() == PaymentStatus.PENDING) {
          pending++;
        } else {
          failed++;
          publishFailure(subscription, describe(result));
        }
      } catch (PaymentGatewayTimeoutException e) {
        log.warn(
            "Recurring charge for tenant {} timed out, outcome unknown",
            subscription.getTenantId());
        pending++;
      } catch (RuntimeException e) {
        log.error("Recurring charge failed for tenant {}", subscription.getTenantId(), e);
        failed++;
        publishFailure(subscription, e.getMessage());
      }
    }

    var summary =
        new RecurringBillingSummary(
            succeeded + failed + pending, succeeded, failed, pending, skipped);
    log.info("Recurring billing job completed: {}", summary);
    return summary;
  }

  private void publishFailure(Subscription subscription, String reason) {
    try {
      eventPublisher.publishEvent(
          new RecurringChargeFailedEvent(
              subscription.getTenantId(),
              subscription.getId(),
              subscription.getPlan(),
              subscription.getEndDate(),
              reason,
              clock.instant()));
    } catch (RuntimeException e) {
      log.error(
          "Failed to publish charge failure for subscription {}", subscription.getId(), e);
    }
  }

  private static String describe(RecurringChargeResult result) {
    return result.message() != null ? result.message() : "Payment " + result.status();
  }

  public record RecurringBillingSummary(
      int attempted, int succeeded, int failed, int pending, int skipped) {}
}

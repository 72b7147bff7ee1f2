package io.stockflow.backend.billing;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.event.SubscriptionExpiringEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily expiry run: warns tenants seven days and one day before their end date, then expires
 * lapsed subscriptions. Each step and each subscription is isolated from the others' failures.
 */
@Component
public class SubscriptionExpiryScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionExpiryScheduledJob.class);

  private static final Duration ONE_DAY = Duration.ofDays(1);

  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionLifecycleService lifecycleService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public SubscriptionExpiryScheduledJob(
      SubscriptionRepository subscriptionRepository,
      SubscriptionLifecycleService lifecycleService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.subscriptionRepository = subscriptionRepository;
    this.lifecycleService = lifecycleService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Scheduled(cron = "${stockflow.billing.expiry-cron:0 0 9 * * *}")
  public void runScheduled() {
    execute();
  }

  /** Runs one pass; also triggered manually from the operator API. */
  public ExpiryCheckSummary execute() {
    log.info("Subscription expiry job started");
    Instant now = clock.instant();

    int expiring7Days = 0;
    int expiringTomorrow = 0;
    int expired = 0;
    try {
      expiring7Days = warnExpiring(now, 7);
    } catch (RuntimeException e) {
      log.error("Subscription expiry job: 7-day warnings failed", e);
    }
    try {
      expiringTomorrow = warnExpiring(now, 1);
    } catch (RuntimeException e) {
      log.error("Subscription expiry job: 1-day warnings failed", e);
    }
    try {
      expired = expireLapsed(now);
    } catch (RuntimeException e) {
      log.error("Subscription expiry job: expiring lapsed subscriptions failed", e);
    }

    var summary = new ExpiryCheckSummary(expiring7Days, expiringTomorrow, expired);
    log.info("Subscription expiry job completed: {}", summary);
    return summary;
  }

  /** Warns subscriptions ending in {@code [now + (days-1)d, now + days d)}. */
  private int warnExpiring(Instant now, int days) {
    Instant to = now.plus(ONE_DAY.multipliedBy(days));
    var subscriptions =
        subscriptionRepository.findByStatusAndEndDateBetween(
            SubscriptionStatus.ACTIVE, to.minus(ONE_DAY), to);
    int warned = 0;
    for (Subscription subscription : subscriptions) {
      try {
        eventPublisher.publishEvent(
            new SubscriptionExpiringEvent(
                subscription.getTenantId(),
                subscription.getId(),
                subscription.getPlan(),
                subscription.getEndDate(),
                days,
                now));
        warned++;
      } catch (RuntimeException e) {
        log.error(
            "Failed to send {}-day expiry warning for subscription {}",
            days,
            subscription.getId(),
            e);
      }
    }
    return warned;
  }

  private int expireLapsed(Instant now) {
    int expired = 0;
    for (Subscription subscription :
        subscriptionRepository.findLapsed(SubscriptionStatus.ACTIVE, now)) {
      try {
        if (lifecycleService.expire(subscription.getId())) {
          expired++;
        }
      } catch (RuntimeException e) {
        log.error("Failed to expire subscription {}", subscription.getId(), e);
      }
    }
    return expired;
  }

  public record ExpiryCheckSummary(int expiring7Days, int expiringTomorrow, int expired) {}
}

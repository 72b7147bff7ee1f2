package io.stockflow.backend.event;

import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import java.time.Instant;
import java.util.UUID;

/** Published when a plan is activated, or renewed when {@code renewal} is true. */
public record SubscriptionActivatedEvent(
    UUID tenantId,
    UUID subscriptionId,
    SubscriptionPlan plan,
    SubscriptionPeriod period,
    Instant endDate,
    boolean renewal,
    Instant occurredAt)
    implements SubscriptionEvent {

  @Override
  public String eventType() {
    return renewal ? "subscription.renewed" : "subscription.activated";
  }
}

package io.stockflow.backend.event;

import io.stockflow.backend.plan.SubscriptionPlan;
import java.time.Instant;
import java.util.UUID;

/** Advance warning sent by the expiry job, {@code daysRemaining} before {@code endDate}. */
public record SubscriptionExpiringEvent(
    UUID tenantId,
    UUID subscriptionId,
    SubscriptionPlan plan,
    Instant endDate,
    int daysRemaining,
    Instant occurredAt)
    implements SubscriptionEvent {

  @Override
  public String eventType() {
    return "subscription.expiring";
  }
}

package io.stockflow.backend.event;

import io.stockflow.backend.plan.SubscriptionPlan;
import java.time.Instant;
import java.util.UUID;

public record SubscriptionExpiredEvent(
    UUID tenantId, UUID subscriptionId, SubscriptionPlan plan, Instant endDate, Instant occurredAt)
    implements SubscriptionEvent {

  @Override
  public String eventType() {
    return "subscription.expired";
  }
}

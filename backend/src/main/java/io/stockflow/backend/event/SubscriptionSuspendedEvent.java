package io.stockflow.backend.event;

import io.stockflow.backend.plan.SubscriptionPlan;
import java.time.Instant;
import java.util.UUID;

public record SubscriptionSuspendedEvent(
    UUID tenantId, UUID subscriptionId, SubscriptionPlan plan, String reason, Instant occurredAt)
    implements SubscriptionEvent {

  @Override
  public String eventType() {
    return "subscription.suspended";
  }
}

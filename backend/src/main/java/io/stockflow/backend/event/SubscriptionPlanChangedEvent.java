package io.stockflow.backend.event;

import io.stockflow.backend.plan.SubscriptionPlan;
import java.time.Instant;
import java.util.UUID;

public record SubscriptionPlanChangedEvent(
    UUID tenantId,
    UUID subscriptionId,
    SubscriptionPlan previousPlan,
    SubscriptionPlan newPlan,
    Instant occurredAt)
    implements SubscriptionEvent {

  @Override
  public String eventType() {
    return "subscription.plan_changed";
  }
}

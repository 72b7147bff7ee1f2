package io.stockflow.backend.event;

import io.stockflow.backend.plan.SubscriptionPlan;
import java.time.Instant;
import java.util.UUID;

/** A scheduled renewal was declined or errored. The subscription itself is left unchanged. */
public record RecurringChargeFailedEvent(
    UUID tenantId,
    UUID subscriptionId,
    SubscriptionPlan plan,
    Instant endDate,
    String reason,
    Instant occurredAt)
    implements SubscriptionEvent {

  @Override
  public String eventType() {
    return "subscription.charge_failed";
  }
}

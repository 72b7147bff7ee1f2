package io.stockflow.backend.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for subscription lifecycle events published via Spring ApplicationEventPublisher.
 * Implementations are records holding ids and values only, never entities, so they stay valid after
 * the publishing transaction commits.
 */
public sealed interface SubscriptionEvent
    permits SubscriptionActivatedEvent,
        SubscriptionSuspendedEvent,
        SubscriptionPlanChangedEvent,
        SubscriptionExpiringEvent,
        SubscriptionExpiredEvent,
        RecurringChargeFailedEvent {

  /** Dotted event name, also used as the in-app notification type. */
  String eventType();

  UUID tenantId();

  UUID subscriptionId();

  Instant occurredAt();
}

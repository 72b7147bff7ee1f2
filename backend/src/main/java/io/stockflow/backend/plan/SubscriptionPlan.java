package io.stockflow.backend.plan;

/** Subscription tiers, ordered from the base tier upwards. */
public enum SubscriptionPlan {
  EMPRENDEDOR,
  PYME,
  PRO,
  PLUS
}

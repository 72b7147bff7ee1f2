package io.stockflow.backend.plan;

/** Billing cadence. Duration, multiplier and discount live in {@link PlanCatalog}. */
public enum SubscriptionPeriod {
  MONTHLY,
  QUARTERLY,
  ANNUAL
}

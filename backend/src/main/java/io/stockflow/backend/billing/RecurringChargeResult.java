package io.stockflow.backend.billing;

import io.stockflow.backend.integration.payment.PaymentStatus;
import java.util.UUID;

/**
 * Outcome of one renewal attempt.
 *
 * @param status gateway status of the charge, null when no charge was made
 */
public record RecurringChargeResult(
    UUID subscriptionId, Outcome outcome, PaymentStatus status, String message) {

  public enum Outcome {
    /** The gateway accepted the request; see {@link #status()} for the result. */
    CHARGED,
    /** Another run already holds the ledger claim for this period. No charge was made. */
    ALREADY_CLAIMED
  }

  static RecurringChargeResult charged(UUID subscriptionId, PaymentStatus status, String message) {
    return new RecurringChargeResult(subscriptionId, Outcome.CHARGED, status, message);
  }

  static RecurringChargeResult alreadyClaimed(UUID subscriptionId) {
    return new RecurringChargeResult(subscriptionId, Outcome.ALREADY_CLAIMED, null, null);
  }

  public boolean approved() {
    return outcome == Outcome.CHARGED && status == PaymentStatus.APPROVED;
  }
}

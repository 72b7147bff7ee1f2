package io.stockflow.backend.integration.payment;

import java.util.Locale;

/** Normalized status of a gateway transaction. */
public enum PaymentStatus {
  /** Created at the gateway, final outcome not yet known. */
  PENDING,
  /** Funds captured. The only status that may create or extend a subscription. */
  APPROVED,
  /** Rejected by the issuer or the gateway's risk checks. */
  DECLINED,
  /** Cancelled after creation. */
  VOIDED,
  /** Failed for a technical reason, or reported with a status this client does not know. */
  ERROR;

  /** Maps a raw gateway status string. Unknown or missing values map to {@link #ERROR}. */
  public static PaymentStatus fromGateway(String raw) {
    if (raw == null) {
      return ERROR;
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "PENDING" -> PENDING;
      case "APPROVED" -> APPROVED;
      case "DECLINED" -> DECLINED;
      case "VOIDED" -> VOIDED;
      default -> ERROR;
    };
  }

  public boolean isTerminal() {
    return this != PENDING;
  }
}

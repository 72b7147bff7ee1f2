package io.stockflow.backend.integration.payment;

/**
 * Charge request. {@code paymentSourceId} and {@code recurrent} are set for renewals against a
 * stored card; {@code redirectUrl} only applies to customer-present checkouts.
 */
public record CreateTransactionRequest(
    long amountInCents,
    String currency,
    String customerEmail,
    String reference,
    String acceptanceToken,
    String personalAuthToken,
    String paymentSourceId,
    boolean recurrent,
    String redirectUrl) {

  public static CreateTransactionRequest recurring(
      long amountInCents,
      String currency,
      String customerEmail,
      String reference,
      String acceptanceToken,
      String paymentSourceId) {
    return new CreateTransactionRequest(
        amountInCents,
        currency,
        customerEmail,
        reference,
        acceptanceToken,
        null,
        paymentSourceId,
        true,
        null);
  }
}

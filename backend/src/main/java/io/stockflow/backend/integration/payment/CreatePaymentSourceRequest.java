package io.stockflow.backend.integration.payment;

/**
 * Request to turn a client-side card token into a reusable payment source.
 *
 * @param personalAuthToken optional acceptance of the personal-data policy, may be null
 */
public record CreatePaymentSourceRequest(
    String cardToken, String customerEmail, String acceptanceToken, String personalAuthToken) {}

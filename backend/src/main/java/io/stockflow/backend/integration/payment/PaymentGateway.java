package io.stockflow.backend.integration.payment;

import tools.jackson.databind.JsonNode;

/**
 * Port for the card-payment provider used to collect subscription fees. Every remote operation is
 * bounded by a timeout and fails with one of {@link PaymentGatewayException}, {@link
 * PaymentGatewayTimeoutException}, {@link PaymentGatewayTransportException} or {@link
 * PaymentGatewayConfigurationException}.
 */
public interface PaymentGateway {

  /** Unique provider identifier (e.g., "wompi"). */
  String providerId();

  /** Public key handed to the client-side checkout widget. */
  String publicKey();

  /** Current acceptance tokens. Cached for a short time by implementations. */
  MerchantAcceptance getMerchantAcceptance();

  /** Stores a card for later charges and returns the gateway's payment source. */
  PaymentSource createPaymentSource(CreatePaymentSourceRequest request);

  /** Creates a one-time or recurring transaction. */
  GatewayTransaction createTransaction(CreateTransactionRequest request);

  /** Fetches a transaction by the gateway's id. */
  GatewayTransaction getTransaction(String transactionId);

  /** Invalidates a stored payment source so it can no longer be charged. */
  void voidPaymentSource(String paymentSourceId);

  /** Integrity hash binding reference, amount and currency for the checkout widget. */
  String integrityHash(
      String reference, long amountInCents, String currency, String expirationTime);

  /** Verifies the checksum of an inbound event. Returns false instead of throwing. */
  boolean verifyEventSignature(JsonNode event);
}

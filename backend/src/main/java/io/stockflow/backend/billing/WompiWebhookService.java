package io.stockflow.backend.billing;

import io.stockflow.backend.integration.payment.GatewayTransaction;
import io.stockflow.backend.integration.payment.InvalidWebhookSignatureException;
import io.stockflow.backend.integration.payment.PaymentGateway;
import io.stockflow.backend.integration.payment.PaymentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Processes gateway events. Only the signature check can fail the request; once an event is
 * authenticated, processing errors are logged and the delivery is acknowledged so the gateway does
 * not keep retrying it. Failed events can be replayed from the gateway dashboard.
 */
@Service
public class WompiWebhookService {

  private static final Logger log = LoggerFactory.getLogger(WompiWebhookService.class);

  static final String TRANSACTION_UPDATED = "transaction.updated";

  private final PaymentGateway paymentGateway;
  private final BillingLedgerService ledgerService;
  private final PaymentSettlementService settlementService;
  private final ObjectMapper objectMapper;

  public WompiWebhookService(
      PaymentGateway paymentGateway,
      BillingLedgerService ledgerService,
      PaymentSettlementService settlementService,
      ObjectMapper objectMapper) {
    this.paymentGateway = paymentGateway;
    this.ledgerService = ledgerService;
    this.settlementService = settlementService;
    this.objectMapper = objectMapper;
  }

  /**
   * @throws InvalidWebhookSignatureException when the payload is unparseable or its checksum does
   *     not verify
   */
  public void processWebhook(String payload) {
    JsonNode event = parse(payload);
    if (!paymentGateway.verifyEventSignature(event)) {
      log.warn("Wompi webhook received with invalid signature");
      throw new InvalidWebhookSignatureException();
    }

    String eventType = event.path("event").asText();
    log.info("Processing Wompi webhook event: {}", eventType);
    try {
      if (TRANSACTION_UPDATED.equals(eventType)) {
        handleTransactionUpdated(event.path("data").path("transaction"));
      } else {
        log.info("Ignoring unhandled Wompi webhook event: {}", eventType);
      }
    } catch (RuntimeException e) {
      log.error("Error processing Wompi webhook {}", eventType, e);
    }
  }

  private void handleTransactionUpdated(JsonNode transactionNode) {
    if (!transactionNode.isObject() || transactionNode.path("id").asText().isEmpty()) {
      log.warn("Webhook {} received without transaction data", TRANSACTION_UPDATED);
      return;
    }
    GatewayTransaction transaction = GatewayTransaction.fromJson(transactionNode);
    log.info("Processing transaction update: {} -> {}", transaction.id(), transaction.status());

    var entry = ledgerService.applyGatewayUpdate(transaction);
    if (entry.isEmpty()) {
      log.warn("No billing transaction found for Wompi transaction {}", transaction.id());
      return;
    }

    var row = entry.get().transaction();
    if (row.getStatus() == PaymentStatus.APPROVED) {
      settlementService
          .settle(row.getId(), transaction.customerEmail())
          .ifPresent(
              subscription ->
                  log.info(
                      "Transaction {} settled for tenant {}: {} until {}",
                      transaction.id(),
                      row.getTenantId(),
                      subscription.getPlan(),
                      subscription.getEndDate()));
    }
  }

  private JsonNode parse(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new InvalidWebhookSignatureException();
    }
    try {
      return objectMapper.readTree(payload);
    } catch (JacksonException e) {
      log.warn("Unparseable Wompi webhook payload: {}", e.getOriginalMessage());
      throw new InvalidWebhookSignatureException();
    }
  }
}

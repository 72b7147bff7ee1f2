package io.stockflow.backend.integration.payment;

import tools.jackson.databind.JsonNode;

/** A transaction as reported by the gateway, either fetched directly or carried by an event. */
public record GatewayTransaction(
    String id,
    PaymentStatus status,
    String rawStatus,
    String reference,
    long amountInCents,
    String currency,
    String paymentMethodType,
    String paymentSourceId,
    String customerEmail,
    String statusMessage) {

  /** Reads the gateway's snake_case transaction object. Absent fields become null. */
  public static GatewayTransaction fromJson(JsonNode node) {
    String rawStatus = text(node, "status");
    String email = text(node, "customer_email");
    if (email == null) {
      email = text(node.path("customer_data"), "email");
    }
    return new GatewayTransaction(
        text(node, "id"),
        PaymentStatus.fromGateway(rawStatus),
        rawStatus,
        text(node, "reference"),
        node.path("amount_in_cents").asLong(0L),
        text(node, "currency"),
        text(node, "payment_method_type"),
        text(node, "payment_source_id"),
        email,
        text(node, "status_message"));
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    return value.asText();
  }
}

package io.stockflow.backend.integration.payment;

/** A tokenized, reusable card held by the gateway. */
public record PaymentSource(String id, String type, String status) {}

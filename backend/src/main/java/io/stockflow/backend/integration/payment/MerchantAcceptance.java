package io.stockflow.backend.integration.payment;

/** Presigned acceptance tokens the customer must accept before a charge can be created. */
public record MerchantAcceptance(String acceptanceToken, String personalDataAuthToken) {}

package io.stockflow.backend.integration.email;

public record SendResult(boolean success, String providerMessageId, String errorMessage) {}

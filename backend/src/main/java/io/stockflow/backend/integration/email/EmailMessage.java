package io.stockflow.backend.integration.email;

import java.util.Objects;
import java.util.UUID;

/**
 * A rendered billing notice addressed to one recipient. {@code tenantId} and {@code eventType}
 * travel with the message so every provider can tag or log it.
 */
public record EmailMessage(
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    UUID tenantId,
    String eventType) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    if (htmlBody == null && plainTextBody == null) {
      throw new IllegalArgumentException("Email needs an HTML or a plain-text body");
    }
  }

  public static EmailMessage forTenant(
      String to, RenderedEmail rendered, UUID tenantId, String eventType) {
    return new EmailMessage(
        to,
        rendered.subject(),
        rendered.htmlBody(),
        rendered.plainTextBody(),
        tenantId,
        eventType);
  }
}

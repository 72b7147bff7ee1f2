package io.stockflow.backend.integration.email;

/** Outbound channel for billing notices. */
public interface EmailProvider {

  /** Short identifier of the transport, "smtp" or "noop". */
  String providerId();

  /** Never throws for delivery problems; they are reported through {@link SendResult}. */
  SendResult sendEmail(EmailMessage message);
}

package io.stockflow.backend.integration.email;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/** Used when no SMTP host is configured: billing notices are logged and reported as sent. */
@Component
@ConditionalOnMissingBean(SmtpEmailProvider.class)
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info(
        "Email delivery disabled, dropping {} notice for tenant {} to {}: '{}'",
        message.eventType(),
        message.tenantId(),
        message.to(),
        message.subject());
    return new SendResult(true, null, null);
  }
}

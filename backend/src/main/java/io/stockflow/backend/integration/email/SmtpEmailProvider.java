package io.stockflow.backend.integration.email;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/** Delivers billing notices over SMTP. Active only when {@code spring.mail.host} is set. */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpEmailProvider implements EmailProvider {

  static final String TENANT_HEADER = "X-StockFlow-Tenant";
  static final String EVENT_HEADER = "X-StockFlow-Event";

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;
  private final String senderName;

  public SmtpEmailProvider(
      JavaMailSender mailSender,
      @Value("${stockflow.email.sender-address}") String senderAddress,
      @Value("${stockflow.email.sender-name:StockFlow}") String senderName) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
    this.senderName = senderName;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      var helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      helper.setFrom(senderAddress, senderName);
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      if (message.htmlBody() == null) {
        helper.setText(message.plainTextBody(), false);
      } else if (message.plainTextBody() == null) {
        helper.setText(message.htmlBody(), true);
      } else {
        helper.setText(message.plainTextBody(), message.htmlBody());
      }
      if (message.tenantId() != null) {
        mimeMessage.setHeader(TENANT_HEADER, message.tenantId().toString());
      }
      if (message.eventType() != null) {
        mimeMessage.setHeader(EVENT_HEADER, message.eventType());
      }
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug(
          "Sent {} email for tenant {} to {} (Message-ID {})",
          message.eventType(),
          message.tenantId(),
          message.to(),
          messageId);
      return new SendResult(true, messageId, null);
    } catch (MailException | MessagingException | UnsupportedEncodingException e) {
      log.error(
          "SMTP delivery of {} email to {} failed: {}",
          message.eventType(),
          message.to(),
          e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }
}

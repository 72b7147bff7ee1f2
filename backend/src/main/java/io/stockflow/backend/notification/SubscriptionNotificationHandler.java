package io.stockflow.backend.notification;

import io.stockflow.backend.config.BillingConfig.BillingProperties;
import io.stockflow.backend.event.RecurringChargeFailedEvent;
import io.stockflow.backend.event.SubscriptionActivatedEvent;
import io.stockflow.backend.event.SubscriptionEvent;
import io.stockflow.backend.event.SubscriptionExpiredEvent;
import io.stockflow.backend.event.SubscriptionExpiringEvent;
import io.stockflow.backend.event.SubscriptionPlanChangedEvent;
import io.stockflow.backend.event.SubscriptionSuspendedEvent;
import io.stockflow.backend.integration.email.EmailMessage;
import io.stockflow.backend.integration.email.EmailProvider;
import io.stockflow.backend.notification.template.EmailTemplateRenderer;
import io.stockflow.backend.plan.PlanCatalog;
import io.stockflow.backend.plan.SubscriptionPlan;
import io.stockflow.backend.tenant.Tenant;
import io.stockflow.backend.tenant.TenantRepository;
import io.stockflow.backend.user.User;
import io.stockflow.backend.user.UserRepository;
import io.stockflow.backend.user.UserRole;
import io.stockflow.backend.user.UserStatus;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Tells a tenant's active admins about subscription changes, by email and in-app notification.
 * Handlers run after the publishing transaction commits, or immediately when the event comes from a
 * scheduled job outside a transaction. A failed delivery to one admin never affects the others or
 * the billing change that triggered it.
 */
@Component
public class SubscriptionNotificationHandler {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionNotificationHandler.class);

  private static final ZoneId BILLING_ZONE = ZoneId.of("America/Bogota");
  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("d 'de' MMMM 'de' yyyy", Locale.forLanguageTag("es-CO"))
          .withZone(BILLING_ZONE);

  private final UserRepository userRepository;
  private final TenantRepository tenantRepository;
  private final NotificationService notificationService;
  private final EmailTemplateRenderer templateRenderer;
  private final EmailProvider emailProvider;
  private final BillingProperties billingProperties;

  public SubscriptionNotificationHandler(
      UserRepository userRepository,
      TenantRepository tenantRepository,
      NotificationService notificationService,
      EmailTemplateRenderer templateRenderer,
      EmailProvider emailProvider,
      BillingProperties billingProperties) {
    this.userRepository = userRepository;
    this.tenantRepository = tenantRepository;
    this.notificationService = notificationService;
    this.templateRenderer = templateRenderer;
    this.emailProvider = emailProvider;
    this.billingProperties = billingProperties;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onActivated(SubscriptionActivatedEvent event) {
    String planName = displayName(event.plan());
    var vars = new HashMap<String, Object>();
    vars.put("planName", planName);
    vars.put("endDate", formatDate(event.endDate()));
    vars.put("renewal", event.renewal());
    String title =
        event.renewal()
            ? "Tu plan " + planName + " fue renovado"
            : "Tu plan " + planName + " está activo";
    notifyAdmins(
        event,
        new Notice(
            "subscription-activated",
            title,
            "Vigente hasta el " + formatDate(event.endDate()) + ".",
            vars));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onSuspended(SubscriptionSuspendedEvent event) {
    var vars = new HashMap<String, Object>();
    vars.put("planName", displayName(event.plan()));
    vars.put("reason", event.reason());
    notifyAdmins(
        event,
        new Notice(
            "subscription-suspended",
            "Tu suscripción fue suspendida",
            "Motivo: " + event.reason(),
            vars));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onPlanChanged(SubscriptionPlanChangedEvent event) {
    var vars = new HashMap<String, Object>();
    vars.put("previousPlanName", displayName(event.previousPlan()));
    vars.put("planName", displayName(event.newPlan()));
    notifyAdmins(
        event,
        new Notice(
            "subscription-plan-changed",
            "Tu plan cambió a " + displayName(event.newPlan()),
            "Plan anterior: " + displayName(event.previousPlan()) + ".",
            vars));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onExpiring(SubscriptionExpiringEvent event) {
    var vars = new HashMap<String, Object>();
    vars.put("planName", displayName(event.plan()));
    vars.put("endDate", formatDate(event.endDate()));
    vars.put("daysRemaining", event.daysRemaining());
    String title =
        event.daysRemaining() == 1
            ? "Tu suscripción vence mañana"
            : "Tu suscripción vence en " + event.daysRemaining() + " días";
    notifyAdmins(
        event,
        new Notice(
            "subscription-expiring",
            title,
            "Renueva antes del " + formatDate(event.endDate()) + " para no perder el acceso.",
            vars));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onExpired(SubscriptionExpiredEvent event) {
    var vars = new HashMap<String, Object>();
    vars.put("planName", displayName(event.plan()));
    vars.put("endDate", formatDate(event.endDate()));
    notifyAdmins(
        event,
        new Notice(
            "subscription-expired",
            "Tu suscripción ha vencido",
            "Tu plan " + displayName(event.plan()) + " venció el " + formatDate(event.endDate()),
            vars));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onRecurringChargeFailed(RecurringChargeFailedEvent event) {
    var vars = new HashMap<String, Object>();
    vars.put("planName", displayName(event.plan()));
    vars.put("endDate", formatDate(event.endDate()));
    vars.put("reason", event.reason());
    notifyAdmins(
        event,
        new Notice(
            "recurring-charge-failed",
            "No pudimos renovar tu suscripción",
            "El cobro automático fue rechazado. Actualiza tu método de pago antes del "
                + formatDate(event.endDate())
                + ".",
            vars));
  }

  private void notifyAdmins(SubscriptionEvent event, Notice notice) {
    List<User> admins;
    try {
      admins =
          userRepository.findByTenantIdAndRoleAndStatus(
              event.tenantId(), UserRole.ADMIN, UserStatus.ACTIVE);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to load admins for {} event, tenant {}", event.eventType(), event.tenantId(), e);
      return;
    }

    if (admins.isEmpty()) {
      log.info(
          "No active admins for tenant {}, sending {} to the billing email only",
          event.tenantId(),
          event.eventType());
      emailBillingContact(event, notice);
      return;
    }

    for (User admin : admins) {
      sendEmail(event, notice, admin.getEmail(), admin.getFirstName());
      try {
        notificationService.createNotification(
            event.tenantId(), admin.getId(), event.eventType(), notice.title(), notice.body());
      } catch (RuntimeException e) {
        log.warn(
            "Failed to create {} notification for user {}", event.eventType(), admin.getId(), e);
      }
    }
  }

  private void emailBillingContact(SubscriptionEvent event, Notice notice) {
    try {
      tenantRepository
          .findById(event.tenantId())
          .map(Tenant::getBillingEmail)
          .filter(email -> !email.isBlank())
          .ifPresent(email -> sendEmail(event, notice, email, null));
    } catch (RuntimeException e) {
      log.warn("Failed to load billing contact for tenant {}", event.tenantId(), e);
    }
  }

  private void sendEmail(SubscriptionEvent event, Notice notice, String to, String firstName) {
    try {
      Map<String, Object> context = new HashMap<>(notice.variables());
      context.put("subject", notice.title());
      context.put("recipientName", firstName);
      context.put("billingUrl", billingProperties.frontendUrl() + "/billing");
      var rendered = templateRenderer.render(notice.template(), context);
      var result =
          emailProvider.sendEmail(
              EmailMessage.forTenant(to, rendered, event.tenantId(), event.eventType()));
      if (!result.success()) {
        log.warn("Email for {} to {} not sent: {}", event.eventType(), to, result.errorMessage());
      }
    } catch (RuntimeException e) {
      log.warn("Failed to send {} email to {}", event.eventType(), to, e);
    }
  }

  private static String displayName(SubscriptionPlan plan) {
    return plan == null ? "" : PlanCatalog.limitsOf(plan).displayName();
  }

  private static String formatDate(Instant instant) {
    return instant == null ? "" : DATE_FORMAT.format(instant);
  }

  private record Notice(
      String template, String title, String body, Map<String, Object> variables) {}
}

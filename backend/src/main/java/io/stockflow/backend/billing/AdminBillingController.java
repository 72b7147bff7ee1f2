package io.stockflow.backend.billing;

import io.stockflow.backend.billing.RecurringBillingScheduledJob.RecurringBillingSummary;
import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.billing.SubscriptionAdminService.SubscriptionSummary;
import io.stockflow.backend.billing.SubscriptionBillingService.SubscriptionStatusResponse;
import io.stockflow.backend.billing.SubscriptionExpiryScheduledJob.ExpiryCheckSummary;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints, authenticated by API key. */
@RestController
@RequestMapping("/internal/billing")
public class AdminBillingController {

  private static final Logger log = LoggerFactory.getLogger(AdminBillingController.class);

  private final SubscriptionLifecycleService lifecycleService;
  private final SubscriptionBillingService billingService;
  private final SubscriptionAdminService adminService;
  private final RecurringBillingScheduledJob recurringBillingJob;
  private final SubscriptionExpiryScheduledJob expiryJob;

  public AdminBillingController(
      SubscriptionLifecycleService lifecycleService,
      SubscriptionBillingService billingService,
      SubscriptionAdminService adminService,
      RecurringBillingScheduledJob recurringBillingJob,
      SubscriptionExpiryScheduledJob expiryJob) {
    this.lifecycleService = lifecycleService;
    this.billingService = billingService;
    this.adminService = adminService;
    this.recurringBillingJob = recurringBillingJob;
    this.expiryJob = expiryJob;
  }

  @PostMapping("/tenants/{tenantId}/activate")
  public ResponseEntity<SubscriptionStatusResponse> activate(
      @PathVariable UUID tenantId, @Valid @RequestBody ActivateRequest request) {
    log.info(
        "Received activate: tenantId={}, plan={}, period={}",
        tenantId,
        request.plan(),
        request.period());
    lifecycleService.activate(tenantId, request.plan(), request.period());
    return ResponseEntity.ok(billingService.getSubscriptionStatus(tenantId));
  }

  @PostMapping("/tenants/{tenantId}/suspend")
  public ResponseEntity<SubscriptionStatusResponse> suspend(
      @PathVariable UUID tenantId, @Valid @RequestBody SuspendRequest request) {
    log.info("Received suspend: tenantId={}, reason={}", tenantId, request.reason());
    lifecycleService.suspend(tenantId, request.reason());
    return ResponseEntity.ok(billingService.getSubscriptionStatus(tenantId));
  }

  @PostMapping("/tenants/{tenantId}/reactivate")
  public ResponseEntity<SubscriptionStatusResponse> reactivate(@PathVariable UUID tenantId) {
    log.info("Received reactivate: tenantId={}", tenantId);
    lifecycleService.reactivate(tenantId);
    return ResponseEntity.ok(billingService.getSubscriptionStatus(tenantId));
  }

  @PostMapping("/tenants/{tenantId}/change-plan")
  public ResponseEntity<SubscriptionStatusResponse> changePlan(
      @PathVariable UUID tenantId, @Valid @RequestBody ChangePlanRequest request) {
    log.info("Received change-plan: tenantId={}, plan={}", tenantId, request.plan());
    lifecycleService.changePlan(tenantId, request.plan());
    return ResponseEntity.ok(billingService.getSubscriptionStatus(tenantId));
  }

  @PostMapping("/tenants/{tenantId}/charge")
  public ResponseEntity<SubscriptionStatusResponse> charge(@PathVariable UUID tenantId) {
    log.info("Received manual recurring charge: tenantId={}", tenantId);
    return ResponseEntity.ok(billingService.chargeRecurring(tenantId));
  }

  @GetMapping("/subscriptions")
  public ResponseEntity<List<SubscriptionSummary>> getSubscriptions(
      @RequestParam(required = false) SubscriptionStatus status) {
    return ResponseEntity.ok(adminService.getSubscriptions(status));
  }

  @GetMapping("/subscriptions/expiring")
  public ResponseEntity<List<SubscriptionSummary>> getExpiringSubscriptions(
      @RequestParam(defaultValue = "7") @Min(1) @Max(365) int days) {
    return ResponseEntity.ok(adminService.getExpiringSubscriptions(days));
  }

  @PostMapping("/jobs/recurring-billing")
  public ResponseEntity<RecurringBillingSummary> runRecurringBilling() {
    log.info("Received manual recurring billing run");
    return ResponseEntity.ok(recurringBillingJob.execute());
  }

  @PostMapping("/jobs/expiry-check")
  public ResponseEntity<ExpiryCheckSummary> runExpiryCheck() {
    log.info("Received manual expiry check run");
    return ResponseEntity.ok(expiryJob.execute());
  }

  public record ActivateRequest(
      @NotNull(message = "plan is required") SubscriptionPlan plan,
      @NotNull(message = "period is required") SubscriptionPeriod period) {}

  public record SuspendRequest(@NotBlank(message = "reason is required") String reason) {}

  public record ChangePlanRequest(@NotNull(message = "plan is required") SubscriptionPlan plan) {}
}

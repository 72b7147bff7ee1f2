package io.stockflow.backend.billing;

import io.stockflow.backend.billing.SubscriptionBillingService.BillingTransactionResponse;
import io.stockflow.backend.billing.SubscriptionBillingService.CheckoutConfigResponse;
import io.stockflow.backend.billing.SubscriptionBillingService.PaymentSourceResponse;
import io.stockflow.backend.billing.SubscriptionBillingService.PlanOffer;
import io.stockflow.backend.billing.SubscriptionBillingService.SubscriptionStatusResponse;
import io.stockflow.backend.multitenancy.RequestScopes;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/billing")
public class BillingController {

  private static final String ANY_MEMBER =
      "hasAnyRole('SUPER_ADMIN', 'ADMIN', 'MANAGER', 'EMPLOYEE', 'CONTADOR')";
  private static final String BILLING_ADMIN = "hasAnyRole('SUPER_ADMIN', 'ADMIN')";

  private final SubscriptionBillingService billingService;

  public BillingController(SubscriptionBillingService billingService) {
    this.billingService = billingService;
  }

  @GetMapping("/status")
  @PreAuthorize(ANY_MEMBER)
  public ResponseEntity<SubscriptionStatusResponse> getStatus() {
    return ResponseEntity.ok(billingService.getSubscriptionStatus(RequestScopes.requireTenantId()));
  }

  @GetMapping("/plans")
  @PreAuthorize(ANY_MEMBER)
  public ResponseEntity<List<PlanOffer>> getPlans() {
    return ResponseEntity.ok(billingService.getPlans());
  }

  @GetMapping("/checkout-config")
  @PreAuthorize(BILLING_ADMIN)
  public ResponseEntity<CheckoutConfigResponse> getCheckoutConfig(
      @RequestParam SubscriptionPlan plan, @RequestParam SubscriptionPeriod period) {
    return ResponseEntity.ok(
        billingService.getCheckoutConfig(RequestScopes.requireTenantId(), plan, period));
  }

  @PostMapping("/verify-payment")
  @PreAuthorize(BILLING_ADMIN)
  public ResponseEntity<SubscriptionStatusResponse> verifyPayment(
      @Valid @RequestBody VerifyPaymentRequest request) {
    return ResponseEntity.ok(
        billingService.verifyPayment(
            RequestScopes.requireTenantId(),
            request.transactionId(),
            request.plan(),
            request.period()));
  }

  @PostMapping("/payment-source")
  @PreAuthorize(BILLING_ADMIN)
  public ResponseEntity<PaymentSourceResponse> createPaymentSource(
      @Valid @RequestBody CreatePaymentSourceRequest request) {
    return ResponseEntity.ok(
        billingService.createPaymentSource(
            RequestScopes.requireTenantId(),
            request.token(),
            request.acceptanceToken(),
            request.personalAuthToken()));
  }

  @DeleteMapping("/payment-source")
  @PreAuthorize(BILLING_ADMIN)
  public ResponseEntity<Void> removePaymentSource() {
    billingService.removePaymentSource(RequestScopes.requireTenantId());
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/history")
  @PreAuthorize(BILLING_ADMIN)
  public ResponseEntity<List<BillingTransactionResponse>> getHistory() {
    return ResponseEntity.ok(billingService.getBillingHistory(RequestScopes.requireTenantId()));
  }

  public record VerifyPaymentRequest(
      @NotBlank(message = "transactionId is required") String transactionId,
      @NotNull(message = "plan is required") SubscriptionPlan plan,
      @NotNull(message = "period is required") SubscriptionPeriod period) {}

  public record CreatePaymentSourceRequest(
      @NotBlank(message = "token is required") String token,
      @NotBlank(message = "acceptanceToken is required") String acceptanceToken,
      String personalAuthToken) {}
}

package io.stockflow.backend.billing;

import static io.stockflow.backend.billing.BillingFixtures.gatewayTransaction;
import static io.stockflow.backend.billing.BillingFixtures.subscription;
import static io.stockflow.backend.billing.BillingFixtures.tenant;
import static io.stockflow.backend.billing.BillingFixtures.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.stockflow.backend.integration.payment.PaymentStatus;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import io.stockflow.backend.tenant.TenantRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PaymentSettlementServiceTest {

  private static final Instant NOW = Instant.parse("2026-05-10T14:30:00Z");
  private static final UUID TENANT_ID = UUID.randomUUID();

  @Mock private BillingTransactionRepository transactionRepository;
  @Mock private SubscriptionRepository subscriptionRepository;
  @Mock private TenantRepository tenantRepository;
  @Mock private SubscriptionLifecycleService lifecycleService;

  private PaymentSettlementService settlementService;

  @BeforeEach
  void setUp() {
    settlementService =
        new PaymentSettlementService(
            transactionRepository,
            subscriptionRepository,
            tenantRepository,
            lifecycleService,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private BillingTransaction checkoutRow(SubscriptionPlan plan, PaymentStatus status) {
    var row =
        BillingTransaction.checkout(
            TENANT_ID,
            null,
            plan,
            SubscriptionPeriod.MONTHLY,
            gatewayTransaction("tx-" + status, status, "SF-a-1", 100L),
            NOW);
    return withId(row, UUID.randomUUID());
  }

  @Test
  void settle_approvedCheckoutWithoutSubscription_activatesPlan() {
    var row = checkoutRow(SubscriptionPlan.PRO, PaymentStatus.APPROVED);
    var activated = subscription(TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY, NOW);
    var tenant = tenant(TENANT_ID);
    when(transactionRepository.findForUpdate(row.getId())).thenReturn(Optional.of(row));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.empty());
    when(lifecycleService.activate(TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY))
        .thenReturn(activated);
    when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.of(tenant));

    var result = settlementService.settle(row.getId(), "pagos@tornillo.co");

    assertThat(result).containsSame(activated);
    assertThat(row.isApplied()).isTrue();
    assertThat(row.getAppliedAt()).isEqualTo(NOW);
    assertThat(row.getSubscriptionId()).isEqualTo(activated.getId());
    assertThat(tenant.getBillingEmail()).isEqualTo("pagos@tornillo.co");
    verify(transactionRepository).save(row);
  }

  @Test
  void settle_approvedCheckoutOnActiveSamePlan_extendsInsteadOfRestarting() {
    var row = checkoutRow(SubscriptionPlan.PYME, PaymentStatus.APPROVED);
    var current =
        subscription(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, NOW);
    when(transactionRepository.findForUpdate(row.getId())).thenReturn(Optional.of(row));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(current));
    when(lifecycleService.extend(TENANT_ID, SubscriptionPeriod.MONTHLY)).thenReturn(current);

    var result = settlementService.settle(row.getId(), null);

    assertThat(result).containsSame(current);
    verify(lifecycleService).extend(TENANT_ID, SubscriptionPeriod.MONTHLY);
    verifyNoInteractions(tenantRepository);
  }

  @Test
  void settle_approvedCheckoutForOtherPlan_activatesNewPlan() {
    var row = checkoutRow(SubscriptionPlan.PLUS, PaymentStatus.APPROVED);
    var current =
        subscription(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, NOW);
    var activated =
        subscription(TENANT_ID, SubscriptionPlan.PLUS, SubscriptionPeriod.MONTHLY, NOW);
    when(transactionRepository.findForUpdate(row.getId())).thenReturn(Optional.of(row));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(current));
    when(lifecycleService.activate(TENANT_ID, SubscriptionPlan.PLUS, SubscriptionPeriod.MONTHLY))
        .thenReturn(activated);

    assertThat(settlementService.settle(row.getId(), " ")).containsSame(activated);
  }

  @Test
  void settle_sameRowTwice_appliesOnlyOnce() {
    var row = checkoutRow(SubscriptionPlan.PRO, PaymentStatus.APPROVED);
    var activated = subscription(TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY, NOW);
    when(transactionRepository.findForUpdate(row.getId())).thenReturn(Optional.of(row));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.empty());
    when(lifecycleService.activate(TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY))
        .thenReturn(activated);

    var first = settlementService.settle(row.getId(), null);
    var second = settlementService.settle(row.getId(), null);

    assertThat(first).isPresent();
    assertThat(second).isEmpty();
    verify(lifecycleService, times(1)).activate(any(), any(), any());
    verify(transactionRepository, times(1)).save(row);
  }

  @Test
  void settle_declinedRow_changesNothing() {
    var row = checkoutRow(SubscriptionPlan.PRO, PaymentStatus.DECLINED);
    when(transactionRepository.findForUpdate(row.getId())).thenReturn(Optional.of(row));

    assertThat(settlementService.settle(row.getId(), "pagos@tornillo.co")).isEmpty();
    assertThat(row.isApplied()).isFalse();
    verifyNoInteractions(lifecycleService, subscriptionRepository, tenantRepository);
  }

  private BillingTransaction approvedRenewalClaim() {
    var claim =
        withId(
            BillingTransaction.recurringClaim(
                TENANT_ID,
                UUID.randomUUID(),
                SubscriptionPlan.PYME,
                SubscriptionPeriod.ANNUAL,
                143_904_000L,
                "COP",
                "SF-a-2",
                NOW,
                NOW),
            UUID.randomUUID());
    claim.applyGatewayState(
        gatewayTransaction("tx-r", PaymentStatus.APPROVED, "SF-a-2", 143_904_000L), NOW);
    return claim;
  }

  @Test
  void settle_approvedRecurringClaim_extendsByClaimPeriod() {
    var claim = approvedRenewalClaim();
    var current =
        subscription(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.ANNUAL, NOW);
    when(transactionRepository.findForUpdate(claim.getId())).thenReturn(Optional.of(claim));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(current));
    when(lifecycleService.extend(TENANT_ID, SubscriptionPeriod.ANNUAL)).thenReturn(current);

    assertThat(settlementService.settle(claim.getId(), null)).containsSame(current);
    verify(lifecycleService, never()).activate(any(), any(), any());
  }

  @Test
  void settle_renewalApprovedAfterSuspension_startsNewPeriodInsteadOfFailing() {
    var claim = approvedRenewalClaim();
    var suspended =
        subscription(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.ANNUAL, NOW);
    suspended.suspend("Chargeback", NOW);
    var reactivated =
        subscription(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.ANNUAL, NOW);
    when(transactionRepository.findForUpdate(claim.getId())).thenReturn(Optional.of(claim));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(suspended));
    when(lifecycleService.activate(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.ANNUAL))
        .thenReturn(reactivated);

    assertThat(settlementService.settle(claim.getId(), null)).containsSame(reactivated);
    assertThat(claim.isApplied()).isTrue();
    assertThat(claim.getSubscriptionId()).isEqualTo(reactivated.getId());
    verify(lifecycleService, never()).extend(any(), any());
  }

  @Test
  void settle_renewalApprovedAfterExpiry_startsNewPeriod() {
    var claim = approvedRenewalClaim();
    var expired =
        subscription(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.ANNUAL, NOW);
    expired.expire(NOW);
    when(transactionRepository.findForUpdate(claim.getId())).thenReturn(Optional.of(claim));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(expired));
    when(lifecycleService.activate(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.ANNUAL))
        .thenReturn(expired);

    assertThat(settlementService.settle(claim.getId(), null)).isPresent();
    assertThat(claim.isApplied()).isTrue();
  }

  @Test
  void settle_unknownRow_returnsEmpty() {
    var id = UUID.randomUUID();
    when(transactionRepository.findForUpdate(id)).thenReturn(Optional.empty());

    assertThat(settlementService.settle(id, null)).isEmpty();
    verifyNoInteractions(lifecycleService);
  }
}

package io.stockflow.backend.billing;

import static io.stockflow.backend.billing.BillingFixtures.subscription;
import static io.stockflow.backend.billing.BillingFixtures.tenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.event.SubscriptionActivatedEvent;
import io.stockflow.backend.event.SubscriptionExpiredEvent;
import io.stockflow.backend.event.SubscriptionPlanChangedEvent;
import io.stockflow.backend.event.SubscriptionSuspendedEvent;
import io.stockflow.backend.exception.InvalidStateException;
import io.stockflow.backend.exception.ResourceNotFoundException;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import io.stockflow.backend.tenant.TenantRepository;
import io.stockflow.backend.tenant.TenantStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class SubscriptionLifecycleServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");
  private static final UUID TENANT_ID = UUID.fromString("a1b2c3d4-0000-0000-0000-000000000001");

  @Mock private SubscriptionRepository subscriptionRepository;
  @Mock private TenantRepository tenantRepository;
  @Mock private ApplicationEventPublisher eventPublisher;

  private SubscriptionLifecycleService service;

  @BeforeEach
  void setUp() {
    service =
        new SubscriptionLifecycleService(
            subscriptionRepository,
            tenantRepository,
            eventPublisher,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static Instant daysAgo(int days) {
    return NOW.minus(Duration.ofDays(days));
  }

  private void saveReturnsArgument() {
    when(subscriptionRepository.save(any(Subscription.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  // --- activate ---

  @Test
  void activate_withoutSubscription_createsActivePeriodAndAppliesQuotas() {
    var tenant = tenant(TENANT_ID);
    when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.of(tenant));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.empty());
    saveReturnsArgument();

    var subscription =
        service.activate(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.QUARTERLY);

    assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
    assertThat(subscription.getStartDate()).isEqualTo(NOW);
    assertThat(subscription.getEndDate()).isEqualTo(NOW.plus(Duration.ofDays(90)));
    assertThat(tenant.getPlan()).isEqualTo(SubscriptionPlan.PYME);
    assertThat(tenant.getMaxWarehouses()).isEqualTo(2);
    assertThat(tenant.getMaxEmployees()).isEqualTo(15);
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.ACTIVE);

    var event = ArgumentCaptor.forClass(SubscriptionActivatedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().renewal()).isFalse();
    assertThat(event.getValue().eventType()).isEqualTo("subscription.activated");
    assertThat(event.getValue().endDate()).isEqualTo(subscription.getEndDate());
  }

  @Test
  void activate_fromExpired_restartsPeriodAndReactivatesTenant() {
    var tenant = tenant(TENANT_ID);
    tenant.suspend();
    var existing =
        subscription(
            TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY, daysAgo(60));
    existing.expire(daysAgo(29));
    when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.of(tenant));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));
    saveReturnsArgument();

    var subscription =
        service.activate(TENANT_ID, SubscriptionPlan.PLUS, SubscriptionPeriod.ANNUAL);

    assertThat(subscription).isSameAs(existing);
    assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
    assertThat(subscription.getPlan()).isEqualTo(SubscriptionPlan.PLUS);
    assertThat(subscription.getEndDate()).isEqualTo(NOW.plus(Duration.ofDays(365)));
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.ACTIVE);
    assertThat(tenant.getMaxEmployees()).isEqualTo(-1);
  }

  @Test
  void activate_unknownTenant_throwsNotFound() {
    when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.activate(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(eventPublisher);
  }

  // --- extend ---

  @Test
  void extend_beforeEndDate_addsPeriodToCurrentEnd() {
    var existing =
        subscription(
            TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, daysAgo(28));
    Instant previousEnd = existing.getEndDate();
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));
    saveReturnsArgument();

    var subscription = service.extend(TENANT_ID, SubscriptionPeriod.MONTHLY);

    assertThat(subscription.getEndDate()).isEqualTo(previousEnd.plus(Duration.ofDays(30)));
    assertThat(subscription.getStartDate()).isEqualTo(daysAgo(28));

    var event = ArgumentCaptor.forClass(SubscriptionActivatedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().renewal()).isTrue();
    assertThat(event.getValue().eventType()).isEqualTo("subscription.renewed");
  }

  @Test
  void extend_afterEndDate_restartsFromNow() {
    var existing =
        subscription(
            TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, daysAgo(32));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));
    saveReturnsArgument();

    var subscription = service.extend(TENANT_ID, SubscriptionPeriod.QUARTERLY);

    assertThat(subscription.getEndDate()).isEqualTo(NOW.plus(Duration.ofDays(90)));
    assertThat(subscription.getPeriodType()).isEqualTo(SubscriptionPeriod.QUARTERLY);
  }

  @Test
  void extend_suspendedSubscription_throwsInvalidState() {
    var existing =
        subscription(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, NOW);
    existing.suspend("Chargeback", NOW);
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));

    assertThatThrownBy(() -> service.extend(TENANT_ID, SubscriptionPeriod.MONTHLY))
        .isInstanceOf(InvalidStateException.class);
    verify(subscriptionRepository, never()).save(any());
  }

  @Test
  void extend_withoutSubscription_throwsNotFound() {
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.extend(TENANT_ID, SubscriptionPeriod.MONTHLY))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  // --- suspend / reactivate ---

  @Test
  void suspend_active_recordsReasonAndSuspendsTenant() {
    var tenant = tenant(TENANT_ID);
    var existing =
        subscription(TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY, NOW);
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));
    when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.of(tenant));
    saveReturnsArgument();

    var subscription = service.suspend(TENANT_ID, "Terms violation");

    assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.SUSPENDED);
    assertThat(subscription.getSuspendedReason()).isEqualTo("Terms violation");
    assertThat(subscription.getSuspendedAt()).isEqualTo(NOW);
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.SUSPENDED);

    var event = ArgumentCaptor.forClass(SubscriptionSuspendedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().reason()).isEqualTo("Terms violation");
  }

  @Test
  void suspend_alreadySuspended_throwsInvalidState() {
    var existing =
        subscription(TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY, NOW);
    existing.suspend("First", NOW);
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));

    assertThatThrownBy(() -> service.suspend(TENANT_ID, "Second"))
        .isInstanceOf(InvalidStateException.class);
    assertThat(existing.getSuspendedReason()).isEqualTo("First");
    verifyNoInteractions(eventPublisher);
  }

  @Test
  void reactivate_suspendedWithinPeriod_restoresActive() {
    var tenant = tenant(TENANT_ID);
    tenant.suspend();
    var existing =
        subscription(
            TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY, daysAgo(5));
    existing.suspend("Chargeback", daysAgo(1));
    Instant endDate = existing.getEndDate();
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));
    when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.of(tenant));
    saveReturnsArgument();

    var subscription = service.reactivate(TENANT_ID);

    assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
    assertThat(subscription.getSuspendedReason()).isNull();
    assertThat(subscription.getEndDate()).isEqualTo(endDate);
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.ACTIVE);
  }

  @Test
  void reactivate_afterEndDate_throwsInvalidState() {
    var existing =
        subscription(
            TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY, daysAgo(40));
    existing.suspend("Chargeback", daysAgo(20));
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));

    assertThatThrownBy(() -> service.reactivate(TENANT_ID))
        .isInstanceOf(InvalidStateException.class);
    assertThat(existing.getStatus()).isEqualTo(SubscriptionStatus.SUSPENDED);
  }

  @Test
  void reactivate_active_throwsInvalidState() {
    var existing =
        subscription(TENANT_ID, SubscriptionPlan.PRO, SubscriptionPeriod.MONTHLY, NOW);
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));

    assertThatThrownBy(() -> service.reactivate(TENANT_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  // --- changePlan ---

  @Test
  void changePlan_active_updatesQuotasAndKeepsPeriod() {
    var tenant = tenant(TENANT_ID);
    var existing =
        subscription(
            TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.ANNUAL, daysAgo(100));
    Instant endDate = existing.getEndDate();
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));
    when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.of(tenant));
    saveReturnsArgument();

    var subscription = service.changePlan(TENANT_ID, SubscriptionPlan.PRO);

    assertThat(subscription.getPlan()).isEqualTo(SubscriptionPlan.PRO);
    assertThat(subscription.getEndDate()).isEqualTo(endDate);
    assertThat(tenant.getMaxWarehouses()).isEqualTo(10);
    assertThat(tenant.getMaxUsers()).isEqualTo(4);

    var event = ArgumentCaptor.forClass(SubscriptionPlanChangedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().previousPlan()).isEqualTo(SubscriptionPlan.PYME);
    assertThat(event.getValue().newPlan()).isEqualTo(SubscriptionPlan.PRO);
  }

  @Test
  void changePlan_expired_throwsInvalidState() {
    var existing =
        subscription(TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, NOW);
    existing.expire(NOW);
    when(subscriptionRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(existing));

    assertThatThrownBy(() -> service.changePlan(TENANT_ID, SubscriptionPlan.PRO))
        .isInstanceOf(InvalidStateException.class);
  }

  // --- expire ---

  @Test
  void expire_lapsedActive_expiresAndSuspendsTenant() {
    var tenant = tenant(TENANT_ID);
    var existing =
        subscription(
            TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, daysAgo(31));
    when(subscriptionRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
    when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.of(tenant));

    boolean expired = service.expire(existing.getId());

    assertThat(expired).isTrue();
    assertThat(existing.getStatus()).isEqualTo(SubscriptionStatus.EXPIRED);
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.SUSPENDED);
    verify(eventPublisher).publishEvent(any(SubscriptionExpiredEvent.class));
  }

  @Test
  void expire_renewedSinceSelection_returnsFalse() {
    var existing =
        subscription(
            TENANT_ID, SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, daysAgo(5));
    when(subscriptionRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

    boolean expired = service.expire(existing.getId());

    assertThat(expired).isFalse();
    assertThat(existing.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
    verifyNoInteractions(tenantRepository, eventPublisher);
  }
}

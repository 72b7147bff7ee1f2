package io.stockflow.backend.billing;

import static io.stockflow.backend.billing.BillingFixtures.subscription;
import static io.stockflow.backend.billing.BillingFixtures.tenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.billing.SubscriptionAdminService.SubscriptionSummary;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import io.stockflow.backend.tenant.TenantRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubscriptionAdminServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-01T12:00:00Z");

  @Mock private SubscriptionRepository subscriptionRepository;
  @Mock private TenantRepository tenantRepository;

  private SubscriptionAdminService service;

  @BeforeEach
  void setUp() {
    service =
        new SubscriptionAdminService(
            subscriptionRepository, tenantRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void getSubscriptions_withoutFilter_listsAllWithTenantNames() {
    var tenantA = tenant(UUID.randomUUID());
    tenantA.attachPaymentSource("3891");
    var subA =
        subscription(tenantA.getId(), SubscriptionPlan.PYME, SubscriptionPeriod.MONTHLY, NOW);
    var orphan =
        subscription(UUID.randomUUID(), SubscriptionPlan.PRO, SubscriptionPeriod.ANNUAL, NOW);
    when(subscriptionRepository.findAllByOrderByEndDateAsc()).thenReturn(List.of(subA, orphan));
    when(tenantRepository.findAllById(List.of(tenantA.getId(), orphan.getTenantId())))
        .thenReturn(List.of(tenantA));

    var summaries = service.getSubscriptions(null);

    assertThat(summaries)
        .extracting(SubscriptionSummary::tenantName, SubscriptionSummary::hasPaymentSource)
        .containsExactly(tuple(tenantA.getName(), true), tuple(null, false));
  }

  @Test
  void getSubscriptions_withStatus_filtersByStatus() {
    when(subscriptionRepository.findByStatusOrderByEndDateAsc(SubscriptionStatus.SUSPENDED))
        .thenReturn(List.of());
    when(tenantRepository.findAllById(List.of())).thenReturn(List.of());

    assertThat(service.getSubscriptions(SubscriptionStatus.SUSPENDED)).isEmpty();
  }

  @Test
  void getExpiringSubscriptions_queriesActiveWithinDays() {
    when(subscriptionRepository.findByStatusAndEndDateBetween(
            SubscriptionStatus.ACTIVE, NOW, NOW.plus(Duration.ofDays(7))))
        .thenReturn(List.of());
    when(tenantRepository.findAllById(List.of())).thenReturn(List.of());

    service.getExpiringSubscriptions(7);

    verify(subscriptionRepository)
        .findByStatusAndEndDateBetween(
            SubscriptionStatus.ACTIVE, NOW, NOW.plus(Duration.ofDays(7)));
  }
}

package io.stockflow.backend.billing;

import static org.assertj.core.api.Assertions.assertThat;

import io.stockflow.backend.TestcontainersConfiguration;
import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import io.stockflow.backend.plan.SubscriptionPeriod;
import io.stockflow.backend.plan.SubscriptionPlan;
import io.stockflow.backend.tenant.Tenant;
import io.stockflow.backend.tenant.TenantRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.ReflectionTestUtils;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Window boundaries of the scheduler queries. Each test works in its own far-off time range so
 * rows from other tests never fall inside the window under test.
 */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SubscriptionRepositoryIntegrationTest {

  @Autowired private SubscriptionRepository subscriptionRepository;
  @Autowired private TenantRepository tenantRepository;
  @Autowired private Flyway flyway;

  private Subscription endingAt(Instant endDate, boolean withCard, SubscriptionStatus status) {
    var tenant = new Tenant("org_" + UUID.randomUUID(), "Papelería Central");
    if (withCard) {
      tenant.attachPaymentSource("ps_" + UUID.randomUUID());
    }
    tenant = tenantRepository.saveAndFlush(tenant);
    var subscription =
        new Subscription(
            tenant.getId(),
            SubscriptionPlan.PYME,
            SubscriptionPeriod.MONTHLY,
            endDate.minus(Duration.ofDays(30)));
    ReflectionTestUtils.setField(subscription, "endDate", endDate);
    if (status == SubscriptionStatus.SUSPENDED) {
      subscription.suspend("Contracargo", endDate.minus(Duration.ofDays(1)));
    } else if (status == SubscriptionStatus.EXPIRED) {
      subscription.expire(endDate);
    }
    return subscriptionRepository.saveAndFlush(subscription);
  }

  private static List<UUID> ids(List<Subscription> subscriptions) {
    return subscriptions.stream().map(Subscription::getId).toList();
  }

  @Test
  void schema_isMigratedByFlywayAndAcceptedByHibernateValidation() {
    assertThat(flyway.info().current()).isNotNull();
    assertThat(flyway.info().current().getVersion().getVersion()).isEqualTo("1");
    assertThat(flyway.info().pending()).isEmpty();
  }

  @Test
  void findRenewalCandidates_includesBothEndsOfTheWindow() {
    Instant from = Instant.parse("2030-01-10T06:00:00Z");
    Instant until = from.plus(Duration.ofDays(3));
    var atFrom = endingAt(from, true, SubscriptionStatus.ACTIVE);
    var atUntil = endingAt(until, true, SubscriptionStatus.ACTIVE);
    var beforeFrom = endingAt(from.minusSeconds(1), true, SubscriptionStatus.ACTIVE);
    var afterUntil = endingAt(until.plusSeconds(1), true, SubscriptionStatus.ACTIVE);

    var candidates =
        ids(subscriptionRepository.findRenewalCandidates(SubscriptionStatus.ACTIVE, from, until));

    assertThat(candidates).containsExactly(atFrom.getId(), atUntil.getId());
    assertThat(candidates).doesNotContain(beforeFrom.getId(), afterUntil.getId());
  }

  @Test
  void findRenewalCandidates_skipsTenantsWithoutCardAndInactiveSubscriptions() {
    Instant from = Instant.parse("2030-02-10T06:00:00Z");
    Instant until = from.plus(Duration.ofDays(3));
    Instant endDate = from.plus(Duration.ofDays(1));
    var withCard = endingAt(endDate, true, SubscriptionStatus.ACTIVE);
    endingAt(endDate, false, SubscriptionStatus.ACTIVE);
    endingAt(endDate, true, SubscriptionStatus.SUSPENDED);
    endingAt(endDate, true, SubscriptionStatus.EXPIRED);

    assertThat(
            ids(
                subscriptionRepository.findRenewalCandidates(
                    SubscriptionStatus.ACTIVE, from, until)))
        .containsExactly(withCard.getId());
  }

  @Test
  void findByStatusAndEndDateBetween_isHalfOpen() {
    Instant from = Instant.parse("2030-03-10T09:00:00Z");
    Instant to = from.plus(Duration.ofDays(1));
    var atFrom = endingAt(from, false, SubscriptionStatus.ACTIVE);
    var justBeforeTo = endingAt(to.minusSeconds(1), false, SubscriptionStatus.ACTIVE);
    var atTo = endingAt(to, false, SubscriptionStatus.ACTIVE);

    var warned =
        ids(
            subscriptionRepository.findByStatusAndEndDateBetween(
                SubscriptionStatus.ACTIVE, from, to));

    assertThat(warned).containsExactly(atFrom.getId(), justBeforeTo.getId());
    assertThat(warned).doesNotContain(atTo.getId());
  }

  @Test
  void findLapsed_excludesSubscriptionEndingExactlyNow() {
    Instant now = Instant.parse("2020-04-10T09:00:00Z");
    var lapsed = endingAt(now.minusSeconds(1), false, SubscriptionStatus.ACTIVE);
    var endingNow = endingAt(now, false, SubscriptionStatus.ACTIVE);
    var alreadyExpired = endingAt(now.minus(Duration.ofDays(2)), false, SubscriptionStatus.EXPIRED);

    var found = ids(subscriptionRepository.findLapsed(SubscriptionStatus.ACTIVE, now));

    assertThat(found).contains(lapsed.getId());
    assertThat(found).doesNotContain(endingNow.getId(), alreadyExpired.getId());
  }
}

package io.stockflow.backend.billing;

import io.stockflow.backend.billing.Subscription.SubscriptionStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

  Optional<Subscription> findByTenantId(UUID tenantId);

  List<Subscription> findAllByOrderByEndDateAsc();

  List<Subscription> findByStatusOrderByEndDateAsc(SubscriptionStatus status);

  /** Subscriptions in {@code status} whose end date falls in {@code [from, to)}. */
  @Query(
      """
      SELECT s FROM Subscription s
      WHERE s.status = :status
        AND s.endDate >= :from
        AND s.endDate < :to
      ORDER BY s.endDate ASC
      """)
  List<Subscription> findByStatusAndEndDateBetween(
      @Param("status") SubscriptionStatus status,
      @Param("from") Instant from,
      @Param("to") Instant to);

  @Query(
      """
      SELECT s FROM Subscription s
      WHERE s.status = :status
        AND s.endDate < :now
      ORDER BY s.endDate ASC
      """)
  List<Subscription> findLapsed(
      @Param("status") SubscriptionStatus status, @Param("now") Instant now);

  /**
   * Subscriptions in {@code status} ending within {@code [from, until]} whose tenant has a stored
   * card.
   */
  @Query(
      """
      SELECT s FROM Subscription s
      WHERE s.status = :status
        AND s.endDate >= :from
        AND s.endDate <= :until
        AND EXISTS (
          SELECT t.id FROM Tenant t
          WHERE t.id = s.tenantId
            AND t.paymentSourceId IS NOT NULL
        )
      ORDER BY s.endDate ASC
      """)
  List<Subscription> findRenewalCandidates(
      @Param("status") SubscriptionStatus status,
      @Param("from") Instant from,
      @Param("until") Instant until);
}

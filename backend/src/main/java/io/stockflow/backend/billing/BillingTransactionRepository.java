package io.stockflow.backend.billing;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BillingTransactionRepository extends JpaRepository<BillingTransaction, UUID> {

  Optional<BillingTransaction> findByGatewayTransactionId(String gatewayTransactionId);

  /** Rows written before the gateway assigned an id, e.g. a renewal claim whose call timed out. */
  @Query(
      """
      SELECT t FROM BillingTransaction t
      WHERE t.reference = :reference
        AND t.gatewayTransactionId IS NULL
      ORDER BY t.createdAt DESC
      """)
  List<BillingTransaction> findUnboundByReference(@Param("reference") String reference);

  List<BillingTransaction> findByTenantIdOrderByCreatedAtDesc(UUID tenantId);

  @Query(
      """
      SELECT COUNT(t) > 0 FROM BillingTransaction t
      WHERE t.subscriptionId = :subscriptionId
        AND t.recurring = true
        AND t.createdAt >= :since
      """)
  boolean existsRecurringSince(
      @Param("subscriptionId") UUID subscriptionId, @Param("since") Instant since);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM BillingTransaction t WHERE t.id = :id")
  Optional<BillingTransaction> findForUpdate(@Param("id") UUID id);
}

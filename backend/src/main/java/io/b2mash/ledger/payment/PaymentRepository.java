package io.b2mash.ledger.payment;

import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PaymentRepository
    extends JpaRepository<Payment, UUID>, JpaSpecificationExecutor<Payment> {

  Optional<Payment> findByIdAndOrganizationIdAndDeletedAtIsNull(UUID id, UUID organizationId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      "SELECT p FROM Payment p WHERE p.id = :id AND p.organizationId = :organizationId"
          + " AND p.deletedAt IS NULL")
  Optional<Payment> findByIdForUpdate(
      @Param("id") UUID id, @Param("organizationId") UUID organizationId);

  /** Gateway lookups are not tenant scoped: the intent id is globally unique. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Payment p WHERE p.stripePaymentIntentId = :gatewayRequestId")
  Optional<Payment> findByGatewayRequestIdForUpdate(
      @Param("gatewayRequestId") String gatewayRequestId);

  @Query(
      "SELECT p.status AS status, p.paymentMethod AS paymentMethod, COUNT(p) AS paymentCount,"
          + " SUM(p.amount) AS amount FROM Payment p"
          + " WHERE p.organizationId = :organizationId AND p.deletedAt IS NULL"
          + " GROUP BY p.status, p.paymentMethod")
  List<PaymentTotals> summarize(@Param("organizationId") UUID organizationId);

  @Query(
      "SELECT COUNT(p) FROM Payment p WHERE p.organizationId = :organizationId"
          + " AND p.deletedAt IS NULL AND p.createdAt >= :since")
  long countCreatedSince(
      @Param("organizationId") UUID organizationId, @Param("since") Instant since);

  interface PaymentTotals {
    PaymentStatus getStatus();

    PaymentMethod getPaymentMethod();

    Long getPaymentCount();

    BigDecimal getAmount();
  }
}

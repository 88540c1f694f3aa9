package io.b2mash.ledger.payment;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefundRepository extends JpaRepository<Refund, UUID> {

  List<Refund> findByPaymentIdOrderByCreatedAt(UUID paymentId);

  @Query(
      "SELECT COALESCE(SUM(r.amount), 0) FROM Refund r"
          + " WHERE r.paymentId = :paymentId AND r.status = :status")
  BigDecimal sumAmountByPaymentIdAndStatus(
      @Param("paymentId") UUID paymentId, @Param("status") RefundStatus status);
}

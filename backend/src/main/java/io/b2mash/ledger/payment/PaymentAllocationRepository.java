package io.b2mash.ledger.payment;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PaymentAllocationRepository extends JpaRepository<PaymentAllocation, UUID> {

  boolean existsByPaymentId(UUID paymentId);

  List<PaymentAllocation> findByPaymentIdOrderByCreatedAt(UUID paymentId);
}

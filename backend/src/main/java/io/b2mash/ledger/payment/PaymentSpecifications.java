package io.b2mash.ledger.payment;

import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

/** Optional list filters; a null argument matches everything. */
final class PaymentSpecifications {

  private PaymentSpecifications() {}

  static Specification<Payment> liveInOrganization(UUID organizationId) {
    return (root, query, cb) ->
        cb.and(
            cb.equal(root.get("organizationId"), organizationId),
            cb.isNull(root.get("deletedAt")));
  }

  static Specification<Payment> forCustomer(UUID customerId) {
    return (root, query, cb) ->
        customerId == null ? cb.conjunction() : cb.equal(root.get("customerId"), customerId);
  }

  static Specification<Payment> forInvoice(UUID invoiceId) {
    return (root, query, cb) ->
        invoiceId == null ? cb.conjunction() : cb.equal(root.get("invoiceId"), invoiceId);
  }

  static Specification<Payment> withStatus(PaymentStatus status) {
    return (root, query, cb) ->
        status == null ? cb.conjunction() : cb.equal(root.get("status"), status);
  }
}

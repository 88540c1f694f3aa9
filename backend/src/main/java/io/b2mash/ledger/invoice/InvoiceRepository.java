package io.b2mash.ledger.invoice;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  Optional<Invoice> findByIdAndOrganizationIdAndDeletedAtIsNull(UUID id, UUID organizationId);

  @Query(
      "SELECT COUNT(i) > 0 FROM Invoice i WHERE i.quoteId = :quoteId AND i.deletedAt IS NULL")
  boolean existsLiveInvoiceForQuote(@Param("quoteId") UUID quoteId);

  List<Invoice> findByOrganizationIdAndDeletedAtIsNullOrderByCreatedAtDesc(UUID organizationId);

  List<Invoice> findByOrganizationIdAndCustomerIdAndDeletedAtIsNullOrderByCreatedAtDesc(
      UUID organizationId, UUID customerId);

  List<Invoice> findByOrganizationIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(
      UUID organizationId, InvoiceStatus status);

  List<Invoice> findByOrganizationIdAndCustomerIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(
      UUID organizationId, UUID customerId, InvoiceStatus status);

  @Query(
      "SELECT i.status AS status, COUNT(i) AS invoiceCount, SUM(i.total) AS total,"
          + " SUM(i.amountPaid) AS amountPaid, SUM(i.balance) AS balance FROM Invoice i"
          + " WHERE i.organizationId = :organizationId AND i.deletedAt IS NULL"
          + " GROUP BY i.status")
  List<StatusTotals> summarizeByStatus(@Param("organizationId") UUID organizationId);

  @Query(
      "SELECT COUNT(i) AS invoiceCount, COALESCE(SUM(i.balance), 0) AS balance FROM Invoice i"
          + " WHERE i.organizationId = :organizationId AND i.deletedAt IS NULL"
          + " AND i.dueDate < :asOf AND i.balance > 0 AND i.status NOT IN :excluded")
  OverdueTotals summarizeOverdue(
      @Param("organizationId") UUID organizationId,
      @Param("asOf") LocalDate asOf,
      @Param("excluded") Collection<InvoiceStatus> excluded);

  interface StatusTotals {
    InvoiceStatus getStatus();

    Long getInvoiceCount();

    BigDecimal getTotal();

    BigDecimal getAmountPaid();

    BigDecimal getBalance();
  }

  interface OverdueTotals {
    Long getInvoiceCount();

    BigDecimal getBalance();
  }
}

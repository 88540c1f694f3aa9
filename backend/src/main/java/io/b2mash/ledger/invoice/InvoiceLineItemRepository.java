package io.b2mash.ledger.invoice;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InvoiceLineItemRepository extends JpaRepository<InvoiceLineItem, UUID> {

  List<InvoiceLineItem> findByInvoiceIdAndLatestVersionTrueOrderBySortOrder(UUID invoiceId);

  List<InvoiceLineItem> findByInvoiceIdOrderBySortOrderAscVersionAsc(UUID invoiceId);

  long countByInvoiceId(UUID invoiceId);
}

package io.b2mash.ledger.sequence;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DocumentNumberRepository extends JpaRepository<DocumentNumber, UUID> {

  /** Most recently reserved sequential number; fallback numbers do not advance the sequence. */
  Optional<DocumentNumber>
      findFirstByOrganizationIdAndDocumentTypeAndFallbackFalseOrderByCreatedAtDesc(
          UUID organizationId, String documentType);
}

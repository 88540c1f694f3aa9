package io.b2mash.ledger.quote;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface QuoteRepository extends JpaRepository<Quote, UUID> {

  Optional<Quote> findByIdAndOrganizationIdAndDeletedAtIsNull(UUID id, UUID organizationId);
}

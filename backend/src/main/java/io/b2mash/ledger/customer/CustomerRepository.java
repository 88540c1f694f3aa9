package io.b2mash.ledger.customer;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CustomerRepository extends JpaRepository<Customer, UUID> {

  Optional<Customer> findByIdAndOrganizationIdAndDeletedAtIsNull(UUID id, UUID organizationId);
}

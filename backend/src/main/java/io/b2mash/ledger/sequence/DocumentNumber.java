package io.b2mash.ledger.sequence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A reserved document number. The unique constraint on {@code (organization_id, document_type,
 * number)} is what makes concurrent reservations safe; rows are never updated or deleted.
 */
@Entity
@Table(name = "document_numbers")
public class DocumentNumber {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "document_type", nullable = false, updatable = false, length = 30)
  private String documentType;

  @Column(name = "number", nullable = false, updatable = false, length = 50)
  private String number;

  @Column(name = "fallback", nullable = false, updatable = false)
  private boolean fallback;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected DocumentNumber() {}

  public DocumentNumber(UUID organizationId, String documentType, String number, boolean fallback) {
    this.organizationId = organizationId;
    this.documentType = documentType;
    this.number = number;
    this.fallback = fallback;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getDocumentType() {
    return documentType;
  }

  public String getNumber() {
    return number;
  }

  public boolean isFallback() {
    return fallback;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

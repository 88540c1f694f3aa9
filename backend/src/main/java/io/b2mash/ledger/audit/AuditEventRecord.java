package io.b2mash.ledger.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which derives actor and request metadata from the ledger context.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "invoice", "payment")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param organizationId tenant owning the entity
 * @param actorId acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API, INTERNAL, WEBHOOK
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details before/after snapshots and other key fields as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID organizationId,
    UUID actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}

package io.b2mash.ledger.audit;

import io.b2mash.ledger.multitenancy.LedgerContext;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditEventRecord}. Actor, source, IP address and user agent
 * come from the {@link LedgerContext} unless set explicitly.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("invoice.sent")
 *     .entityType("invoice")
 *     .entityId(invoice.getId())
 *     .context(context)
 *     .before(before)
 *     .after(invoice.toAuditSnapshot())
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private LedgerContext context;
  private String source;
  private Map<String, Object> before;
  private Map<String, Object> after;
  private final Map<String, Object> details = new LinkedHashMap<>();

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder context(LedgerContext context) {
    this.context = context;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder before(Map<String, Object> before) {
    this.before = before;
    return this;
  }

  public AuditEventBuilder after(Map<String, Object> after) {
    this.after = after;
    return this;
  }

  public AuditEventBuilder detail(String key, Object value) {
    this.details.put(key, value);
    return this;
  }

  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null || context == null) {
      throw new IllegalStateException("eventType, entityType, entityId and context are required");
    }
    var payload = new LinkedHashMap<String, Object>(details);
    if (before != null) {
      payload.put("before", before);
    }
    if (after != null) {
      payload.put("after", after);
    }

    String resolvedSource = source;
    if (resolvedSource == null) {
      resolvedSource = context.ipAddress() != null ? "API" : "INTERNAL";
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        context.organizationId(),
        context.userId(),
        context.isSystem() ? "SYSTEM" : "USER",
        resolvedSource,
        context.ipAddress(),
        context.userAgent(),
        payload.isEmpty() ? null : payload);
  }
}

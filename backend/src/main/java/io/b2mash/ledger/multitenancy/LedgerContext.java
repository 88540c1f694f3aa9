package io.b2mash.ledger.multitenancy;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

/**
 * Caller identity handed to every ledger operation. The organization id scopes every lookup; the
 * remaining fields only feed the audit trail.
 *
 * @param organizationId tenant that owns the data being read or written
 * @param userId acting user, or null for system and webhook callers
 * @param ipAddress client address, null outside HTTP requests
 * @param userAgent truncated User-Agent header, null outside HTTP requests
 */
public record LedgerContext(UUID organizationId, UUID userId, String ipAddress, String userAgent) {

  public static final String ORGANIZATION_HEADER = "X-Organization-Id";
  public static final String USER_HEADER = "X-User-Id";

  private static final int MAX_USER_AGENT_LENGTH = 500;

  public LedgerContext {
    if (organizationId == null) {
      throw new IllegalArgumentException("organizationId is required");
    }
    if (userAgent != null && userAgent.length() > MAX_USER_AGENT_LENGTH) {
      userAgent = userAgent.substring(0, MAX_USER_AGENT_LENGTH);
    }
  }

  public static LedgerContext system(UUID organizationId) {
    return new LedgerContext(organizationId, null, null, null);
  }

  public static LedgerContext fromRequest(
      UUID organizationId, UUID userId, HttpServletRequest request) {
    return new LedgerContext(
        organizationId, userId, request.getRemoteAddr(), request.getHeader("User-Agent"));
  }

  public boolean isSystem() {
    return userId == null;
  }
}

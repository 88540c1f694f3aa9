package io.b2mash.ledger.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  static final String MDC_ORGANIZATION_ID = "organizationId";
  static final String MDC_USER_ID = "userId";
  static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String organizationId = request.getHeader(LedgerContext.ORGANIZATION_HEADER);
      if (organizationId != null && !organizationId.isBlank()) {
        MDC.put(MDC_ORGANIZATION_ID, organizationId);
      }

      String userId = request.getHeader(LedgerContext.USER_HEADER);
      if (userId != null && !userId.isBlank()) {
        MDC.put(MDC_USER_ID, userId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_ORGANIZATION_ID);
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}

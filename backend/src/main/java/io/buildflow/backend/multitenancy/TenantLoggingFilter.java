package io.buildflow.backend.multitenancy;

import io.buildflow.backend.session.UserSession;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts the request id, agency database and session user into the MDC so every log line of a
 * request can be tied back to the tenant it touched.
 */
@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  static final String MDC_REQUEST_ID = "requestId";
  static final String MDC_TENANT_DB = "tenantDb";
  static final String MDC_USER_ID = "userId";
  static final String REQUEST_ID_HEADER = "X-Request-Id";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    MDC.put(MDC_REQUEST_ID, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    try {
      String databaseName = TenantContext.getDatabaseName();
      if (databaseName != null) {
        MDC.put(MDC_TENANT_DB, databaseName);
      }

      var auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth != null && auth.getPrincipal() instanceof UserSession session) {
        MDC.put(MDC_USER_ID, session.userId().toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_TENANT_DB);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}

package io.buildflow.backend.security;

import io.buildflow.backend.multitenancy.TenantAccessException;
import io.buildflow.backend.multitenancy.TenantContext;
import io.buildflow.backend.session.SessionGovernor;
import io.buildflow.backend.session.UserSession;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code /api/**} requests by their bearer session token against the agency bound by
 * {@code TenantFilter}. The authenticated principal is the {@link UserSession}.
 */
@Component
public class SessionAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionAuthFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final SessionGovernor sessionGovernor;

  public SessionAuthFilter(SessionGovernor sessionGovernor) {
    this.sessionGovernor = sessionGovernor;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String databaseName = TenantContext.getDatabaseName();
    String authHeader = request.getHeader("Authorization");
    if (databaseName == null || authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
      filterChain.doFilter(request, response);
      return;
    }

    String token = authHeader.substring(BEARER_PREFIX.length()).trim();
    Optional<UserSession> session;
    try {
      session =
          token.isEmpty()
              ? Optional.empty()
              : sessionGovernor.validateSession(databaseName, token);
    } catch (TenantAccessException e) {
      log.warn("Session validation on {} failed: {}", databaseName, e.getMessage());
      response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Agency database unavailable");
      return;
    }
    if (session.isEmpty()) {
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Session expired or revoked");
      return;
    }

    var authentication =
        new UsernamePasswordAuthenticationToken(
            session.get(), null, List.of(new SimpleGrantedAuthority("ROLE_AGENCY_USER")));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }
}

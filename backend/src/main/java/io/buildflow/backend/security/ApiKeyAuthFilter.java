package io.buildflow.backend.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates calls to {@code /internal/**} (provisioning, repair, session administration) made
 * by trusted services holding the shared API key. The optional {@code X-Internal-Caller} header
 * names the calling service and becomes the principal.
 */
@Component
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

  static final String API_KEY_HEADER = "X-API-KEY";
  static final String CALLER_HEADER = "X-Internal-Caller";
  static final String DEFAULT_CALLER = "internal-service";

  private final byte[] expectedApiKey;

  public ApiKeyAuthFilter(@Value("${internal.api.key}") String expectedApiKey) {
    this.expectedApiKey = expectedApiKey.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String apiKey = request.getHeader(API_KEY_HEADER);
    if (apiKey == null
        || !MessageDigest.isEqual(expectedApiKey, apiKey.getBytes(StandardCharsets.UTF_8))) {
      log.warn(
          "Rejected internal call to {} from {}: {} API key",
          request.getRequestURI(),
          request.getRemoteAddr(),
          apiKey == null ? "missing" : "wrong");
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
      return;
    }

    String caller = request.getHeader(CALLER_HEADER);
    SecurityContextHolder.getContext()
        .setAuthentication(
            new InternalCallerToken(caller == null || caller.isBlank() ? DEFAULT_CALLER : caller));
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/internal/");
  }

  private static final class InternalCallerToken extends AbstractAuthenticationToken {

    private final String caller;

    InternalCallerToken(String caller) {
      super(List.of(new SimpleGrantedAuthority("ROLE_INTERNAL_SERVICE")));
      this.caller = caller;
      setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
      return null;
    }

    @Override
    public Object getPrincipal() {
      return caller;
    }
  }
}

package io.buildflow.backend.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.buildflow.backend.provisioning.AgencyRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the {@value #TENANT_HEADER} header to a registered tenant database and binds it to
 * {@link TenantContext} for the rest of the request.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  public static final String TENANT_HEADER = "X-Agency-Database";

  private final AgencyRepository agencyRepository;
  private final Cache<String, Boolean> knownDatabases =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(10)).build();

  public TenantFilter(AgencyRepository agencyRepository) {
    this.agencyRepository = agencyRepository;
  }

  /** Forgets a cached database name, used after a tenant is deleted. */
  public void evictDatabase(String databaseName) {
    knownDatabases.invalidate(databaseName);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String databaseName = request.getHeader(TENANT_HEADER);
    if (databaseName == null || databaseName.isBlank()) {
      filterChain.doFilter(request, response);
      return;
    }
    databaseName = databaseName.trim();
    if (!DatabaseIdentifiers.isValid(databaseName)) {
      response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Invalid agency database");
      return;
    }
    if (!isRegistered(databaseName)) {
      response.sendError(HttpServletResponse.SC_NOT_FOUND, "Agency not provisioned");
      return;
    }
    try {
      TenantContext.setDatabaseName(databaseName);
      filterChain.doFilter(request, response);
    } finally {
      TenantContext.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }

  private boolean isRegistered(String databaseName) {
    // Only positive lookups are cached so a freshly provisioned agency is seen immediately
    if (knownDatabases.getIfPresent(databaseName) != null) {
      return true;
    }
    boolean registered = agencyRepository.existsByDatabaseNameAndActiveTrue(databaseName);
    if (registered) {
      knownDatabases.put(databaseName, Boolean.TRUE);
    }
    return registered;
  }
}

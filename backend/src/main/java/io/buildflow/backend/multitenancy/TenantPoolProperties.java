package io.buildflow.backend.multitenancy;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the per-tenant connection pools.
 *
 * @param maxConnectionsPerTenant upper bound of physical connections in one tenant pool
 * @param acquireTimeout how long a borrower waits before {@link PoolSaturatedException}
 * @param idleTimeout idle connections are closed after this long
 * @param statementTimeout server-side statement timeout applied to every tenant connection
 * @param evictionDrainTimeout how long eviction waits for in-flight borrows to return
 * @param maxPools soft limit on the number of live pools, exceeded pools are logged
 */
@ConfigurationProperties(prefix = "buildflow.pools")
public record TenantPoolProperties(
    int maxConnectionsPerTenant,
    Duration acquireTimeout,
    Duration idleTimeout,
    Duration statementTimeout,
    Duration evictionDrainTimeout,
    int maxPools) {

  public TenantPoolProperties {
    if (maxConnectionsPerTenant <= 0) {
      maxConnectionsPerTenant = 5;
    }
    if (acquireTimeout == null) {
      acquireTimeout = Duration.ofSeconds(5);
    }
    if (idleTimeout == null) {
      idleTimeout = Duration.ofSeconds(30);
    }
    if (statementTimeout == null) {
      statementTimeout = Duration.ofSeconds(30);
    }
    if (evictionDrainTimeout == null) {
      evictionDrainTimeout = Duration.ofSeconds(10);
    }
    if (maxPools <= 0) {
      maxPools = 200;
    }
  }

  public static TenantPoolProperties defaults() {
    return new TenantPoolProperties(0, null, null, null, null, 0);
  }
}

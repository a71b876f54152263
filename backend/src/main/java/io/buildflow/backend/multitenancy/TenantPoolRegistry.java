package io.buildflow.backend.multitenancy;

import com.zaxxer.hikari.HikariPoolMXBean;
import jakarta.annotation.PreDestroy;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide registry of tenant connection pools, keyed by database name.
 *
 * <p>Pools are created lazily on the first {@link #acquire(String)} for a name. Creation is
 * coalesced per key, so concurrent first requests for the same unseen tenant share one pool. A pool
 * lives until {@link #evict(String)} is called or the application shuts down.
 *
 * <p>Callers borrow with try-with-resources:
 *
 * <pre>{@code
 * try (var conn = registry.acquire("agency_acme_1a2b3c4d")) {
 *   ...
 * }
 * }</pre>
 */
@Component
public class TenantPoolRegistry {

  private static final Logger log = LoggerFactory.getLogger(TenantPoolRegistry.class);
  private static final long DRAIN_POLL_MILLIS = 50;

  private final TenantDataSourceFactory dataSourceFactory;
  private final TenantPoolProperties properties;
  private final ConcurrentMap<String, TenantPool> pools = new ConcurrentHashMap<>();

  public TenantPoolRegistry(
      TenantDataSourceFactory dataSourceFactory, TenantPoolProperties properties) {
    this.dataSourceFactory = dataSourceFactory;
    this.properties = properties;
  }

  /**
   * Borrows a connection to the named tenant database.
   *
   * @throws TenantDatabaseNotFoundException the database does not exist on the cluster
   * @throws TenantUnreachableException the cluster could not be reached (retryable)
   * @throws TenantConfigInvalidException the name is invalid or credentials were rejected
   * @throws PoolSaturatedException every connection of the pool stayed busy for the acquire timeout
   */
  public TenantConnection acquire(String databaseName) {
    if (!DatabaseIdentifiers.isValid(databaseName)) {
      throw new TenantConfigInvalidException(
          databaseName,
          "Invalid tenant database name",
          new InvalidDatabaseNameException(databaseName));
    }
    TenantPool pool = pools.computeIfAbsent(databaseName, this::createPool);
    Connection connection;
    try {
      connection = pool.dataSource().getConnection();
    } catch (SQLException e) {
      TenantAccessException failure =
          TenantErrorClassifier.classifyAcquireFailure(databaseName, e);
      if (failure instanceof TenantDatabaseNotFoundException) {
        discard(pool);
      }
      log.debug("Acquire failed for tenant database {}: {}", databaseName, failure.getMessage());
      throw failure;
    }
    pool.onBorrow();
    return new TenantConnection(databaseName, connection, pool);
  }

  /** Returns a borrowed connection to its pool. The pool itself stays open. */
  public void release(TenantConnection connection) {
    connection.close();
  }

  /**
   * Removes the pool from the registry and closes it. New borrowers get a fresh pool afterwards.
   * In-flight borrows get {@link TenantPoolProperties#evictionDrainTimeout()} to return; any still
   * out after that are terminated and their holders see a connection error on the next statement.
   *
   * @return true if a pool was registered under the name
   */
  public boolean evict(String databaseName) {
    TenantPool pool = pools.remove(databaseName);
    if (pool == null) {
      return false;
    }
    HikariPoolMXBean mxBean = pool.dataSource().getHikariPoolMXBean();
    if (mxBean != null) {
      mxBean.softEvictConnections();
    }
    awaitDrain(pool, properties.evictionDrainTimeout());
    if (pool.borrowed() > 0) {
      log.warn(
          "Closing pool for tenant database {} with {} connections still borrowed",
          databaseName,
          pool.borrowed());
    }
    pool.dataSource().close();
    log.info("Evicted connection pool for tenant database {}", databaseName);
    return true;
  }

  public boolean isPooled(String databaseName) {
    return pools.containsKey(databaseName);
  }

  public int size() {
    return pools.size();
  }

  public List<PoolStats> stats() {
    return pools.values().stream()
        .map(TenantPoolRegistry::toStats)
        .sorted(Comparator.comparing(PoolStats::databaseName))
        .toList();
  }

  @PreDestroy
  public void evictAll() {
    log.info("Closing {} tenant connection pools", pools.size());
    for (String databaseName : List.copyOf(pools.keySet())) {
      try {
        evict(databaseName);
      } catch (RuntimeException e) {
        log.error("Failed to close pool for tenant database {}", databaseName, e);
      }
    }
  }

  private TenantPool createPool(String databaseName) {
    if (pools.size() >= properties.maxPools()) {
      log.warn(
          "Tenant pool count {} reached the configured limit {}; creating pool for {} anyway",
          pools.size(),
          properties.maxPools(),
          databaseName);
    }
    return new TenantPool(databaseName, dataSourceFactory.create(databaseName));
  }

  private void discard(TenantPool pool) {
    if (pools.remove(pool.databaseName(), pool)) {
      pool.dataSource().close();
      log.info("Discarded pool for missing tenant database {}", pool.databaseName());
    }
  }

  private static void awaitDrain(TenantPool pool, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (pool.borrowed() > 0 && System.nanoTime() < deadline) {
      try {
        Thread.sleep(DRAIN_POLL_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  private static PoolStats toStats(TenantPool pool) {
    var dataSource = pool.dataSource();
    HikariPoolMXBean mxBean = dataSource.getHikariPoolMXBean();
    int active = mxBean != null ? mxBean.getActiveConnections() : 0;
    int idle = mxBean != null ? mxBean.getIdleConnections() : 0;
    int waiting = mxBean != null ? mxBean.getThreadsAwaitingConnection() : 0;
    int total = mxBean != null ? mxBean.getTotalConnections() : 0;
    return new PoolStats(
        pool.databaseName(),
        active,
        idle,
        waiting,
        total,
        dataSource.getMaximumPoolSize(),
        pool.borrowed(),
        pool.acquireCount(),
        pool.createdAt(),
        pool.lastAcquiredAt());
  }
}

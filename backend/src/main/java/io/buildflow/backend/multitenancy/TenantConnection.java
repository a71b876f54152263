package io.buildflow.backend.multitenancy;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A connection borrowed from a tenant pool for one unit of work. Closing it returns the physical
 * connection to the pool; closing twice is a no-op.
 */
public final class TenantConnection implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TenantConnection.class);

  private final String databaseName;
  private final Connection connection;
  private final TenantPool pool;
  private final AtomicBoolean released = new AtomicBoolean();

  TenantConnection(String databaseName, Connection connection, TenantPool pool) {
    this.databaseName = databaseName;
    this.connection = connection;
    this.pool = pool;
  }

  public String databaseName() {
    return databaseName;
  }

  public Connection connection() {
    if (released.get()) {
      throw new IllegalStateException("Connection to " + databaseName + " was already released");
    }
    return connection;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("Failed to return connection to pool for tenant database {}", databaseName, e);
    } finally {
      pool.onReturn();
    }
  }
}

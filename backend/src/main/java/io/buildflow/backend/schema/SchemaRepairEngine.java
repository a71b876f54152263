package io.buildflow.backend.schema;

import io.buildflow.backend.multitenancy.TenantConnection;
import io.buildflow.backend.multitenancy.TenantPoolRegistry;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Service;

/**
 * Creates and repairs tenant schemas from the idempotent module scripts. Running a module twice
 * leaves the database unchanged; no script drops or removes anything.
 */
@Service
public class SchemaRepairEngine {

  private static final Logger log = LoggerFactory.getLogger(SchemaRepairEngine.class);
  private static final String SCHEMA_LOCK_KEY = "buildflow_schema_creation";
  private static final long LOCK_POLL_MILLIS = 250;

  private final TenantPoolRegistry poolRegistry;
  private final SchemaRepairProperties properties;
  private final Map<SchemaModule, String> scripts = new EnumMap<>(SchemaModule.class);

  public SchemaRepairEngine(TenantPoolRegistry poolRegistry, SchemaRepairProperties properties) {
    this.poolRegistry = poolRegistry;
    this.properties = properties;
    for (SchemaModule module : SchemaModule.values()) {
      scripts.put(module, SchemaModuleCatalog.loadScript(module));
    }
  }

  /** Runs one module's script in its own transaction. */
  public void ensureModule(Connection connection, SchemaModule module) {
    boolean autoCommit = getAutoCommit(connection);
    try {
      connection.setAutoCommit(false);
      ScriptUtils.executeSqlScript(connection, scriptResource(module));
      connection.commit();
      log.debug("Ensured schema module {}", module);
    } catch (SQLException | RuntimeException e) {
      rollbackQuietly(connection, e);
      throw new SchemaRepairException("Failed to ensure schema module " + module, e);
    } finally {
      restoreAutoCommit(connection, autoCommit);
    }
  }

  /**
   * Ensures every module in dependency order while holding the schema advisory lock, then records
   * the schema version. An already complete schema is left unchanged.
   */
  public void ensureAll(Connection connection, String databaseName) {
    acquireSchemaLock(connection, databaseName);
    try {
      for (SchemaModule module : SchemaModule.values()) {
        ensureModule(connection, module);
      }
      recordSchemaVersion(connection);
      log.info(
          "Ensured {} schema modules on tenant database {}",
          SchemaModule.values().length,
          databaseName);
    } finally {
      releaseSchemaLock(connection, databaseName);
    }
  }

  /**
   * Checks the required tables on a freshly created database.
   *
   * @throws SchemaVerificationFailedException if any required table is missing
   */
  public void verifyRequiredTables(Connection connection, String databaseName) {
    List<String> missing = missingTables(connection, SchemaModuleCatalog.REQUIRED_TABLES);
    if (!missing.isEmpty()) {
      throw new SchemaVerificationFailedException(databaseName, missing);
    }
  }

  public Set<String> existingTables(Connection connection) {
    var tables = new TreeSet<String>();
    try (var statement =
            connection.prepareStatement(
                "SELECT table_name FROM information_schema.tables"
                    + " WHERE table_schema = 'public' AND table_type = 'BASE TABLE'");
        var rs = statement.executeQuery()) {
      while (rs.next()) {
        tables.add(rs.getString(1));
      }
    } catch (SQLException e) {
      throw new SchemaRepairException("Failed to list tenant tables", e);
    }
    return tables;
  }

  public List<String> missingTables(Connection connection, Collection<String> required) {
    Set<String> existing = existingTables(connection);
    return required.stream().filter(table -> !existing.contains(table)).toList();
  }

  /**
   * Checks only the tables of the given modules and returns those with a table absent, in
   * dependency order.
   */
  public List<SchemaModule> incompleteModules(
      Connection connection, Collection<SchemaModule> modules) {
    if (modules.isEmpty()) {
      return List.of();
    }
    String[] tables =
        modules.stream().flatMap(module -> module.tables().stream()).toArray(String[]::new);
    var existing = new TreeSet<String>();
    try (var statement =
        connection.prepareStatement(
            "SELECT table_name FROM information_schema.tables"
                + " WHERE table_schema = 'public' AND table_type = 'BASE TABLE'"
                + " AND table_name::text = ANY (?)")) {
      statement.setArray(1, connection.createArrayOf("text", tables));
      try (var rs = statement.executeQuery()) {
        while (rs.next()) {
          existing.add(rs.getString(1));
        }
      }
    } catch (SQLException e) {
      throw new SchemaRepairException("Failed to check tables of modules " + modules, e);
    }
    var incomplete = new ArrayList<SchemaModule>();
    for (SchemaModule module : SchemaModule.values()) {
      if (modules.contains(module) && !existing.containsAll(module.tables())) {
        incomplete.add(module);
      }
    }
    return incomplete;
  }

  /** Modules with at least one table absent from the database, in dependency order. */
  public List<SchemaModule> incompleteModules(Connection connection) {
    Set<String> existing = existingTables(connection);
    var incomplete = new ArrayList<SchemaModule>();
    for (SchemaModule module : SchemaModule.values()) {
      if (!existing.containsAll(module.tables())) {
        incomplete.add(module);
      }
    }
    return incomplete;
  }

  /** Brings a registered tenant database up to the full module set. */
  public SchemaRepairResult repairTenantSchema(String databaseName) {
    try (TenantConnection tenant = poolRegistry.acquire(databaseName)) {
      Connection connection = tenant.connection();
      int before = existingTables(connection).size();
      ensureAll(connection, databaseName);
      Set<String> after = existingTables(connection);
      int added = after.size() - before;
      log.info(
          "Repaired schema of {}: {} tables before, {} after, {} added",
          databaseName,
          before,
          after.size(),
          added);
      return new SchemaRepairResult(
          databaseName, before, after.size(), added, List.copyOf(after));
    }
  }

  /** Read-only health check listing missing tables per module. */
  public SchemaValidationReport validateTenantSchema(String databaseName) {
    try (TenantConnection tenant = poolRegistry.acquire(databaseName)) {
      Set<String> existing = existingTables(tenant.connection());
      Map<SchemaModule, List<String>> missing = new LinkedHashMap<>();
      for (SchemaModule module : SchemaModule.values()) {
        List<String> absent =
            module.tables().stream().filter(table -> !existing.contains(table)).toList();
        if (!absent.isEmpty()) {
          missing.put(module, absent);
        }
      }
      return new SchemaValidationReport(databaseName, missing, missing.isEmpty());
    }
  }

  private void acquireSchemaLock(Connection connection, String databaseName) {
    long deadline = System.nanoTime() + properties.lockWait().toNanos();
    try (var statement =
        connection.prepareStatement("SELECT pg_try_advisory_lock(hashtext(?))")) {
      statement.setString(1, SCHEMA_LOCK_KEY);
      while (true) {
        try (var rs = statement.executeQuery()) {
          if (rs.next() && rs.getBoolean(1)) {
            return;
          }
        }
        if (System.nanoTime() >= deadline) {
          throw new SchemaRepairException(
              "Timed out waiting for schema lock on tenant database " + databaseName);
        }
        log.debug("Schema lock on {} is held elsewhere, waiting", databaseName);
        Thread.sleep(LOCK_POLL_MILLIS);
      }
    } catch (SQLException e) {
      throw new SchemaRepairException("Failed to acquire schema lock on " + databaseName, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SchemaRepairException("Interrupted waiting for schema lock on " + databaseName, e);
    }
  }

  private void releaseSchemaLock(Connection connection, String databaseName) {
    try (var statement = connection.prepareStatement("SELECT pg_advisory_unlock(hashtext(?))")) {
      statement.setString(1, SCHEMA_LOCK_KEY);
      statement.execute();
    } catch (SQLException e) {
      // The lock is session scoped and goes away with the connection
      log.warn("Failed to release schema lock on {}", databaseName, e);
    }
  }

  private void recordSchemaVersion(Connection connection) {
    try (var statement =
        connection.prepareStatement(
            "INSERT INTO schema_info (id, schema_version, updated_at) VALUES (1, ?, now())"
                + " ON CONFLICT (id) DO UPDATE SET schema_version = EXCLUDED.schema_version,"
                + " updated_at = now()")) {
      statement.setString(1, SchemaModuleCatalog.SCHEMA_VERSION);
      statement.executeUpdate();
    } catch (SQLException e) {
      throw new SchemaRepairException("Failed to record schema version", e);
    }
  }

  private EncodedResource scriptResource(SchemaModule module) {
    byte[] bytes = scripts.get(module).getBytes(StandardCharsets.UTF_8);
    return new EncodedResource(
        new ByteArrayResource(bytes, module.scriptPath()), StandardCharsets.UTF_8);
  }

  private static boolean getAutoCommit(Connection connection) {
    try {
      return connection.getAutoCommit();
    } catch (SQLException e) {
      throw new SchemaRepairException("Tenant connection is not usable", e);
    }
  }

  private static void restoreAutoCommit(Connection connection, boolean autoCommit) {
    try {
      connection.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      log.warn("Failed to restore auto-commit on tenant connection", e);
    }
  }

  private static void rollbackQuietly(Connection connection, Exception original) {
    try {
      connection.rollback();
    } catch (SQLException rollbackFailure) {
      original.addSuppressed(rollbackFailure);
    }
  }
}

package io.buildflow.backend.schema;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.buildflow.backend.multitenancy.TenantConnection;
import io.buildflow.backend.multitenancy.TenantPoolRegistry;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * On-demand repair of a tenant database after a query hit a missing relation. Disabled unless
 * {@code buildflow.schema.reactive-repair-enabled} is set.
 *
 * <p>PostgreSQL reports a missing relation (42P01) without naming it in a structured field, so the
 * module to repair comes from the modules the failed unit of work declared it touches. Only those
 * modules' tables are checked, and only the incomplete ones are ensured. A relation reported by the
 * server still takes precedence. Work that declares nothing falls back to checking every module.
 * Attempts per tenant database are rate limited, and a failed attempt backs off for longer.
 */
@Component
public class ReactiveSchemaRepair {

  private static final Logger log = LoggerFactory.getLogger(ReactiveSchemaRepair.class);

  private final SchemaRepairEngine engine;
  private final TenantPoolRegistry poolRegistry;
  private final SchemaRepairProperties properties;
  private final Cache<String, Instant> recentAttempts;
  private final Cache<String, Instant> recentFailures;

  public ReactiveSchemaRepair(
      SchemaRepairEngine engine,
      TenantPoolRegistry poolRegistry,
      SchemaRepairProperties properties) {
    this.engine = engine;
    this.poolRegistry = poolRegistry;
    this.properties = properties;
    this.recentAttempts =
        Caffeine.newBuilder().expireAfterWrite(properties.repairCooldown()).build();
    this.recentFailures =
        Caffeine.newBuilder().expireAfterWrite(properties.failedRepairCooldown()).build();
  }

  public boolean isEnabled() {
    return properties.reactiveRepairEnabled();
  }

  /**
   * Repairs the module owning the missing relation.
   *
   * @param declaredModules modules the failed unit of work reads or writes, possibly empty
   * @return true if a repair ran and the caller should retry its unit of work once
   */
  public boolean repairMissingRelation(
      String databaseName, SQLException failure, Set<SchemaModule> declaredModules) {
    if (!isEnabled()) {
      return false;
    }
    if (recentFailures.getIfPresent(databaseName) != null) {
      log.debug("Skipping schema repair of {}: previous attempt failed recently", databaseName);
      return false;
    }
    if (recentAttempts.asMap().putIfAbsent(databaseName, Instant.now()) != null) {
      log.debug("Skipping schema repair of {}: repaired recently", databaseName);
      return false;
    }

    Optional<SchemaModule> reported =
        missingRelation(failure).flatMap(SchemaModuleCatalog::moduleForTable);
    try (TenantConnection tenant = poolRegistry.acquire(databaseName)) {
      List<SchemaModule> modules;
      if (reported.isPresent()) {
        modules = List.of(reported.get());
      } else if (!declaredModules.isEmpty()) {
        modules = engine.incompleteModules(tenant.connection(), declaredModules);
      } else {
        log.warn(
            "Unit of work on {} declared no schema modules, checking the whole schema",
            databaseName);
        modules = engine.incompleteModules(tenant.connection());
      }
      if (modules.isEmpty()) {
        log.info(
            "Missing relation on {} is not a table of modules {}", databaseName, declaredModules);
        return false;
      }
      for (SchemaModule module : modules) {
        engine.ensureModule(tenant.connection(), module);
      }
      log.info("Repaired schema modules {} on {} after missing relation", modules, databaseName);
      return true;
    } catch (RuntimeException e) {
      recentFailures.put(databaseName, Instant.now());
      log.error("Reactive schema repair of {} failed", databaseName, e);
      return false;
    }
  }

  /** The relation named in the server's structured error fields, when the server sent one. */
  static Optional<String> missingRelation(SQLException failure) {
    if (failure instanceof PSQLException psql) {
      ServerErrorMessage serverError = psql.getServerErrorMessage();
      if (serverError != null && serverError.getTable() != null) {
        return Optional.of(serverError.getTable());
      }
    }
    return Optional.empty();
  }
}

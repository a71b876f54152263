package io.buildflow.backend.multitenancy;

import io.buildflow.backend.schema.ReactiveSchemaRepair;
import io.buildflow.backend.schema.SchemaModule;
import java.sql.SQLException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs one unit of work against a tenant database on a connection borrowed from {@link
 * TenantPoolRegistry}. The connection is returned on every exit path.
 *
 * <p>Driver failures are translated into the tenant error taxonomy. A query that fails because a
 * relation is missing is repaired and retried once when reactive repair is enabled; otherwise it
 * is reported as {@link TenantConfigInvalidException}. Work that declares the schema modules it
 * touches lets the repair check and ensure just those modules.
 */
@Component
public class TenantJdbc {

  private static final Logger log = LoggerFactory.getLogger(TenantJdbc.class);

  private final TenantPoolRegistry poolRegistry;
  private final ReactiveSchemaRepair reactiveSchemaRepair;

  public TenantJdbc(TenantPoolRegistry poolRegistry, ReactiveSchemaRepair reactiveSchemaRepair) {
    this.poolRegistry = poolRegistry;
    this.reactiveSchemaRepair = reactiveSchemaRepair;
  }

  public <T> T query(String databaseName, Function<JdbcTemplate, T> work) {
    return run(databaseName, Set.of(), false, work);
  }

  public <T> T query(
      String databaseName, Set<SchemaModule> modules, Function<JdbcTemplate, T> work) {
    return run(databaseName, modules, false, work);
  }

  public <T> T inTransaction(String databaseName, Function<JdbcTemplate, T> work) {
    return run(databaseName, Set.of(), true, work);
  }

  public <T> T inTransaction(
      String databaseName, Set<SchemaModule> modules, Function<JdbcTemplate, T> work) {
    return run(databaseName, modules, true, work);
  }

  private <T> T run(
      String databaseName,
      Set<SchemaModule> modules,
      boolean transactional,
      Function<JdbcTemplate, T> work) {
    try {
      return attempt(databaseName, transactional, work);
    } catch (DataAccessException e) {
      SQLException sqlException = TenantErrorClassifier.findSqlException(e);
      if (sqlException == null) {
        throw e;
      }
      Optional<TenantAccessException> accessFailure =
          TenantErrorClassifier.classify(databaseName, sqlException);
      if (accessFailure.isPresent()) {
        throw accessFailure.get();
      }
      if (!TenantErrorClassifier.isMissingRelation(sqlException)) {
        throw e;
      }
      if (!reactiveSchemaRepair.isEnabled()) {
        throw new TenantConfigInvalidException(
            databaseName, "Tenant database " + databaseName + " is missing a relation", e);
      }
      if (!reactiveSchemaRepair.repairMissingRelation(databaseName, sqlException, modules)) {
        throw e;
      }
      log.info("Retrying unit of work on {} after schema repair", databaseName);
      return retryOnce(databaseName, transactional, work);
    }
  }

  private <T> T retryOnce(
      String databaseName, boolean transactional, Function<JdbcTemplate, T> work) {
    try {
      return attempt(databaseName, transactional, work);
    } catch (DataAccessException e) {
      SQLException sqlException = TenantErrorClassifier.findSqlException(e);
      if (sqlException != null) {
        Optional<TenantAccessException> accessFailure =
            TenantErrorClassifier.classify(databaseName, sqlException);
        if (accessFailure.isPresent()) {
          throw accessFailure.get();
        }
      }
      throw e;
    }
  }

  private <T> T attempt(
      String databaseName, boolean transactional, Function<JdbcTemplate, T> work) {
    try (TenantConnection connection = poolRegistry.acquire(databaseName)) {
      var dataSource = new SingleConnectionDataSource(connection.connection(), true);
      var jdbcTemplate = new JdbcTemplate(dataSource);
      if (!transactional) {
        return work.apply(jdbcTemplate);
      }
      var transactionTemplate =
          new TransactionTemplate(new DataSourceTransactionManager(dataSource));
      return transactionTemplate.execute(status -> work.apply(jdbcTemplate));
    }
  }
}

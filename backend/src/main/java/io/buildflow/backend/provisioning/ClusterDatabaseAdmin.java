package io.buildflow.backend.provisioning;

import io.buildflow.backend.config.ClusterProperties;
import io.buildflow.backend.multitenancy.DatabaseIdentifiers;
import io.buildflow.backend.multitenancy.TenantConnectionTarget;
import io.buildflow.backend.multitenancy.TenantErrorClassifier;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Cluster-level statements (CREATE/DROP DATABASE, backend termination) over short-lived
 * administrative connections to the maintenance database. These connections never go through the
 * tenant pool registry and are closed as soon as the statement completes.
 */
@Component
public class ClusterDatabaseAdmin {

  private static final Logger log = LoggerFactory.getLogger(ClusterDatabaseAdmin.class);

  private final ClusterProperties cluster;
  private final RetryTemplate dropRetryTemplate;

  public ClusterDatabaseAdmin(ClusterProperties cluster) {
    this.cluster = cluster;
    this.dropRetryTemplate =
        RetryTemplate.builder()
            .maxAttempts(5)
            .exponentialBackoff(500, 2, 5000)
            .retryOn(DatabaseInUseException.class)
            .build();
  }

  public boolean databaseExists(String databaseName) {
    DatabaseIdentifiers.validate(databaseName);
    Boolean exists =
        maintenance()
            .queryForObject(
                "SELECT EXISTS (SELECT 1 FROM pg_database WHERE datname = ?)",
                Boolean.class,
                databaseName);
    return Boolean.TRUE.equals(exists);
  }

  /**
   * Creates the database, dropping a leftover database of the same name first. Fails if the new
   * database cannot be seen in {@code pg_database} afterwards.
   */
  public void createDatabase(String databaseName) {
    String quoted = DatabaseIdentifiers.quote(databaseName);
    if (databaseExists(databaseName)) {
      log.warn("Database {} already exists, dropping the leftover before creating", databaseName);
      dropDatabase(databaseName);
    }
    maintenance()
        .execute(
            (ConnectionCallback<Void>)
                connection -> {
                  applyStatementTimeout(connection);
                  try (var statement = connection.createStatement()) {
                    statement.execute("CREATE DATABASE " + quoted);
                  }
                  return null;
                });
    if (!databaseExists(databaseName)) {
      throw new IllegalStateException("Database " + databaseName + " was not visible after CREATE");
    }
    log.info("Created database {}", databaseName);
  }

  /** Terminates remaining backends and drops the database, retrying while it is still in use. */
  public void dropDatabase(String databaseName) {
    String quoted = DatabaseIdentifiers.quote(databaseName);
    dropRetryTemplate.execute(
        context -> {
          if (context.getRetryCount() > 0) {
            log.info("Retrying drop of {} (attempt {})", databaseName, context.getRetryCount() + 1);
          }
          terminateConnections(databaseName);
          try {
            maintenance()
                .execute(
                    (ConnectionCallback<Void>)
                        connection -> {
                          applyStatementTimeout(connection);
                          try (var statement = connection.createStatement()) {
                            statement.execute("DROP DATABASE IF EXISTS " + quoted);
                          }
                          return null;
                        });
          } catch (DataAccessException e) {
            SQLException sqlException = TenantErrorClassifier.findSqlException(e);
            if (sqlException != null
                && TenantErrorClassifier.OBJECT_IN_USE.equals(sqlException.getSQLState())) {
              throw new DatabaseInUseException(databaseName, e);
            }
            throw e;
          }
          return null;
        });
    log.info("Dropped database {}", databaseName);
  }

  /** Terminates every other backend connected to the database. */
  public int terminateConnections(String databaseName) {
    DatabaseIdentifiers.validate(databaseName);
    Integer terminated =
        maintenance()
            .execute(
                (ConnectionCallback<Integer>)
                    connection -> {
                      applyStatementTimeout(connection);
                      try (var statement =
                          connection.prepareStatement(
                              "SELECT count(pg_terminate_backend(pid)) FROM pg_stat_activity"
                                  + " WHERE datname = ? AND pid <> pg_backend_pid()")) {
                        statement.setString(1, databaseName);
                        try (var rs = statement.executeQuery()) {
                          return rs.next() ? rs.getInt(1) : 0;
                        }
                      }
                    });
    int count = terminated != null ? terminated : 0;
    if (count > 0) {
      log.info("Terminated {} connections to {}", count, databaseName);
    }
    return count;
  }

  /**
   * Opens a dedicated connection to a tenant database outside the pool registry and checks that
   * the server really connected to that database. The caller owns and closes it.
   */
  public Connection openDatabaseConnection(String databaseName) throws SQLException {
    Connection connection = dataSourceFor(databaseName).getConnection();
    try {
      applyStatementTimeout(connection);
      try (var statement = connection.prepareStatement("SELECT current_database()");
          var rs = statement.executeQuery()) {
        String actual = rs.next() ? rs.getString(1) : null;
        if (!databaseName.equals(actual)) {
          throw new IllegalStateException(
              "Connected to " + actual + " instead of tenant database " + databaseName);
        }
      }
      return connection;
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  private JdbcTemplate maintenance() {
    String url =
        "jdbc:postgresql://"
            + cluster.host()
            + ":"
            + cluster.port()
            + "/"
            + cluster.maintenanceDatabase();
    return new JdbcTemplate(adminDataSource(url));
  }

  DataSource dataSourceFor(String databaseName) {
    return adminDataSource(TenantConnectionTarget.of(cluster, databaseName).jdbcUrl());
  }

  private DataSource adminDataSource(String url) {
    var dataSource = new DriverManagerDataSource(url, cluster.username(), cluster.password());
    var properties = new Properties();
    properties.setProperty("ApplicationName", "buildflow-admin");
    properties.setProperty("connectTimeout", String.valueOf(cluster.connectTimeout().toSeconds()));
    dataSource.setConnectionProperties(properties);
    return dataSource;
  }

  private void applyStatementTimeout(Connection connection) throws SQLException {
    try (var statement = connection.createStatement()) {
      statement.execute("SET statement_timeout = " + cluster.statementTimeout().toMillis());
    }
  }

  static class DatabaseInUseException extends RuntimeException {

    DatabaseInUseException(String databaseName, Throwable cause) {
      super("Database " + databaseName + " is still in use", cause);
    }
  }
}

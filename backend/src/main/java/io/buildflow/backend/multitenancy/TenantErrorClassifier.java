package io.buildflow.backend.multitenancy;

import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Optional;

/**
 * Maps driver failures on a tenant connection to the tenant error taxonomy using SQLSTATE codes
 * only. Message text is never inspected.
 */
public final class TenantErrorClassifier {

  public static final String INVALID_CATALOG_NAME = "3D000";
  public static final String UNDEFINED_TABLE = "42P01";
  public static final String UNDEFINED_FUNCTION = "42883";
  public static final String UNDEFINED_OBJECT = "42704";
  public static final String INSUFFICIENT_PRIVILEGE = "42501";
  public static final String UNIQUE_VIOLATION = "23505";
  public static final String OBJECT_IN_USE = "55006";

  private TenantErrorClassifier() {}

  /** Classifies a failure to obtain a connection from a tenant pool. */
  public static TenantAccessException classifyAcquireFailure(String databaseName, SQLException e) {
    Optional<TenantAccessException> classified = classify(databaseName, deepestSqlException(e));
    if (classified.isPresent()) {
      return classified.get();
    }
    if (e instanceof SQLTransientConnectionException) {
      // Hikari timed out waiting for a free connection without any underlying connect failure
      return new PoolSaturatedException(databaseName, e);
    }
    return new TenantUnreachableException(
        databaseName, "Unable to connect to tenant database " + databaseName, e);
  }

  /**
   * Classifies a statement or connection failure. Returns empty for ordinary SQL errors (constraint
   * violations, syntax errors) that belong to the caller.
   */
  public static Optional<TenantAccessException> classify(String databaseName, SQLException e) {
    String state = e.getSQLState();
    if (state == null) {
      if (hasCause(e, SocketTimeoutException.class)) {
        return Optional.of(
            new TenantUnreachableException(
                databaseName, "Timed out talking to tenant database " + databaseName, e));
      }
      return Optional.empty();
    }
    if (INVALID_CATALOG_NAME.equals(state)) {
      return Optional.of(new TenantDatabaseNotFoundException(databaseName, e));
    }
    if (state.startsWith("28") || INSUFFICIENT_PRIVILEGE.equals(state)) {
      return Optional.of(
          new TenantConfigInvalidException(
              databaseName, "Credentials rejected by tenant database " + databaseName, e));
    }
    if (state.startsWith("08") || state.startsWith("57P")) {
      return Optional.of(
          new TenantUnreachableException(
              databaseName, "Tenant database " + databaseName + " is unreachable", e));
    }
    return Optional.empty();
  }

  public static boolean isMissingRelation(SQLException e) {
    return e != null && UNDEFINED_TABLE.equals(e.getSQLState());
  }

  /** Returns the first {@link SQLException} in the cause chain, or null. */
  public static SQLException findSqlException(Throwable t) {
    Throwable current = t;
    while (current != null) {
      if (current instanceof SQLException sql) {
        return sql;
      }
      current = current.getCause();
    }
    return null;
  }

  private static SQLException deepestSqlException(SQLException e) {
    SQLException deepest = e;
    Throwable current = e.getCause();
    while (current != null) {
      if (current instanceof SQLException sql && sql.getSQLState() != null) {
        deepest = sql;
      }
      current = current.getCause();
    }
    return deepest;
  }

  private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
    Throwable current = t;
    while (current != null) {
      if (type.isInstance(current)) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}

package io.buildflow.backend.multitenancy;

/** Failure to reach or use a tenant database. Subclasses tell callers whether a retry can help. */
public abstract class TenantAccessException extends RuntimeException {

  private final String databaseName;

  protected TenantAccessException(String databaseName, String message, Throwable cause) {
    super(message, cause);
    this.databaseName = databaseName;
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public abstract boolean isRetryable();
}

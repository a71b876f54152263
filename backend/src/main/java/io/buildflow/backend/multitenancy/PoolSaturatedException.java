package io.buildflow.backend.multitenancy;

public class PoolSaturatedException extends TenantAccessException {

  public PoolSaturatedException(String databaseName, Throwable cause) {
    super(databaseName, "No connection available for tenant database " + databaseName, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}

package io.buildflow.backend.multitenancy;

public class TenantDatabaseNotFoundException extends TenantAccessException {

  public TenantDatabaseNotFoundException(String databaseName, Throwable cause) {
    super(databaseName, "Tenant database does not exist: " + databaseName, cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}

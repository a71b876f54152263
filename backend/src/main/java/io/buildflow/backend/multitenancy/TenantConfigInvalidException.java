package io.buildflow.backend.multitenancy;

public class TenantConfigInvalidException extends TenantAccessException {

  public TenantConfigInvalidException(String databaseName, String message, Throwable cause) {
    super(databaseName, message, cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}

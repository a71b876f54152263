package io.buildflow.backend.multitenancy;

public class TenantUnreachableException extends TenantAccessException {

  public TenantUnreachableException(String databaseName, String message, Throwable cause) {
    super(databaseName, message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}

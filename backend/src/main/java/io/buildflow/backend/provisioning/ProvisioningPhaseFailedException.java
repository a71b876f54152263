package io.buildflow.backend.provisioning;

/**
 * Tenant creation failed in {@link #getPhase()}. By the time this is thrown, any database created
 * for the attempt has been dropped or the failure to drop it has been logged.
 */
public class ProvisioningPhaseFailedException extends RuntimeException {

  private final ProvisioningPhase phase;
  private final String databaseName;

  public ProvisioningPhaseFailedException(
      ProvisioningPhase phase, String databaseName, Throwable cause) {
    super("Provisioning failed during " + phase + ": " + cause.getMessage(), cause);
    this.phase = phase;
    this.databaseName = databaseName;
  }

  public ProvisioningPhase getPhase() {
    return phase;
  }

  public String getDatabaseName() {
    return databaseName;
  }
}

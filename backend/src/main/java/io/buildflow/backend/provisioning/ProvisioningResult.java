package io.buildflow.backend.provisioning;

import java.util.UUID;

public record ProvisioningResult(
    UUID agencyId, String databaseName, UUID adminUserId, boolean reusedExisting) {

  public static ProvisioningResult created(UUID agencyId, String databaseName, UUID adminUserId) {
    return new ProvisioningResult(agencyId, databaseName, adminUserId, false);
  }

  public static ProvisioningResult existing(Agency agency) {
    return new ProvisioningResult(
        agency.getId(), agency.getDatabaseName(), agency.getOwnerUserId(), true);
  }
}

package io.buildflow.backend.provisioning;

/** Phases of tenant creation, in execution order. */
public enum ProvisioningPhase {
  CHECKING_DOMAIN,
  CREATING_DATABASE,
  CREATING_SCHEMA,
  SEEDING_SETTINGS,
  CREATING_ADMIN,
  COMMITTING_MAIN_RECORD,
  ASSIGNING_DEFAULTS
}

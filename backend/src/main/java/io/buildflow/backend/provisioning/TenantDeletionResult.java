package io.buildflow.backend.provisioning;

import java.util.UUID;

/** {@code recordRemoved} is false while the database still exists; the agency is then inactive. */
public record TenantDeletionResult(
    UUID agencyId, String databaseName, boolean databaseDropped, boolean recordRemoved) {}

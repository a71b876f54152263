package io.buildflow.backend.provisioning;

import io.buildflow.backend.provisioning.CreateTenantCommand.OnboardingMetadata;
import java.util.UUID;

record AgencyRegistration(
    UUID agencyId,
    String name,
    String domain,
    String databaseName,
    UUID ownerUserId,
    String plan,
    OnboardingMetadata metadata,
    PostalAddress address) {}

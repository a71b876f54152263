package io.buildflow.backend.provisioning;

import java.util.List;
import java.util.UUID;

/**
 * Input to tenant creation. {@code adminPasswordHash} is already hashed by the caller.
 *
 * @param pageIds pages to entitle explicitly, may be empty
 */
public record CreateTenantCommand(
    String agencyName,
    String domain,
    String adminName,
    String adminEmail,
    String adminPasswordHash,
    String plan,
    OnboardingMetadata metadata,
    List<UUID> pageIds) {

  public CreateTenantCommand {
    metadata = metadata != null ? metadata : OnboardingMetadata.empty();
    pageIds = pageIds != null ? List.copyOf(pageIds) : List.of();
  }

  public record OnboardingMetadata(
      String industry,
      String phone,
      String address,
      String companySize,
      Boolean gstEnabled,
      String primaryFocus,
      List<String> businessGoals) {

    public OnboardingMetadata {
      businessGoals = businessGoals != null ? List.copyOf(businessGoals) : List.of();
    }

    public static OnboardingMetadata empty() {
      return new OnboardingMetadata(null, null, null, null, null, null, List.of());
    }
  }
}

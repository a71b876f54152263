package io.buildflow.backend.setup;

import jakarta.validation.Valid;
import java.util.List;

/**
 * Answers of the agency setup wizard. Blank fields leave the stored setting unchanged.
 *
 * @param foundedYear year the company was founded, or {@code null}
 * @param employeeCount head count, or {@code null}
 */
public record TenantSetupRequest(
    String companyName,
    String companyTagline,
    String industry,
    String businessType,
    Integer foundedYear,
    Integer employeeCount,
    String description,
    String legalName,
    String registrationNumber,
    String taxId,
    String taxIdType,
    SetupAddress address,
    String phone,
    String email,
    String website,
    String currency,
    String fiscalYearStart,
    Boolean enableGst,
    String gstNumber,
    String timezone,
    String dateFormat,
    String language,
    @Valid List<DepartmentRequest> departments,
    @Valid List<TeamMemberRequest> teamMembers) {

  public TenantSetupRequest {
    address = address != null ? address : new SetupAddress(null, null, null, null, null);
    departments = departments != null ? List.copyOf(departments) : List.of();
    teamMembers = teamMembers != null ? List.copyOf(teamMembers) : List.of();
  }

  public record SetupAddress(
      String street, String city, String state, String zipCode, String country) {}
}

package io.buildflow.backend.provisioning;

import io.buildflow.backend.multitenancy.PoolStats;
import io.buildflow.backend.multitenancy.TenantPoolRegistry;
import io.buildflow.backend.provisioning.CreateTenantCommand.OnboardingMetadata;
import io.buildflow.backend.schema.SchemaRepairResult;
import io.buildflow.backend.schema.SchemaValidationReport;
import io.buildflow.backend.setup.SetupStatus;
import io.buildflow.backend.setup.TeamCredentialsManifest;
import io.buildflow.backend.setup.TenantSetupRequest;
import io.buildflow.backend.setup.TenantSetupService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/agencies")
public class AgencyProvisioningController {

  private static final Logger log = LoggerFactory.getLogger(AgencyProvisioningController.class);

  private final TenantProvisioningService provisioningService;
  private final TenantSetupService setupService;
  private final TenantDeletionService deletionService;
  private final TenantPoolRegistry poolRegistry;

  public AgencyProvisioningController(
      TenantProvisioningService provisioningService,
      TenantSetupService setupService,
      TenantDeletionService deletionService,
      TenantPoolRegistry poolRegistry) {
    this.provisioningService = provisioningService;
    this.setupService = setupService;
    this.deletionService = deletionService;
    this.poolRegistry = poolRegistry;
  }

  @PostMapping("/provision")
  public ResponseEntity<ProvisioningResult> provisionAgency(
      @Valid @RequestBody ProvisionAgencyRequest request) {
    log.info("Received provisioning request for domain {}", request.domain());

    var result = provisioningService.createTenant(request.toCommand());

    if (result.reusedExisting()) {
      return ResponseEntity.ok(result);
    }
    return ResponseEntity.created(URI.create("/internal/agencies/" + result.databaseName()))
        .body(result);
  }

  @GetMapping("/domain-availability")
  public ResponseEntity<DomainAvailabilityResponse> checkDomain(@RequestParam String domain) {
    boolean available = provisioningService.checkDomainAvailable(domain);
    return ResponseEntity.ok(new DomainAvailabilityResponse(domain, available));
  }

  @PostMapping("/{databaseName}/complete-setup")
  public ResponseEntity<TeamCredentialsManifest> completeSetup(
      @PathVariable String databaseName, @Valid @RequestBody TenantSetupRequest request) {
    return ResponseEntity.ok(setupService.completeTenantSetup(databaseName, request));
  }

  @GetMapping("/{databaseName}/setup-status")
  public ResponseEntity<SetupStatus> setupStatus(@PathVariable String databaseName) {
    return ResponseEntity.ok(setupService.getSetupStatus(databaseName));
  }

  @PostMapping("/{databaseName}/repair-schema")
  public ResponseEntity<SchemaRepairResult> repairSchema(@PathVariable String databaseName) {
    log.info("Received schema repair request for {}", databaseName);
    return ResponseEntity.ok(provisioningService.repairTenantSchema(databaseName));
  }

  @GetMapping("/{databaseName}/schema-health")
  public ResponseEntity<SchemaValidationReport> schemaHealth(@PathVariable String databaseName) {
    return ResponseEntity.ok(provisioningService.validateTenantSchema(databaseName));
  }

  @DeleteMapping("/{agencyId}")
  public ResponseEntity<TenantDeletionResult> deleteAgency(@PathVariable UUID agencyId) {
    log.info("Received delete request for agency {}", agencyId);
    return ResponseEntity.ok(deletionService.deleteTenant(agencyId));
  }

  @GetMapping("/pools")
  public ResponseEntity<List<PoolStats>> pools() {
    return ResponseEntity.ok(poolRegistry.stats());
  }

  public record ProvisionAgencyRequest(
      @NotBlank(message = "agencyName is required") String agencyName,
      @NotBlank(message = "domain is required") String domain,
      @NotBlank(message = "adminName is required") String adminName,
      @NotBlank(message = "adminEmail is required") @Email String adminEmail,
      @NotBlank(message = "adminPasswordHash is required") String adminPasswordHash,
      @NotBlank(message = "subscriptionPlan is required") String subscriptionPlan,
      String industry,
      String phone,
      String address,
      String companySize,
      Boolean gstEnabled,
      String primaryFocus,
      List<String> businessGoals,
      List<UUID> pageIds) {

    CreateTenantCommand toCommand() {
      return new CreateTenantCommand(
          agencyName,
          domain,
          adminName,
          adminEmail,
          adminPasswordHash,
          subscriptionPlan,
          new OnboardingMetadata(
              industry, phone, address, companySize, gstEnabled, primaryFocus, businessGoals),
          pageIds);
    }
  }

  public record DomainAvailabilityResponse(String domain, boolean available) {}
}

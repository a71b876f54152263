package io.buildflow.backend.provisioning;

import io.buildflow.backend.exception.ResourceConflictException;
import io.buildflow.backend.multitenancy.TenantDatabaseNotFoundException;
import io.buildflow.backend.multitenancy.TenantPoolRegistry;
import io.buildflow.backend.schema.SchemaRepairEngine;
import io.buildflow.backend.schema.SchemaRepairResult;
import io.buildflow.backend.schema.SchemaValidationReport;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Service;

/**
 * Creates agencies, each with its own PostgreSQL database. Phases run in {@link
 * ProvisioningPhase} order; a failure after the database exists drops it again before the error
 * is reported.
 */
@Service
public class TenantProvisioningService {

  private static final Logger log = LoggerFactory.getLogger(TenantProvisioningService.class);

  private final AgencyRepository agencyRepository;
  private final AgencyRegistry agencyRegistry;
  private final ClusterDatabaseAdmin clusterAdmin;
  private final SchemaRepairEngine schemaEngine;
  private final TenantSettingsSeeder settingsSeeder;
  private final AdminAccountCreator adminAccountCreator;
  private final PageEntitlementService pageEntitlementService;
  private final TenantPoolRegistry poolRegistry;
  private final Supplier<UUID> idGenerator;

  public TenantProvisioningService(
      AgencyRepository agencyRepository,
      AgencyRegistry agencyRegistry,
      ClusterDatabaseAdmin clusterAdmin,
      SchemaRepairEngine schemaEngine,
      TenantSettingsSeeder settingsSeeder,
      AdminAccountCreator adminAccountCreator,
      PageEntitlementService pageEntitlementService,
      TenantPoolRegistry poolRegistry) {
    this(
        agencyRepository,
        agencyRegistry,
        clusterAdmin,
        schemaEngine,
        settingsSeeder,
        adminAccountCreator,
        pageEntitlementService,
        poolRegistry,
        UUID::randomUUID);
  }

  TenantProvisioningService(
      AgencyRepository agencyRepository,
      AgencyRegistry agencyRegistry,
      ClusterDatabaseAdmin clusterAdmin,
      SchemaRepairEngine schemaEngine,
      TenantSettingsSeeder settingsSeeder,
      AdminAccountCreator adminAccountCreator,
      PageEntitlementService pageEntitlementService,
      TenantPoolRegistry poolRegistry,
      Supplier<UUID> idGenerator) {
    this.agencyRepository = agencyRepository;
    this.agencyRegistry = agencyRegistry;
    this.clusterAdmin = clusterAdmin;
    this.schemaEngine = schemaEngine;
    this.settingsSeeder = settingsSeeder;
    this.adminAccountCreator = adminAccountCreator;
    this.pageEntitlementService = pageEntitlementService;
    this.poolRegistry = poolRegistry;
    this.idGenerator = idGenerator;
  }

  /**
   * Provisions a new agency, or returns the existing one registered for the same domain.
   *
   * @throws IllegalArgumentException a required field is missing
   * @throws ResourceConflictException the matching agency is deactivated, pending deletion
   * @throws ProvisioningPhaseFailedException a phase failed; its database has been dropped
   */
  public ProvisioningResult createTenant(CreateTenantCommand command) {
    validate(command);
    String domain = DomainNames.normalize(command.domain());
    String subdomain = DomainNames.subdomainPrefix(domain);

    // Phase 1
    var existing =
        agencyRepository.findOldestMatchingDomain(
            domain, subdomain, DomainNames.prefixPattern(subdomain));
    if (existing.isPresent() && !existing.get().isActive()) {
      throw new ResourceConflictException(
          "Domain pending deletion",
          "Agency "
              + existing.get().getId()
              + " for domain "
              + existing.get().getDomain()
              + " is deactivated and its database has not been dropped yet");
    }
    if (existing.isPresent()) {
      log.info(
          "Agency for domain {} already exists as {}, returning it",
          domain,
          existing.get().getDatabaseName());
      return ProvisioningResult.existing(existing.get());
    }

    UUID agencyId = idGenerator.get();
    String databaseName = DatabaseNameGenerator.generate(subdomain, agencyId);
    var tx = new ProvisioningTransaction(domain, databaseName);
    tx.markDomainChecked();
    log.info("Provisioning agency {} for domain {} into {}", agencyId, domain, databaseName);

    ProvisioningPhase phase = ProvisioningPhase.CREATING_DATABASE;
    UUID adminUserId;
    try {
      tx.markDatabaseCreateIssued();
      clusterAdmin.createDatabase(databaseName);
      tx.markDatabaseCreated();

      phase = ProvisioningPhase.CREATING_SCHEMA;
      try (Connection connection = clusterAdmin.openDatabaseConnection(databaseName)) {
        schemaEngine.ensureAll(connection, databaseName);
        schemaEngine.verifyRequiredTables(connection, databaseName);
        tx.markSchemaCreated();

        var tenantDataSource = new SingleConnectionDataSource(connection, true);

        phase = ProvisioningPhase.SEEDING_SETTINGS;
        settingsSeeder.seed(new JdbcTemplate(tenantDataSource), agencyId, domain, command);
        tx.markSettingsSeeded();

        phase = ProvisioningPhase.CREATING_ADMIN;
        adminUserId = adminAccountCreator.createAdmin(tenantDataSource, agencyId, command);
        tx.markAdminCreated();
      }

      phase = ProvisioningPhase.COMMITTING_MAIN_RECORD;
      agencyRegistry.commit(
          new AgencyRegistration(
              agencyId,
              command.agencyName(),
              domain,
              databaseName,
              adminUserId,
              command.plan().trim().toLowerCase(Locale.ROOT),
              command.metadata(),
              AddressParser.parse(command.metadata().address())));
      tx.markMainRecordCommitted();
    } catch (DomainAlreadyRegisteredException e) {
      log.warn(
          "Domain {} was registered concurrently, dropping {} and returning the winner",
          domain,
          databaseName);
      compensate(tx, e);
      return agencyRepository
          .findOldestMatchingDomain(domain, subdomain, DomainNames.prefixPattern(subdomain))
          .map(ProvisioningResult::existing)
          .orElseThrow(
              () ->
                  new ProvisioningPhaseFailedException(
                      ProvisioningPhase.COMMITTING_MAIN_RECORD, databaseName, e));
    } catch (SQLException | RuntimeException e) {
      log.error(
          "Provisioning of {} failed during {} after steps {}",
          databaseName,
          phase,
          tx.completedSteps(),
          e);
      compensate(tx, e);
      throw new ProvisioningPhaseFailedException(phase, databaseName, e);
    }

    // Phase 7, best-effort
    try {
      pageEntitlementService.assignDefaults(agencyId, command.pageIds(), command.metadata());
    } catch (RuntimeException e) {
      log.warn("Assigning default pages to agency {} failed, continuing", agencyId, e);
    }

    log.info("Provisioned agency {} with database {}", agencyId, databaseName);
    return ProvisioningResult.created(agencyId, databaseName, adminUserId);
  }

  /** Whether no agency is registered under the domain or its subdomain prefix. */
  public boolean checkDomainAvailable(String domain) {
    String normalized = DomainNames.normalize(domain);
    String subdomain = DomainNames.subdomainPrefix(normalized);
    return agencyRepository
        .findOldestMatchingDomain(normalized, subdomain, DomainNames.prefixPattern(subdomain))
        .isEmpty();
  }

  /** Brings a registered agency database up to the full module set. */
  public SchemaRepairResult repairTenantSchema(String databaseName) {
    requireRegistered(databaseName);
    return schemaEngine.repairTenantSchema(databaseName);
  }

  /** Lists the tables each module is missing, without changing anything. */
  public SchemaValidationReport validateTenantSchema(String databaseName) {
    requireRegistered(databaseName);
    return schemaEngine.validateTenantSchema(databaseName);
  }

  void requireRegistered(String databaseName) {
    if (agencyRepository.findByDatabaseName(databaseName).isEmpty()) {
      throw new TenantDatabaseNotFoundException(databaseName, null);
    }
  }

  private void compensate(ProvisioningTransaction tx, Exception original) {
    // the name carries a fresh agency id, so dropping it if it exists touches nothing else
    if (!tx.isDatabaseCreateIssued()) {
      return;
    }
    String databaseName = tx.databaseName();
    try {
      poolRegistry.evict(databaseName);
      clusterAdmin.dropDatabase(databaseName);
      log.info("Dropped database {} after failed provisioning", databaseName);
    } catch (RuntimeException e) {
      original.addSuppressed(e);
      log.error(
          "Could not drop database {} after failed provisioning, drop it manually with:"
              + " DROP DATABASE IF EXISTS \"{}\"",
          databaseName,
          databaseName,
          e);
    }
  }

  private static void validate(CreateTenantCommand command) {
    require(command.agencyName(), "agencyName");
    require(command.domain(), "domain");
    require(command.adminName(), "adminName");
    require(command.adminEmail(), "adminEmail");
    require(command.adminPasswordHash(), "adminPasswordHash");
    require(command.plan(), "plan");
  }

  private static void require(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is required");
    }
  }
}

package io.buildflow.backend.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.buildflow.backend.TestcontainersConfiguration;
import io.buildflow.backend.multitenancy.TenantJdbc;
import io.buildflow.backend.multitenancy.TenantPoolRegistry;
import io.buildflow.backend.provisioning.CreateTenantCommand.OnboardingMetadata;
import io.buildflow.backend.schema.SchemaModule;
import io.buildflow.backend.schema.SchemaModuleCatalog;
import io.buildflow.backend.setup.DepartmentRequest;
import io.buildflow.backend.setup.TeamMemberRequest;
import io.buildflow.backend.setup.TenantSetupRequest;
import io.buildflow.backend.setup.TenantSetupService;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ProvisioningIntegrationTest {

  @Autowired private TenantProvisioningService provisioningService;
  @Autowired private TenantSetupService setupService;
  @Autowired private TenantDeletionService deletionService;
  @Autowired private ClusterDatabaseAdmin clusterAdmin;
  @Autowired private AgencyRepository agencyRepository;
  @Autowired private AgencyRegistry agencyRegistry;
  @Autowired private TenantJdbc tenantJdbc;
  @Autowired private TenantPoolRegistry poolRegistry;
  @Autowired private JdbcTemplate mainJdbc;

  @Test
  void createTenant_buildsDatabaseWithFullSchemaAndAdmin() {
    String domain = uniqueDomain("full");

    var result = provisioningService.createTenant(command(domain, "Full Schema Co"));

    assertThat(result.reusedExisting()).isFalse();
    assertThat(result.databaseName()).startsWith("agency_full");
    assertThat(clusterAdmin.databaseExists(result.databaseName())).isTrue();

    var report = provisioningService.validateTenantSchema(result.databaseName());
    assertThat(report.healthy()).isTrue();

    String version =
        tenantJdbc.query(
            result.databaseName(),
            jdbc ->
                jdbc.queryForObject(
                    "SELECT schema_version FROM schema_info WHERE id = 1", String.class));
    assertThat(version).isEqualTo(SchemaModuleCatalog.SCHEMA_VERSION);

    List<String> roles =
        tenantJdbc.query(
            result.databaseName(),
            jdbc ->
                jdbc.queryForList(
                    "SELECT role FROM user_roles WHERE user_id = ?",
                    String.class,
                    result.adminUserId()));
    assertThat(roles).containsExactly("super_admin");

    var agency = agencyRepository.findByDatabaseName(result.databaseName()).orElseThrow();
    assertThat(agency.getDomain()).isEqualTo(domain);
    assertThat(agency.getOwnerUserId()).isEqualTo(result.adminUserId());
    assertThat(agency.getMaxUsers()).isEqualTo(5);

    Integer settingsRows =
        mainJdbc.queryForObject(
            "SELECT count(*) FROM public.agency_settings WHERE agency_id = ?",
            Integer.class,
            result.agencyId());
    assertThat(settingsRows).isEqualTo(1);
  }

  @Test
  void createTenant_sameDomainTwice_returnsExistingAgency() {
    String domain = uniqueDomain("twice");

    var first = provisioningService.createTenant(command(domain, "Twice Co"));
    var second = provisioningService.createTenant(command(domain, "Twice Co"));

    assertThat(second.reusedExisting()).isTrue();
    assertThat(second.agencyId()).isEqualTo(first.agencyId());
    assertThat(second.databaseName()).isEqualTo(first.databaseName());
    assertThat(provisioningService.checkDomainAvailable(domain)).isFalse();
  }

  @Test
  void createTenant_bareSubdomainOfRegisteredDomain_returnsExistingAgency() {
    String domain = uniqueDomain("bare");
    String subdomain = DomainNames.subdomainPrefix(domain);

    var first = provisioningService.createTenant(command(domain, "Bare Co"));
    var second = provisioningService.createTenant(command(subdomain, "Bare Co"));

    assertThat(second.reusedExisting()).isTrue();
    assertThat(second.agencyId()).isEqualTo(first.agencyId());
  }

  @Test
  void commit_sameSubdomainUnderAnotherDomain_isRejectedAsDomainConflict() {
    String domain = uniqueDomain("prefix");
    var first = provisioningService.createTenant(command(domain, "Prefix Co"));
    String subdomain = DomainNames.subdomainPrefix(domain);
    var metadata = command(subdomain, "Prefix Co").metadata();
    var registration =
        new AgencyRegistration(
            UUID.randomUUID(),
            "Prefix Co",
            subdomain + ".other.test",
            "agency_" + subdomain + "_ffffffff",
            UUID.randomUUID(),
            "starter",
            metadata,
            AddressParser.parse(metadata.address()));

    assertThatThrownBy(() -> agencyRegistry.commit(registration))
        .isInstanceOf(DomainAlreadyRegisteredException.class);
    assertThat(agencyRepository.findById(first.agencyId())).isPresent();
    assertThat(agencyRepository.findById(registration.agencyId())).isEmpty();
  }

  @Test
  void createTenant_concurrentRequestsForOneDomain_leaveOneAgencyAndOneDatabase()
      throws Exception {
    String domain = uniqueDomain("race");
    ExecutorService executor = Executors.newFixedThreadPool(2);
    var start = new CountDownLatch(1);
    Callable<ProvisioningResult> attempt =
        () -> {
          start.await();
          return provisioningService.createTenant(command(domain, "Race Co"));
        };
    List<ProvisioningResult> results = new ArrayList<>();
    try {
      Future<ProvisioningResult> first = executor.submit(attempt);
      Future<ProvisioningResult> second = executor.submit(attempt);
      start.countDown();
      results.add(first.get(2, TimeUnit.MINUTES));
      results.add(second.get(2, TimeUnit.MINUTES));
    } finally {
      executor.shutdownNow();
    }

    assertThat(results)
        .extracting(ProvisioningResult::agencyId)
        .containsOnly(results.get(0).agencyId());
    assertThat(results).filteredOn(r -> !r.reusedExisting()).hasSize(1);

    String prefix = "agency_" + DomainNames.subdomainPrefix(domain) + "_";
    List<String> databases =
        mainJdbc.queryForList(
            "SELECT datname FROM pg_database WHERE datname LIKE ?", String.class, prefix + "%");
    assertThat(databases).containsExactly(results.get(0).databaseName());
  }

  @Test
  void repairTenantSchema_recreatesDroppedModuleTables() {
    var result = provisioningService.createTenant(command(uniqueDomain("repair"), "Repair Co"));
    String db = result.databaseName();
    tenantJdbc.query(
        db,
        jdbc -> {
          jdbc.execute("DROP TABLE holidays");
          return null;
        });

    var before = provisioningService.validateTenantSchema(db);
    assertThat(before.healthy()).isFalse();
    assertThat(before.missingTables()).containsOnlyKeys(SchemaModule.MISC);
    assertThat(before.missingTables().get(SchemaModule.MISC)).containsExactly("holidays");

    var repair = provisioningService.repairTenantSchema(db);

    assertThat(repair.added()).isEqualTo(1);
    assertThat(repair.allTables()).contains("holidays");
    assertThat(provisioningService.validateTenantSchema(db).healthy()).isTrue();
  }

  @Test
  void tenantQuery_missingTableOfDeclaredModule_isRepairedAndRetried() {
    var result =
        provisioningService.createTenant(command(uniqueDomain("reactive"), "Reactive Co"));
    String db = result.databaseName();
    tenantJdbc.query(
        db,
        jdbc -> {
          jdbc.execute("DROP TABLE company_events");
          return null;
        });

    Integer count =
        tenantJdbc.query(
            db,
            Set.of(SchemaModule.MISC),
            jdbc -> jdbc.queryForObject("SELECT count(*) FROM company_events", Integer.class));

    assertThat(count).isZero();
    assertThat(provisioningService.validateTenantSchema(db).healthy()).isTrue();
  }

  @Test
  void completeTenantSetup_failingMemberDoesNotUndoOthers() {
    String domain = uniqueDomain("setup");
    var result = provisioningService.createTenant(command(domain, "Setup Co"));
    String db = result.databaseName();
    tenantJdbc.query(
        db,
        jdbc -> {
          jdbc.execute(
              "ALTER TABLE profiles ADD CONSTRAINT profiles_full_name_check"
                  + " CHECK (full_name <> 'Broken Member')");
          return null;
        });

    var request =
        new TenantSetupRequest(
            "Setup Company",
            "We build",
            "construction",
            "llc",
            2015,
            40,
            null,
            "Setup Company LLC",
            null,
            null,
            null,
            new TenantSetupRequest.SetupAddress("1 Main St", "Springfield", "IL", "62704", "USA"),
            null,
            null,
            null,
            "USD",
            "01-01",
            false,
            null,
            "UTC",
            null,
            "en",
            List.of(
                new DepartmentRequest("Engineering", "Builds things"),
                new DepartmentRequest("Operations", null)),
            List.of(
                new TeamMemberRequest("Ada Lovelace", "Ada@Setup.test", null, "Engineering", null),
                new TeamMemberRequest("Broken Member", "broken@setup.test", null, null, null),
                new TeamMemberRequest(
                    "Grace Hopper", "grace@setup.test", null, "Operations", "COO"),
                new TeamMemberRequest("Owner Again", "owner@" + domain, null, null, null)));

    var manifest = setupService.completeTenantSetup(db, request);

    assertThat(manifest.credentials())
        .extracting(c -> c.email())
        .containsExactly("ada@setup.test", "grace@setup.test");
    assertThat(manifest.failedEmails()).containsExactly("broken@setup.test");
    assertThat(manifest.skippedEmails()).containsExactly("owner@" + domain);
    assertThat(manifest.csv().split("\n")).hasSize(3);

    Integer users =
        tenantJdbc.query(
            db, jdbc -> jdbc.queryForObject("SELECT count(*) FROM users", Integer.class));
    assertThat(users).isEqualTo(3);
    Integer heads =
        tenantJdbc.query(
            db,
            jdbc ->
                jdbc.queryForObject(
                    "SELECT count(*) FROM team_assignments WHERE role_in_department ="
                        + " 'department_head'",
                    Integer.class));
    assertThat(heads).isEqualTo(2);

    var status = setupService.getSetupStatus(db);
    assertThat(status.setupComplete()).isTrue();
    assertThat(status.agencyName()).isEqualTo("Setup Company");
  }

  @Test
  void deleteTenant_dropsDatabaseAndRegistryRow() {
    var result = provisioningService.createTenant(command(uniqueDomain("delete"), "Delete Co"));
    tenantJdbc.query(result.databaseName(), jdbc -> jdbc.queryForList("SELECT 1"));
    assertThat(poolRegistry.isPooled(result.databaseName())).isTrue();

    var deletion = deletionService.deleteTenant(result.agencyId());

    assertThat(deletion.databaseDropped()).isTrue();
    assertThat(deletion.recordRemoved()).isTrue();
    assertThat(poolRegistry.isPooled(result.databaseName())).isFalse();
    assertThat(clusterAdmin.databaseExists(result.databaseName())).isFalse();
    assertThat(agencyRepository.findById(result.agencyId())).isEmpty();
  }

  private static String uniqueDomain(String label) {
    return label + UUID.randomUUID().toString().substring(0, 8) + ".buildflow.test";
  }

  private static CreateTenantCommand command(String domain, String agencyName) {
    return new CreateTenantCommand(
        agencyName,
        domain,
        "Olive Owner",
        "owner@" + domain,
        "$2a$10$7EqJtq98hPqEX7fNZaFWoOhi5BWX4Z3ZAvvWTpmxX8QTr2ZyW5o5W",
        "starter",
        new OnboardingMetadata(
            "construction",
            "+1 555 0100",
            "12 Main St, Springfield, IL 62704, USA",
            "11-50",
            false,
            "residential",
            List.of("grow")),
        List.of());
  }
}

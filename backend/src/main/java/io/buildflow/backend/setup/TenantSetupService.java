package io.buildflow.backend.setup;

import io.buildflow.backend.exception.ResourceNotFoundException;
import io.buildflow.backend.multitenancy.TenantErrorClassifier;
import io.buildflow.backend.multitenancy.TenantJdbc;
import io.buildflow.backend.provisioning.Agency;
import io.buildflow.backend.provisioning.AgencyRegistry;
import io.buildflow.backend.provisioning.AgencyRepository;
import io.buildflow.backend.schema.SchemaModule;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Completes the setup wizard of a provisioned agency: extended settings, departments and the
 * department heads with their first-login credentials.
 */
@Service
public class TenantSetupService {

  private static final Logger log = LoggerFactory.getLogger(TenantSetupService.class);

  static final String MEMBER_ROLE = "admin";
  static final String DEFAULT_POSITION = "Department Head";
  private static final String SAVEPOINT = "team_member";
  private static final Set<SchemaModule> SETUP_MODULES =
      Set.of(SchemaModule.AUTH, SchemaModule.AGENCIES, SchemaModule.DEPARTMENTS, SchemaModule.HR);

  private final AgencyRepository agencyRepository;
  private final AgencyRegistry agencyRegistry;
  private final TenantJdbc tenantJdbc;
  private final PasswordEncoder passwordEncoder;
  private final PasswordGenerator passwordGenerator;
  private final Clock clock;

  public TenantSetupService(
      AgencyRepository agencyRepository,
      AgencyRegistry agencyRegistry,
      TenantJdbc tenantJdbc,
      PasswordEncoder passwordEncoder,
      PasswordGenerator passwordGenerator) {
    this.agencyRepository = agencyRepository;
    this.agencyRegistry = agencyRegistry;
    this.tenantJdbc = tenantJdbc;
    this.passwordEncoder = passwordEncoder;
    this.passwordGenerator = passwordGenerator;
    this.clock = Clock.systemUTC();
  }

  /**
   * Applies the setup in one tenant transaction. Each team member is created under its own
   * savepoint, so a failing member is left out of the manifest without undoing the others.
   */
  public TeamCredentialsManifest completeTenantSetup(
      String databaseName, TenantSetupRequest request) {
    Agency agency = requireAgency(databaseName);
    UUID agencyId = agency.getId();
    log.info("Completing setup of agency {} in {}", agencyId, databaseName);

    TeamCredentialsManifest manifest =
        tenantJdbc.inTransaction(
            databaseName,
            SETUP_MODULES,
            jdbc -> {
              backfillOwnerProfile(jdbc, agencyId, agency.getOwnerUserId());
              updateSettings(jdbc, agencyId, agency.getName(), request);
              Map<String, UUID> departments = upsertDepartments(jdbc, agencyId, request);
              return createTeamMembers(jdbc, agencyId, departments, request.teamMembers());
            });

    agencyRegistry.markSetupComplete(agencyId);
    log.info(
        "Setup of agency {} complete: {} members created, {} skipped, {} failed",
        agencyId,
        manifest.credentials().size(),
        manifest.skippedEmails().size(),
        manifest.failedEmails().size());
    return manifest;
  }

  public SetupStatus getSetupStatus(String databaseName) {
    Agency agency = requireAgency(databaseName);
    List<SetupStatus> rows =
        tenantJdbc.query(
            databaseName,
            Set.of(SchemaModule.AGENCIES),
            jdbc ->
                jdbc.query(
                    "SELECT setup_complete, agency_name FROM agency_settings LIMIT 1",
                    (rs, rowNum) ->
                        new SetupStatus(
                            rs.getBoolean("setup_complete"), rs.getString("agency_name"))));
    return rows.isEmpty() ? new SetupStatus(false, agency.getName()) : rows.get(0);
  }

  private Agency requireAgency(String databaseName) {
    return agencyRepository
        .findByDatabaseName(databaseName)
        .orElseThrow(() -> new ResourceNotFoundException("Agency", databaseName));
  }

  private void backfillOwnerProfile(JdbcTemplate jdbc, UUID agencyId, UUID ownerUserId) {
    if (ownerUserId == null) {
      return;
    }
    jdbc.update(
        """
        UPDATE profiles SET agency_id = ?, updated_at = now()
        WHERE user_id = ? AND (agency_id IS NULL OR agency_id <> ?)
        """,
        agencyId,
        ownerUserId,
        agencyId);
  }

  private void updateSettings(
      JdbcTemplate jdbc, UUID agencyId, String agencyName, TenantSetupRequest request) {
    Integer rows = jdbc.queryForObject("SELECT count(*) FROM agency_settings", Integer.class);
    if (rows == null || rows == 0) {
      jdbc.update(
          "INSERT INTO agency_settings (agency_id, agency_name) VALUES (?, ?)",
          agencyId,
          firstNonBlank(request.companyName(), request.legalName(), agencyName));
    }
    var address = request.address();
    jdbc.update(
        """
        UPDATE agency_settings SET
            agency_name = COALESCE(NULLIF(?, ''), agency_name),
            company_tagline = COALESCE(NULLIF(?, ''), company_tagline),
            industry = COALESCE(NULLIF(?, ''), industry),
            business_type = COALESCE(NULLIF(?, ''), business_type),
            founded_year = COALESCE(?, founded_year),
            employee_count = COALESCE(?, employee_count),
            description = COALESCE(NULLIF(?, ''), description),
            legal_name = COALESCE(NULLIF(?, ''), legal_name),
            registration_number = COALESCE(NULLIF(?, ''), registration_number),
            tax_id = COALESCE(NULLIF(?, ''), tax_id),
            tax_id_type = COALESCE(NULLIF(?, ''), tax_id_type),
            address_street = COALESCE(NULLIF(?, ''), address_street),
            address_city = COALESCE(NULLIF(?, ''), address_city),
            address_state = COALESCE(NULLIF(?, ''), address_state),
            address_zip = COALESCE(NULLIF(?, ''), address_zip),
            address_country = COALESCE(NULLIF(?, ''), address_country),
            phone = COALESCE(NULLIF(?, ''), phone),
            email = COALESCE(NULLIF(?, ''), email),
            website = COALESCE(NULLIF(?, ''), website),
            currency = COALESCE(NULLIF(?, ''), currency),
            fiscal_year_start = COALESCE(NULLIF(?, ''), fiscal_year_start),
            gst_enabled = COALESCE(?, gst_enabled),
            gst_number = COALESCE(NULLIF(?, ''), gst_number),
            timezone = COALESCE(NULLIF(?, ''), timezone),
            date_format = COALESCE(NULLIF(?, ''), date_format),
            language = COALESCE(NULLIF(?, ''), language),
            agency_id = COALESCE(agency_id, ?),
            setup_complete = true,
            setup_completed_at = now(),
            updated_at = now()
        """,
        firstNonBlank(request.companyName(), request.legalName()),
        request.companyTagline(),
        request.industry(),
        request.businessType(),
        request.foundedYear(),
        request.employeeCount(),
        request.description(),
        request.legalName(),
        request.registrationNumber(),
        request.taxId(),
        request.taxIdType(),
        address.street(),
        address.city(),
        address.state(),
        address.zipCode(),
        address.country(),
        request.phone(),
        request.email(),
        request.website(),
        request.currency(),
        request.fiscalYearStart(),
        request.enableGst(),
        request.gstNumber(),
        request.timezone(),
        request.dateFormat(),
        request.language(),
        agencyId);
  }

  /** Inserts or updates each named department; returns ids by name. */
  private Map<String, UUID> upsertDepartments(
      JdbcTemplate jdbc, UUID agencyId, TenantSetupRequest request) {
    Map<String, UUID> ids = new HashMap<>();
    for (DepartmentRequest department : request.departments()) {
      if (isBlank(department.name())) {
        continue;
      }
      String name = department.name().trim();
      UUID id =
          jdbc.queryForObject(
              """
              INSERT INTO departments (name, description, is_active, agency_id)
              VALUES (?, ?, true, ?)
              ON CONFLICT (agency_id, name) DO UPDATE SET
                  description = EXCLUDED.description,
                  updated_at = now()
              RETURNING id
              """,
              UUID.class,
              name,
              department.description() != null ? department.description() : "",
              agencyId);
      ids.put(name, id);
    }
    log.debug("Upserted {} departments for agency {}", ids.size(), agencyId);
    return ids;
  }

  private TeamCredentialsManifest createTeamMembers(
      JdbcTemplate jdbc,
      UUID agencyId,
      Map<String, UUID> departments,
      List<TeamMemberRequest> members) {
    var credentials = new ArrayList<TeamMemberCredential>();
    var skipped = new ArrayList<String>();
    var failed = new ArrayList<String>();
    var employeeIds = new EmployeeIdAllocator(jdbc, clock);

    for (TeamMemberRequest member : members) {
      if (isBlank(member.name()) || isBlank(member.email())) {
        continue;
      }
      String email = member.email().trim().toLowerCase(Locale.ROOT);
      jdbc.execute("SAVEPOINT " + SAVEPOINT);
      try {
        Optional<TeamMemberCredential> credential =
            createMember(jdbc, agencyId, departments, member, email, employeeIds);
        jdbc.execute("RELEASE SAVEPOINT " + SAVEPOINT);
        credential.ifPresentOrElse(credentials::add, () -> skipped.add(email));
      } catch (DataAccessException e) {
        jdbc.execute("ROLLBACK TO SAVEPOINT " + SAVEPOINT);
        jdbc.execute("RELEASE SAVEPOINT " + SAVEPOINT);
        if (TenantErrorClassifier.isMissingRelation(TenantErrorClassifier.findSqlException(e))) {
          // schema gap, not a member problem
          throw e;
        }
        failed.add(email);
        log.warn("Could not create team member {} for agency {}", email, agencyId, e);
      }
    }
    return new TeamCredentialsManifest(
        List.copyOf(credentials),
        List.copyOf(skipped),
        List.copyOf(failed),
        CredentialsCsv.render(credentials));
  }

  /** Returns empty when a user with the email already exists. */
  private Optional<TeamMemberCredential> createMember(
      JdbcTemplate jdbc,
      UUID agencyId,
      Map<String, UUID> departments,
      TeamMemberRequest member,
      String email,
      EmployeeIdAllocator employeeIds) {
    Boolean exists =
        jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM users WHERE email = ?)", Boolean.class, email);
    if (Boolean.TRUE.equals(exists)) {
      log.info("User {} already exists, skipping", email);
      return Optional.empty();
    }

    String password = passwordGenerator.generate();
    UUID userId =
        jdbc.queryForObject(
            """
            INSERT INTO users (email, password_hash, is_active, email_confirmed)
            VALUES (?, ?, true, false)
            RETURNING id
            """,
            UUID.class,
            email,
            passwordEncoder.encode(password));

    String fullName = member.name().trim();
    jdbc.update(
        "INSERT INTO profiles (user_id, full_name, phone, agency_id) VALUES (?, ?, ?, ?)",
        userId,
        fullName,
        member.phone(),
        agencyId);

    String[] names = fullName.split("\\s+", 2);
    String employeeId = employeeIds.next();
    jdbc.update(
        """
        INSERT INTO employee_details
            (user_id, employee_id, agency_id, first_name, last_name, employment_type, is_active)
        VALUES (?, ?, ?, ?, ?, 'full_time', true)
        """,
        userId,
        employeeId,
        agencyId,
        names[0],
        names.length > 1 ? names[1] : names[0]);

    jdbc.update(
        """
        INSERT INTO user_roles (user_id, role, agency_id)
        VALUES (?, ?, ?)
        ON CONFLICT (user_id, role, agency_id) DO NOTHING
        """,
        userId,
        MEMBER_ROLE,
        agencyId);

    String department = member.department() != null ? member.department().trim() : null;
    UUID departmentId = department != null ? departments.get(department) : null;
    if (departmentId != null) {
      jdbc.update(
          """
          INSERT INTO team_assignments
              (user_id, department_id, position_title, role_in_department, start_date,
               is_active, agency_id)
          VALUES (?, ?, ?, 'department_head', CURRENT_DATE, true, ?)
          """,
          userId,
          departmentId,
          isBlank(member.title()) ? DEFAULT_POSITION : member.title(),
          agencyId);
    }

    return Optional.of(
        new TeamMemberCredential(
            userId, fullName, email, MEMBER_ROLE, department, employeeId, password));
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (!isBlank(value)) {
        return value;
      }
    }
    return null;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}

package io.buildflow.backend.provisioning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates the agency's first user with the {@code super_admin} role. All rows are written in one
 * transaction on the tenant database.
 */
@Component
public class AdminAccountCreator {

  private static final Logger log = LoggerFactory.getLogger(AdminAccountCreator.class);
  static final String FIRST_EMPLOYEE_ID = "EMP-0001";

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AdminAccountCreator(ObjectMapper objectMapper) {
    this(objectMapper, Clock.systemUTC());
  }

  AdminAccountCreator(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** Returns the id of the new user. */
  public UUID createAdmin(DataSource tenantDataSource, UUID agencyId, CreateTenantCommand command) {
    var jdbc = new JdbcTemplate(tenantDataSource);
    var transactionTemplate =
        new TransactionTemplate(new DataSourceTransactionManager(tenantDataSource));
    String email = command.adminEmail().trim().toLowerCase(Locale.ROOT);
    String metadataJson = toJson(Map.of("full_name", command.adminName()));

    UUID userId =
        transactionTemplate.execute(
            status -> {
              UUID id =
                  jdbc.queryForObject(
                      """
                      INSERT INTO users
                          (email, password_hash, email_confirmed, email_confirmed_at, is_active,
                           raw_user_meta_data)
                      VALUES (?, ?, true, now(), true, ?::jsonb)
                      RETURNING id
                      """,
                      UUID.class,
                      email,
                      command.adminPasswordHash(),
                      metadataJson);

              jdbc.update(
                  """
                  INSERT INTO profiles (user_id, full_name, agency_id, is_active)
                  VALUES (?, ?, ?, true)
                  ON CONFLICT (user_id) DO UPDATE SET
                      full_name = EXCLUDED.full_name,
                      agency_id = EXCLUDED.agency_id,
                      updated_at = now()
                  """,
                  id,
                  command.adminName(),
                  agencyId);

              var name = PersonName.split(command.adminName());
              jdbc.update(
                  """
                  INSERT INTO employee_details
                      (user_id, agency_id, employee_id, first_name, last_name, employment_type,
                       hire_date, is_active)
                  VALUES (?, ?, ?, ?, ?, 'full_time', CURRENT_DATE, true)
                  """,
                  id,
                  agencyId,
                  nextAdminEmployeeId(jdbc),
                  name.first(),
                  name.last());

              jdbc.update("DELETE FROM user_roles WHERE user_id = ? AND role = 'employee'", id);
              jdbc.update(
                  """
                  INSERT INTO user_roles (user_id, role, agency_id)
                  VALUES (?, 'super_admin', ?)
                  ON CONFLICT (user_id, role, agency_id) DO NOTHING
                  """,
                  id,
                  agencyId);
              return id;
            });
    log.info("Created super admin {} for agency {}", email, agencyId);
    return userId;
  }

  private String nextAdminEmployeeId(JdbcTemplate jdbc) {
    Boolean taken =
        jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM employee_details WHERE employee_id = ?)",
            Boolean.class,
            FIRST_EMPLOYEE_ID);
    if (!Boolean.TRUE.equals(taken)) {
      return FIRST_EMPLOYEE_ID;
    }
    String millis = String.valueOf(clock.millis());
    return "EMP-" + millis.substring(millis.length() - 6);
  }

  private String toJson(Map<String, String> value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize user metadata", e);
    }
  }
}

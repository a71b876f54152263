package io.buildflow.backend.provisioning;

import io.buildflow.backend.multitenancy.TenantErrorClassifier;
import java.sql.SQLException;
import java.util.UUID;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Writes agency registrations and their settings mirror to the central database. */
@Component
public class AgencyRegistry {

  private static final Logger log = LoggerFactory.getLogger(AgencyRegistry.class);
  static final String DOMAIN_CONSTRAINT = "agencies_domain_key";
  static final String SUBDOMAIN_CONSTRAINT = "agencies_subdomain_key";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  public AgencyRegistry(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
  }

  /**
   * Inserts the agency row and upserts the settings mirror in one transaction.
   *
   * @throws DomainAlreadyRegisteredException another agency committed the same domain, or another
   *     domain with the same subdomain prefix, first
   */
  void commit(AgencyRegistration registration) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            insertAgency(registration);
            upsertSettingsMirror(registration);
          });
      log.info(
          "Registered agency {} ({}) with database {}",
          registration.agencyId(),
          registration.domain(),
          registration.databaseName());
    } catch (DuplicateKeyException e) {
      if (isDomainConflict(e)) {
        throw new DomainAlreadyRegisteredException(registration.domain(), e);
      }
      throw e;
    }
  }

  /** Removes the agency row; the settings mirror and page assignments cascade. */
  public boolean delete(UUID agencyId) {
    return jdbcTemplate.update("DELETE FROM public.agencies WHERE id = ?", agencyId) > 0;
  }

  /** Takes the agency out of routing while keeping its row, e.g. until its database is dropped. */
  public boolean deactivate(UUID agencyId) {
    return jdbcTemplate.update(
            "UPDATE public.agencies SET is_active = false, updated_at = now() WHERE id = ?",
            agencyId)
        > 0;
  }

  public void markSetupComplete(UUID agencyId) {
    jdbcTemplate.update(
        "UPDATE public.agency_settings SET setup_complete = true, updated_at = now()"
            + " WHERE agency_id = ?",
        agencyId);
  }

  private void insertAgency(AgencyRegistration registration) {
    jdbcTemplate.update(
        """
        INSERT INTO public.agencies
            (id, name, domain, database_name, owner_user_id, is_active, subscription_plan,
             max_users, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, true, ?, ?, now(), now())
        ON CONFLICT (id) DO UPDATE SET
            database_name = EXCLUDED.database_name,
            owner_user_id = COALESCE(agencies.owner_user_id, EXCLUDED.owner_user_id),
            updated_at = now()
        """,
        registration.agencyId(),
        registration.name(),
        registration.domain(),
        registration.databaseName(),
        registration.ownerUserId(),
        registration.plan(),
        SubscriptionPlan.maxUsersFor(registration.plan()));
  }

  private void upsertSettingsMirror(AgencyRegistration registration) {
    var metadata = registration.metadata();
    var address = registration.address();
    jdbcTemplate.update(
        """
        INSERT INTO public.agency_settings
            (agency_id, agency_name, domain, industry, phone, company_size, address_city,
             address_country, primary_focus, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, now(), now())
        ON CONFLICT (agency_id) DO UPDATE SET
            agency_name = EXCLUDED.agency_name,
            domain = EXCLUDED.domain,
            industry = COALESCE(EXCLUDED.industry, agency_settings.industry),
            phone = COALESCE(EXCLUDED.phone, agency_settings.phone),
            company_size = COALESCE(EXCLUDED.company_size, agency_settings.company_size),
            address_city = COALESCE(EXCLUDED.address_city, agency_settings.address_city),
            address_country = COALESCE(EXCLUDED.address_country, agency_settings.address_country),
            primary_focus = COALESCE(EXCLUDED.primary_focus, agency_settings.primary_focus),
            updated_at = now()
        """,
        registration.agencyId(),
        registration.name(),
        registration.domain(),
        metadata.industry(),
        metadata.phone(),
        metadata.companySize(),
        address.city(),
        address.country(),
        metadata.primaryFocus());
  }

  static boolean isDomainConflict(DuplicateKeyException e) {
    SQLException sqlException = TenantErrorClassifier.findSqlException(e);
    if (sqlException instanceof PSQLException psql) {
      ServerErrorMessage serverError = psql.getServerErrorMessage();
      if (serverError != null && serverError.getConstraint() != null) {
        return DOMAIN_CONSTRAINT.equals(serverError.getConstraint())
            || SUBDOMAIN_CONSTRAINT.equals(serverError.getConstraint());
      }
    }
    // Without constraint details, a unique violation on the insert can only be the domain or
    // the database name, and the database name embeds a fresh id
    return sqlException != null
        && TenantErrorClassifier.UNIQUE_VIOLATION.equals(sqlException.getSQLState());
  }
}

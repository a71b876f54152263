package io.buildflow.backend.provisioning;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/** Writes the single {@code agency_settings} row of a new tenant database. */
@Component
public class TenantSettingsSeeder {

  private static final Logger log = LoggerFactory.getLogger(TenantSettingsSeeder.class);

  /** Updates the existing row (keeping values the command leaves empty) or inserts one. */
  public void seed(
      JdbcTemplate tenantJdbc, UUID agencyId, String domain, CreateTenantCommand command) {
    var metadata = command.metadata();
    var address = AddressParser.parse(metadata.address());
    boolean gstEnabled = Boolean.TRUE.equals(metadata.gstEnabled());

    int updated =
        tenantJdbc.update(
            """
            UPDATE agency_settings SET
                agency_id = ?,
                agency_name = COALESCE(?, agency_name),
                domain = COALESCE(?, domain),
                industry = COALESCE(?, industry),
                phone = COALESCE(?, phone),
                address_street = COALESCE(?, address_street),
                address_city = COALESCE(?, address_city),
                address_state = COALESCE(?, address_state),
                address_zip = COALESCE(?, address_zip),
                address_country = COALESCE(?, address_country),
                company_size = COALESCE(?, company_size),
                gst_enabled = ?,
                updated_at = now()
            """,
            agencyId,
            command.agencyName(),
            domain,
            metadata.industry(),
            metadata.phone(),
            address.street(),
            address.city(),
            address.state(),
            address.zip(),
            address.country(),
            metadata.companySize(),
            gstEnabled);

    if (updated == 0) {
      tenantJdbc.update(
          """
          INSERT INTO agency_settings
              (agency_id, agency_name, domain, industry, phone, address_street, address_city,
               address_state, address_zip, address_country, company_size, gst_enabled)
          VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
          """,
          agencyId,
          command.agencyName(),
          domain,
          metadata.industry(),
          metadata.phone(),
          address.street(),
          address.city(),
          address.state(),
          address.zip(),
          address.country(),
          metadata.companySize(),
          gstEnabled);
    }
    log.info("Seeded agency settings for {}", domain);
  }
}

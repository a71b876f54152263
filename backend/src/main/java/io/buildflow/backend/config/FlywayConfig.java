package io.buildflow.backend.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migrates the registry database only. Agency databases are built from the module scripts by
 * {@code SchemaRepairEngine}, never by Flyway.
 */
@Configuration
public class FlywayConfig {

  static final String REGISTRY_LOCATION = "classpath:db/migration/global";
  static final String REGISTRY_HISTORY_TABLE = "registry_schema_history";

  @Bean(initMethod = "migrate")
  public Flyway registryFlyway(@Qualifier("mainDataSource") DataSource mainDataSource) {
    return Flyway.configure()
        .dataSource(mainDataSource)
        .locations(REGISTRY_LOCATION)
        .table(REGISTRY_HISTORY_TABLE)
        .schemas("public")
        .baselineOnMigrate(true)
        .validateOnMigrate(true)
        .load();
  }
}

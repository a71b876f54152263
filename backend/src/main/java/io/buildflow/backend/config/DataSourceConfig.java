package io.buildflow.backend.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * The central database holds the agency registry, the settings mirror and the page catalog. Tenant
 * databases are never reached through this pool; see {@code TenantPoolRegistry}.
 */
@Configuration
public class DataSourceConfig {

  @Bean(name = "mainDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.main")
  public HikariDataSource mainDataSource() {
    return new HikariDataSource();
  }
}

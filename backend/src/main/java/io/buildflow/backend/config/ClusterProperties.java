package io.buildflow.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Coordinates of the PostgreSQL cluster that hosts every tenant database.
 *
 * @param host cluster host name
 * @param port cluster port
 * @param username role used for tenant pools and for CREATE/DROP DATABASE
 * @param password password for {@code username}
 * @param maintenanceDatabase database used for cluster-level statements
 * @param statementTimeout upper bound for CREATE/DROP DATABASE and backend termination
 * @param connectTimeout TCP connect timeout for administrative connections
 */
@ConfigurationProperties(prefix = "buildflow.cluster")
public record ClusterProperties(
    String host,
    int port,
    String username,
    String password,
    String maintenanceDatabase,
    Duration statementTimeout,
    Duration connectTimeout) {

  public ClusterProperties {
    if (host == null || host.isBlank()) {
      host = "localhost";
    }
    if (port <= 0) {
      port = 5432;
    }
    if (maintenanceDatabase == null || maintenanceDatabase.isBlank()) {
      maintenanceDatabase = "postgres";
    }
    if (statementTimeout == null) {
      statementTimeout = Duration.ofSeconds(60);
    }
    if (connectTimeout == null) {
      connectTimeout = Duration.ofSeconds(10);
    }
  }
}

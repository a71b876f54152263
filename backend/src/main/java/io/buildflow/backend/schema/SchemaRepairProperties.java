package io.buildflow.backend.schema;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param reactiveRepairEnabled repair a missing relation on demand and retry the failed unit of
 *     work once
 * @param repairCooldown minimum interval between reactive repairs of one tenant database
 * @param failedRepairCooldown back-off after a reactive repair of a tenant database failed
 * @param lockWait how long a full ensure waits for the schema advisory lock
 */
@ConfigurationProperties(prefix = "buildflow.schema")
public record SchemaRepairProperties(
    boolean reactiveRepairEnabled,
    Duration repairCooldown,
    Duration failedRepairCooldown,
    Duration lockWait) {

  public SchemaRepairProperties {
    if (repairCooldown == null) {
      repairCooldown = Duration.ofSeconds(30);
    }
    if (failedRepairCooldown == null) {
      failedRepairCooldown = Duration.ofMinutes(5);
    }
    if (lockWait == null) {
      lockWait = Duration.ofSeconds(30);
    }
  }
}

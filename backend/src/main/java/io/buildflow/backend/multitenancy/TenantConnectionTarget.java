package io.buildflow.backend.multitenancy;

import io.buildflow.backend.config.ClusterProperties;

/** Fully resolved, validated location of one tenant database on the cluster. */
public record TenantConnectionTarget(
    String host, int port, String databaseName, String username, String password) {

  public TenantConnectionTarget {
    DatabaseIdentifiers.validate(databaseName);
  }

  public static TenantConnectionTarget of(ClusterProperties cluster, String databaseName) {
    return new TenantConnectionTarget(
        cluster.host(), cluster.port(), databaseName, cluster.username(), cluster.password());
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ":" + port + "/" + databaseName;
  }

  @Override
  public String toString() {
    return "TenantConnectionTarget[" + host + ":" + port + "/" + databaseName + "]";
  }
}

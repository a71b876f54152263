package io.buildflow.backend.multitenancy;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.metrics.micrometer.MicrometerMetricsTrackerFactory;
import io.buildflow.backend.config.ClusterProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class HikariTenantDataSourceFactory implements TenantDataSourceFactory {

  private static final Logger log = LoggerFactory.getLogger(HikariTenantDataSourceFactory.class);
  static final String APPLICATION_NAME = "buildflow-api";

  private final ClusterProperties cluster;
  private final TenantPoolProperties poolProperties;
  private final ObjectProvider<MeterRegistry> meterRegistryProvider;

  public HikariTenantDataSourceFactory(
      ClusterProperties cluster,
      TenantPoolProperties poolProperties,
      ObjectProvider<MeterRegistry> meterRegistryProvider) {
    this.cluster = cluster;
    this.poolProperties = poolProperties;
    this.meterRegistryProvider = meterRegistryProvider;
  }

  @Override
  public HikariDataSource create(String databaseName) {
    var target = TenantConnectionTarget.of(cluster, databaseName);
    var config = buildConfig(target);
    var meterRegistry = meterRegistryProvider.getIfAvailable();
    if (meterRegistry != null) {
      config.setMetricsTrackerFactory(new MicrometerMetricsTrackerFactory(meterRegistry));
    }
    log.info("Creating connection pool for tenant database {}", databaseName);
    return new HikariDataSource(config);
  }

  HikariConfig buildConfig(TenantConnectionTarget target) {
    var config = new HikariConfig();
    config.setPoolName("tenant-" + target.databaseName());
    config.setJdbcUrl(target.jdbcUrl());
    config.setUsername(target.username());
    config.setPassword(target.password());
    config.setMaximumPoolSize(poolProperties.maxConnectionsPerTenant());
    config.setMinimumIdle(0);
    config.setConnectionTimeout(poolProperties.acquireTimeout().toMillis());
    config.setIdleTimeout(poolProperties.idleTimeout().toMillis());
    // Do not open a socket while the pool is being registered
    config.setInitializationFailTimeout(-1);
    config.addDataSourceProperty("ApplicationName", APPLICATION_NAME);
    config.addDataSourceProperty(
        "options", "-c statement_timeout=" + poolProperties.statementTimeout().toMillis());
    config.addDataSourceProperty(
        "connectTimeout", String.valueOf(cluster.connectTimeout().toSeconds()));
    return config;
  }
}

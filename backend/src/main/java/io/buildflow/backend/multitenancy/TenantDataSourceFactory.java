package io.buildflow.backend.multitenancy;

import com.zaxxer.hikari.HikariDataSource;

/** Builds the connection pool backing one tenant database. */
public interface TenantDataSourceFactory {

  HikariDataSource create(String databaseName);
}

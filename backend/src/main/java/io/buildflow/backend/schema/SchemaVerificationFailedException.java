package io.buildflow.backend.schema;

import java.util.List;

/** A tenant database is missing tables it must have after schema creation. */
public class SchemaVerificationFailedException extends RuntimeException {

  private final String databaseName;
  private final List<String> missingTables;

  public SchemaVerificationFailedException(String databaseName, List<String> missingTables) {
    super("Tenant database " + databaseName + " is missing required tables: " + missingTables);
    this.databaseName = databaseName;
    this.missingTables = List.copyOf(missingTables);
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public List<String> getMissingTables() {
    return missingTables;
  }
}

package io.buildflow.backend.multitenancy;

public class InvalidDatabaseNameException extends IllegalArgumentException {

  private final String databaseName;

  public InvalidDatabaseNameException(String databaseName) {
    super("Invalid database name: " + databaseName);
    this.databaseName = databaseName;
  }

  public String getDatabaseName() {
    return databaseName;
  }
}

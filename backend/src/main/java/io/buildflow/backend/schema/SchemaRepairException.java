package io.buildflow.backend.schema;

public class SchemaRepairException extends RuntimeException {

  public SchemaRepairException(String message) {
    super(message);
  }

  public SchemaRepairException(String message, Throwable cause) {
    super(message, cause);
  }
}

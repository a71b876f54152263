package io.buildflow.backend.schema;

import java.util.List;
import java.util.Map;

public record SchemaValidationReport(
    String databaseName, Map<SchemaModule, List<String>> missingTables, boolean healthy) {}

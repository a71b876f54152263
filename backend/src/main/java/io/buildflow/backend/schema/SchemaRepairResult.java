package io.buildflow.backend.schema;

import java.util.List;

public record SchemaRepairResult(
    String databaseName, int tablesBefore, int tablesAfter, int added, List<String> allTables) {}

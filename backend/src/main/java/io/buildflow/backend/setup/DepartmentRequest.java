package io.buildflow.backend.setup;

public record DepartmentRequest(String name, String description) {}

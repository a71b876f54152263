package io.buildflow.backend.setup;

public record SetupStatus(boolean setupComplete, String agencyName) {}

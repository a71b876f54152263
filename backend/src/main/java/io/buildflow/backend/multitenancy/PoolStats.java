package io.buildflow.backend.multitenancy;

import java.time.Instant;

public record PoolStats(
    String databaseName,
    int active,
    int idle,
    int waiting,
    int total,
    int maxConnections,
    int borrowed,
    long acquireCount,
    Instant createdAt,
    Instant lastAcquiredAt) {}

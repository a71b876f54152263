package io.buildflow.backend.multitenancy;

import com.zaxxer.hikari.HikariDataSource;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** One registered pool plus the bookkeeping the registry needs for draining and stats. */
final class TenantPool {

  private final String databaseName;
  private final HikariDataSource dataSource;
  private final Instant createdAt;
  private final AtomicInteger borrowed = new AtomicInteger();
  private final AtomicLong acquireCount = new AtomicLong();
  private volatile Instant lastAcquiredAt;

  TenantPool(String databaseName, HikariDataSource dataSource) {
    this.databaseName = databaseName;
    this.dataSource = dataSource;
    this.createdAt = Instant.now();
  }

  String databaseName() {
    return databaseName;
  }

  HikariDataSource dataSource() {
    return dataSource;
  }

  Instant createdAt() {
    return createdAt;
  }

  Instant lastAcquiredAt() {
    return lastAcquiredAt;
  }

  long acquireCount() {
    return acquireCount.get();
  }

  int borrowed() {
    return borrowed.get();
  }

  void onBorrow() {
    borrowed.incrementAndGet();
    acquireCount.incrementAndGet();
    lastAcquiredAt = Instant.now();
  }

  void onReturn() {
    borrowed.decrementAndGet();
  }
}

package io.buildflow.backend.provisioning;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Registry entry of one agency in the central database. Rows are written by {@link
 * AgencyRegistry}; the entity is used for lookups.
 */
@Entity
@Table(name = "agencies", schema = "public")
public class Agency {

  @Id private UUID id;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "domain", nullable = false, unique = true)
  private String domain;

  @Column(name = "database_name", nullable = false, unique = true, updatable = false)
  private String databaseName;

  @Column(name = "owner_user_id")
  private UUID ownerUserId;

  @Column(name = "subscription_plan", nullable = false)
  private String subscriptionPlan;

  @Column(name = "max_users", nullable = false)
  private int maxUsers;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Agency() {}

  public Agency(
      UUID id,
      String name,
      String domain,
      String databaseName,
      UUID ownerUserId,
      String subscriptionPlan) {
    this.id = id;
    this.name = name;
    this.domain = domain;
    this.databaseName = databaseName;
    this.ownerUserId = ownerUserId;
    this.subscriptionPlan = subscriptionPlan;
    this.maxUsers = SubscriptionPlan.maxUsersFor(subscriptionPlan);
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDomain() {
    return domain;
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public UUID getOwnerUserId() {
    return ownerUserId;
  }

  public String getSubscriptionPlan() {
    return subscriptionPlan;
  }

  public int getMaxUsers() {
    return maxUsers;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

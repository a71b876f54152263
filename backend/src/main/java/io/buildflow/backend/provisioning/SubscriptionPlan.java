package io.buildflow.backend.provisioning;

import java.util.Locale;

public enum SubscriptionPlan {
  STARTER(5),
  PROFESSIONAL(25),
  ENTERPRISE(1000);

  static final int DEFAULT_MAX_USERS = 25;

  private final int maxUsers;

  SubscriptionPlan(int maxUsers) {
    this.maxUsers = maxUsers;
  }

  public int maxUsers() {
    return maxUsers;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** User limit for a plan name; unknown plans get the professional limit. */
  public static int maxUsersFor(String plan) {
    if (plan == null) {
      return DEFAULT_MAX_USERS;
    }
    for (SubscriptionPlan candidate : values()) {
      if (candidate.value().equals(plan.trim().toLowerCase(Locale.ROOT))) {
        return candidate.maxUsers;
      }
    }
    return DEFAULT_MAX_USERS;
  }
}

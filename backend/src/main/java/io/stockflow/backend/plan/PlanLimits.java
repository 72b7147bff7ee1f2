package io.stockflow.backend.plan;

import java.util.List;

/**
 * Catalog entry for one plan. Quota fields use {@value #UNLIMITED} for "no limit". {@code maxUsers}
 * includes the accountant seats counted by {@code maxContadores}.
 */
public record PlanLimits(
    String displayName,
    String description,
    long monthlyPrice,
    int maxUsers,
    int maxContadores,
    int maxWarehouses,
    int maxProducts,
    int maxInvoices,
    int maxEmployees,
    List<String> features) {

  public static final int UNLIMITED = -1;

  public PlanLimits {
    features = List.copyOf(features);
  }

  public static boolean isUnlimited(int limit) {
    return limit == UNLIMITED;
  }

  /** Seats available to regular users once accountant seats are set aside. */
  public int maxRegularUsers() {
    return isUnlimited(maxUsers) ? UNLIMITED : maxUsers - maxContadores;
  }
}

package io.stockflow.backend.limit;

/** Quota-bound resources. {@link #resource()} is the name reported in limit errors. */
public enum LimitType {
  USERS("users"),
  PRODUCTS("products"),
  INVOICES("invoices"),
  WAREHOUSES("warehouses"),
  CONTADORES("contadores"),
  EMPLOYEES("employees");

  private final String resource;

  LimitType(String resource) {
    this.resource = resource;
  }

  public String resource() {
    return resource;
  }
}

package io.stockflow.backend.tenant;

import io.stockflow.backend.plan.PlanLimits;
import io.stockflow.backend.plan.SubscriptionPlan;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A customer organization. The quota columns mirror the catalog entry of the last applied plan and
 * are only written through {@link #applyPlan(SubscriptionPlan, PlanLimits)}.
 */
@Entity
@Table(name = "tenants")
public class Tenant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "external_org_id", nullable = false, unique = true)
  private String externalOrgId;

  @Column(name = "name", nullable = false)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "plan", length = 20)
  private SubscriptionPlan plan;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TenantStatus status;

  @Column(name = "max_users", nullable = false)
  private int maxUsers;

  @Column(name = "max_products", nullable = false)
  private int maxProducts;

  @Column(name = "max_invoices", nullable = false)
  private int maxInvoices;

  @Column(name = "max_warehouses", nullable = false)
  private int maxWarehouses;

  @Column(name = "max_employees", nullable = false)
  private int maxEmployees;

  @Column(name = "payment_source_id")
  private String paymentSourceId;

  @Column(name = "billing_email")
  private String billingEmail;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Tenant() {}

  public Tenant(String externalOrgId, String name) {
    this.externalOrgId = externalOrgId;
    this.name = name;
    this.status = TenantStatus.ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Records the plan and copies its quotas onto the tenant. */
  public void applyPlan(SubscriptionPlan plan, PlanLimits limits) {
    this.plan = plan;
    this.maxUsers = limits.maxUsers();
    this.maxProducts = limits.maxProducts();
    this.maxInvoices = limits.maxInvoices();
    this.maxWarehouses = limits.maxWarehouses();
    this.maxEmployees = limits.maxEmployees();
    this.updatedAt = Instant.now();
  }

  public void activate() {
    this.status = TenantStatus.ACTIVE;
    this.updatedAt = Instant.now();
  }

  public void suspend() {
    this.status = TenantStatus.SUSPENDED;
    this.updatedAt = Instant.now();
  }

  public void attachPaymentSource(String paymentSourceId) {
    this.paymentSourceId = paymentSourceId;
    this.updatedAt = Instant.now();
  }

  public void detachPaymentSource() {
    this.paymentSourceId = null;
    this.updatedAt = Instant.now();
  }

  public void updateBillingEmail(String billingEmail) {
    this.billingEmail = billingEmail;
    this.updatedAt = Instant.now();
  }

  public boolean hasPaymentSource() {
    return paymentSourceId != null && !paymentSourceId.isBlank();
  }

  public UUID getId() {
    return id;
  }

  public String getExternalOrgId() {
    return externalOrgId;
  }

  public String getName() {
    return name;
  }

  public SubscriptionPlan getPlan() {
    return plan;
  }

  public TenantStatus getStatus() {
    return status;
  }

  public int getMaxUsers() {
    return maxUsers;
  }

  public int getMaxProducts() {
    return maxProducts;
  }

  public int getMaxInvoices() {
    return maxInvoices;
  }

  public int getMaxWarehouses() {
    return maxWarehouses;
  }

  public int getMaxEmployees() {
    return maxEmployees;
  }

  public String getPaymentSourceId() {
    return paymentSourceId;
  }

  public String getBillingEmail() {
    return billingEmail;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

package io.stockflow.backend.user;

public enum UserRole {
  SUPER_ADMIN,
  ADMIN,
  MANAGER,
  EMPLOYEE,
  CONTADOR
}

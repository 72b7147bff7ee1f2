package io.stockflow.backend.user;

public enum UserStatus {
  PENDING,
  ACTIVE,
  SUSPENDED,
  INACTIVE
}

package io.stockflow.backend.user;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<User, UUID> {

  List<User> findByTenantIdAndRoleAndStatus(UUID tenantId, UserRole role, UserStatus status);
}

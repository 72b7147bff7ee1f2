package io.stockflow.backend.limit;

import io.stockflow.backend.limit.LimitEnforcementService.LimitUsage;
import io.stockflow.backend.multitenancy.RequestScopes;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/billing")
public class UsageController {

  private final LimitEnforcementService limitEnforcementService;

  public UsageController(LimitEnforcementService limitEnforcementService) {
    this.limitEnforcementService = limitEnforcementService;
  }

  @GetMapping("/usage")
  @PreAuthorize("hasAnyRole('SUPER_ADMIN', 'ADMIN', 'MANAGER', 'EMPLOYEE', 'CONTADOR')")
  public ResponseEntity<Map<LimitType, LimitUsage>> getUsage() {
    return ResponseEntity.ok(
        limitEnforcementService.getUsageSummary(RequestScopes.requireTenantId()));
  }
}

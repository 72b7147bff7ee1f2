package io.stockflow.backend.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.stockflow.backend.security.OrgJwtUtils;
import io.stockflow.backend.tenant.Tenant;
import io.stockflow.backend.tenant.TenantRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

/** Resolves the token's organization claim to a tenant and binds it to the request. */
public class TenantFilter extends OncePerRequestFilter {

  private final TenantRepository tenantRepository;
  private final Cache<String, UUID> tenantCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofHours(1)).build();

  public TenantFilter(TenantRepository tenantRepository) {
    this.tenantRepository = tenantRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      Jwt jwt = jwtAuth.getToken();
      String orgId = OrgJwtUtils.extractOrgId(jwt);

      if (orgId != null) {
        UUID tenantId = resolveTenant(orgId);
        if (tenantId == null) {
          response.sendError(HttpServletResponse.SC_FORBIDDEN, "Organization not provisioned");
          return;
        }
        RequestScopes.bind(tenantId, orgId);
        try {
          filterChain.doFilter(request, response);
        } finally {
          RequestScopes.clear();
        }
        return;
      }
    }

    // No JWT or no org claim: continue unbound (webhooks, actuator)
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/")
        || path.startsWith("/actuator/")
        || path.startsWith("/api/webhooks/");
  }

  private UUID resolveTenant(String orgId) {
    // Caffeine's get(key, loader) rejects null results; unprovisioned orgs are not cached
    UUID cached = tenantCache.getIfPresent(orgId);
    if (cached != null) {
      return cached;
    }
    UUID tenantId = tenantRepository.findByExternalOrgId(orgId).map(Tenant::getId).orElse(null);
    if (tenantId != null) {
      tenantCache.put(orgId, tenantId);
    }
    return tenantId;
  }
}

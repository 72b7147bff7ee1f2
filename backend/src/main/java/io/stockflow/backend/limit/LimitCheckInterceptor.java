package io.stockflow.backend.limit;

import io.stockflow.backend.multitenancy.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/** Runs the quota check for handlers annotated with {@link CheckLimit}. */
@Component
public class LimitCheckInterceptor implements HandlerInterceptor {

  private final LimitEnforcementService limitEnforcementService;

  public LimitCheckInterceptor(LimitEnforcementService limitEnforcementService) {
    this.limitEnforcementService = limitEnforcementService;
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (!(handler instanceof HandlerMethod handlerMethod)) {
      return true;
    }
    CheckLimit checkLimit = handlerMethod.getMethodAnnotation(CheckLimit.class);
    if (checkLimit == null) {
      return true;
    }
    limitEnforcementService.checkLimit(RequestScopes.requireTenantId(), checkLimit.value());
    return true;
  }
}

package io.stockflow.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem(
            resourceType + " not found",
            "No " + resourceType.toLowerCase() + " found with id " + id),
        null);
  }

  public static ResourceNotFoundException tenant(UUID tenantId) {
    return new ResourceNotFoundException("Tenant", tenantId);
  }

  /** The tenant exists but has never activated a plan. */
  public static ResourceNotFoundException subscriptionForTenant(UUID tenantId) {
    return new ResourceNotFoundException(
        "Subscription not found", "Tenant " + tenantId + " has no subscription");
  }

  private ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}

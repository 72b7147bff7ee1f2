package io.stockflow.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown by the limit guard when a tenant has used up a plan quota. Returns HTTP 403 carrying the
 * resource, the current count and the limit so the client can show an upgrade prompt.
 */
public class PlanLimitExceededException extends ErrorResponseException {

  private final String resource;
  private final long current;
  private final int limit;

  public PlanLimitExceededException(String resource, long current, int limit) {
    super(HttpStatus.FORBIDDEN, createProblem(resource, current, limit), null);
    this.resource = resource;
    this.current = current;
    this.limit = limit;
  }

  public String getResource() {
    return resource;
  }

  public long getCurrent() {
    return current;
  }

  public int getLimit() {
    return limit;
  }

  private static ProblemDetail createProblem(String resource, long current, int limit) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Plan limit exceeded");
    problem.setDetail(
        "%s limit reached (%d). Upgrade your plan.".formatted(capitalize(resource), limit));
    problem.setProperty("resource", resource);
    problem.setProperty("current", current);
    problem.setProperty("limit", limit);
    problem.setProperty("upgradeUrl", "/billing");
    return problem;
  }

  private static String capitalize(String value) {
    return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }
}

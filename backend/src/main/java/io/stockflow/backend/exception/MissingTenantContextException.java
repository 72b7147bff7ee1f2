package io.stockflow.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class MissingTenantContextException extends ErrorResponseException {

  public MissingTenantContextException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Missing tenant context");
    problem.setDetail("Token does not resolve to a provisioned organization");
    return problem;
  }
}

package io.stockflow.backend.integration.payment;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A gateway key or secret needed by the current operation is not configured. */
public class PaymentGatewayConfigurationException extends ErrorResponseException {

  public PaymentGatewayConfigurationException(String setting) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(setting), null);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String setting) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Payment gateway not configured");
    problem.setDetail(setting + " not configured");
    return problem;
  }
}

package io.stockflow.backend.integration.payment;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The request never produced an HTTP response (connection refused, reset, DNS failure). */
public class PaymentGatewayTransportException extends ErrorResponseException {

  public PaymentGatewayTransportException(String operation, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(operation, cause), cause);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String operation, Throwable cause) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Payment gateway unreachable");
    problem.setDetail(
        "Could not reach payment gateway during %s: %s".formatted(operation, cause.getMessage()));
    return problem;
  }
}

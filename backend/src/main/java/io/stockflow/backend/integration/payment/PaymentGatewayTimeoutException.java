package io.stockflow.backend.integration.payment;

import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The gateway did not answer within the configured timeout. The outcome of the call is unknown: a
 * charge may or may not have been created.
 */
public class PaymentGatewayTimeoutException extends ErrorResponseException {

  public PaymentGatewayTimeoutException(String operation, Duration timeout, Throwable cause) {
    super(HttpStatus.GATEWAY_TIMEOUT, createProblem(operation, timeout), cause);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String operation, Duration timeout) {
    var problem = ProblemDetail.forStatus(HttpStatus.GATEWAY_TIMEOUT);
    problem.setTitle("Payment gateway timeout");
    problem.setDetail(
        "Payment gateway did not respond to %s within %d ms"
            .formatted(operation, timeout.toMillis()));
    return problem;
  }
}

package io.stockflow.backend.integration.payment;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The gateway answered with a non-2xx status. Carries the upstream status code and text; never
 * retried inline.
 */
public class PaymentGatewayException extends ErrorResponseException {

  private final int upstreamStatus;
  private final String upstreamStatusText;

  public PaymentGatewayException(
      String operation, int upstreamStatus, String upstreamStatusText, String responseBody) {
    super(
        HttpStatus.BAD_GATEWAY,
        createProblem(operation, upstreamStatus, upstreamStatusText),
        null);
    this.upstreamStatus = upstreamStatus;
    this.upstreamStatusText = upstreamStatusText;
    if (responseBody != null && !responseBody.isBlank()) {
      getBody().setProperty("gatewayResponse", abbreviate(responseBody));
    }
  }

  public int getUpstreamStatus() {
    return upstreamStatus;
  }

  public String getUpstreamStatusText() {
    return upstreamStatusText;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String operation, int status, String statusText) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Payment gateway error");
    problem.setDetail(
        "Payment gateway error during %s: %d %s".formatted(operation, status, statusText));
    problem.setProperty("upstreamStatus", status);
    return problem;
  }

  private static String abbreviate(String body) {
    return body.length() <= 500 ? body : body.substring(0, 500) + "...";
  }
}

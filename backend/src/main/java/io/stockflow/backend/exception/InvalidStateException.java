package io.stockflow.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A transition or operation that the current subscription or tenant state does not allow. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  /**
   * {@code operation} needs an ACTIVE subscription. The current status is also exposed as the
   * {@code subscriptionStatus} problem property.
   */
  public static InvalidStateException subscriptionNotActive(String operation, Enum<?> status) {
    var exception =
        new InvalidStateException(
            "Subscription not active",
            "%s requires an active subscription (current status: %s)".formatted(operation, status));
    exception.getBody().setProperty("subscriptionStatus", status.name());
    return exception;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}

package io.stockflow.backend.exception;

import java.time.Instant;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The request collides with work already recorded, such as a renewal charge for the period. */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  /** A live renewal claim already exists for the period ending at {@code periodEnd}. */
  public static ResourceConflictException renewalAlreadyClaimed(UUID tenantId, Instant periodEnd) {
    var exception =
        new ResourceConflictException(
            "Renewal already attempted",
            "A renewal charge for the period of tenant %s ending %s already exists"
                .formatted(tenantId, periodEnd));
    exception.getBody().setProperty("periodEnd", periodEnd.toString());
    return exception;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}

package io.stockflow.backend.integration.payment;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidWebhookSignatureException extends ErrorResponseException {

  public InvalidWebhookSignatureException() {
    super(HttpStatus.BAD_REQUEST, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid webhook signature");
    problem.setDetail("Event checksum does not match");
    return problem;
  }
}

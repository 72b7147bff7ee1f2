package io.stockflow.backend.exception;

import io.stockflow.backend.integration.payment.PaymentGatewayConfigurationException;
import io.stockflow.backend.integration.payment.PaymentGatewayException;
import io.stockflow.backend.integration.payment.PaymentGatewayTimeoutException;
import io.stockflow.backend.integration.payment.PaymentGatewayTransportException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps exceptions to RFC 9457 problem details. Domain exceptions extend {@link
 * ErrorResponseException} and carry their own status; the handlers here add logging, and cover the
 * framework exceptions that do not.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(PlanLimitExceededException.class)
  public ResponseEntity<ProblemDetail> handlePlanLimitExceeded(
      PlanLimitExceededException ex, HttpServletRequest request) {
    log.info(
        "Plan limit reached: path={}, resource={}, current={}, limit={}",
        request.getRequestURI(),
        ex.getResource(),
        ex.getCurrent(),
        ex.getLimit());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler({
    PaymentGatewayException.class,
    PaymentGatewayTimeoutException.class,
    PaymentGatewayTransportException.class,
    PaymentGatewayConfigurationException.class
  })
  public ResponseEntity<ProblemDetail> handlePaymentGateway(
      ErrorResponseException ex, HttpServletRequest request) {
    log.error(
        "Payment gateway failure: path={}, status={}, detail={}",
        request.getRequestURI(),
        ex.getStatusCode().value(),
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrityViolation(
      DataIntegrityViolationException ex) {
    log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Conflicting change");
    problem.setDetail("The change conflicts with existing data. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}

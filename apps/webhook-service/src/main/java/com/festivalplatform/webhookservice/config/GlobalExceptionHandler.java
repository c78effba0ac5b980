package com.festivalplatform.webhookservice.config;

import com.festivalplatform.domain.webhooks.WebhookDomainException;
import com.festivalplatform.integration.webhookhttp.WebhookUrlRejectedException;
import com.festivalplatform.webhookservice.delivery.DeliveryNotFoundException;
import com.festivalplatform.webhookservice.delivery.DeliveryStateConflictException;
import com.festivalplatform.webhookservice.registry.WebhookNotFoundException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
    problem.setType(URI.create(TYPE_PREFIX + "validation-error"));
    problem.setTitle("Validation Error");
    problem.setProperty(
        "errors",
        ex.getFieldErrors().stream()
            .map(
                fe ->
                    new FieldError(
                        fe.getField(),
                        fe.getDefaultMessage(),
                        String.valueOf(fe.getRejectedValue())))
            .toList());
    return problem;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
    problem.setType(URI.create(TYPE_PREFIX + "malformed-request"));
    problem.setTitle("Malformed Request");
    return problem;
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParam(MissingServletRequestParameterException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "missing-parameter"));
    problem.setTitle("Missing Parameter");
    return problem;
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    String detail =
        String.format(
            "Parameter '%s' should be of type '%s'",
            ex.getName(),
            ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    problem.setType(URI.create(TYPE_PREFIX + "type-mismatch"));
    problem.setTitle("Type Mismatch");
    return problem;
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ProblemDetail handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "method-not-allowed"));
    problem.setTitle("Method Not Allowed");
    return problem;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ProblemDetail handleNotFound(NoResourceFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "not-found"));
    problem.setTitle("Not Found");
    return problem;
  }

  @ExceptionHandler(WebhookNotFoundException.class)
  public ProblemDetail handleWebhookNotFound(WebhookNotFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "webhook-not-found"));
    problem.setTitle("Webhook Not Found");
    return problem;
  }

  @ExceptionHandler(DeliveryNotFoundException.class)
  public ProblemDetail handleDeliveryNotFound(DeliveryNotFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "delivery-not-found"));
    problem.setTitle("Delivery Not Found");
    return problem;
  }

  @ExceptionHandler(DeliveryStateConflictException.class)
  public ProblemDetail handleDeliveryConflict(DeliveryStateConflictException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "delivery-state-conflict"));
    problem.setTitle("Delivery State Conflict");
    problem.setProperty("deliveryStatus", ex.status() == null ? null : ex.status().name());
    return problem;
  }

  @ExceptionHandler(WebhookUrlRejectedException.class)
  public ProblemDetail handleUrlRejected(WebhookUrlRejectedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "invalid-webhook-url"));
    problem.setTitle("Invalid Webhook URL");
    return problem;
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "invalid-argument"));
    problem.setTitle("Invalid Argument");
    return problem;
  }

  @ExceptionHandler(WebhookDomainException.class)
  public ProblemDetail handleWebhookDomain(WebhookDomainException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "webhook-domain-error"));
    problem.setTitle("Webhook Validation Error");
    return problem;
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please try again later.");
    problem.setType(URI.create(TYPE_PREFIX + "internal-error"));
    problem.setTitle("Internal Server Error");
    return problem;
  }

  private record FieldError(String field, String message, String rejectedValue) {}
}

package com.aiadvent.canvas.common.exception;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.validation.WorkflowGraphParsingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(WorkflowGraphParsingException.class)
  public ResponseEntity<ProblemDetail> handleMalformedGraph(WorkflowGraphParsingException ex) {
    log.warn("Rejected malformed workflow graph: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Malformed workflow graph");
    problem.setDetail(ex.getMessage());
    problem.setProperty("issues", ex.issues());
    CompileDiagnostic first = ex.issues().isEmpty() ? null : ex.issues().get(0);
    if (first != null) {
      problem.setProperty("code", first.code());
    }
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
  public ResponseEntity<ProblemDetail> handleUnreadableRequest(Exception ex) {
    log.warn("Rejected unreadable request: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request payload");
    problem.setDetail(
        ex instanceof MissingServletRequestParameterException missing
            ? "Missing request parameter '%s'".formatted(missing.getParameterName())
            : "Request body could not be read");
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}

package com.nosota.tradeflow.exception;

import com.nosota.tradeflow.dto.ErrorResponse;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.AttemptLimitExceededException;
import com.nosota.tradeflow.error.ConcurrentModificationException;
import com.nosota.tradeflow.error.ConversationClosedException;
import com.nosota.tradeflow.error.DuplicateActiveResourceException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.error.InvalidTransitionException;
import com.nosota.tradeflow.error.WorkflowException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(
            InvalidTransitionException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Invalid transition [correlationId={}]: {}", correlationId, ex.getMessage());
        return workflowError(HttpStatus.CONFLICT, "Invalid Transition", ex, request);
    }

    @ExceptionHandler(ActorNotAuthorizedException.class)
    public ResponseEntity<ErrorResponse> handleActorNotAuthorized(
            ActorNotAuthorizedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Actor not authorized [correlationId={}]: {}", correlationId, ex.getMessage());
        return workflowError(HttpStatus.FORBIDDEN, "Actor Not Authorized", ex, request);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Entity not found [correlationId={}]: {}", correlationId, ex.getMessage());
        return workflowError(HttpStatus.NOT_FOUND, "Entity Not Found", ex, request);
    }

    @ExceptionHandler(ConcurrentModificationException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(
            ConcurrentModificationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Concurrent modification [correlationId={}]: {}", correlationId, ex.getMessage());
        return workflowError(HttpStatus.CONFLICT, "Concurrent Modification", ex, request);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLocking(
            OptimisticLockingFailureException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Version conflict [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Concurrent Modification",
                "The resource was changed by another request, reload and try again",
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ConversationClosedException.class)
    public ResponseEntity<ErrorResponse> handleConversationClosed(
            ConversationClosedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Conversation closed [correlationId={}]: {}", correlationId, ex.getMessage());
        return workflowError(HttpStatus.CONFLICT, "Conversation Closed", ex, request);
    }

    @ExceptionHandler(AttemptLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleAttemptLimitExceeded(
            AttemptLimitExceededException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Attempt limit exceeded [correlationId={}]: {}", correlationId, ex.getMessage());
        return workflowError(HttpStatus.UNPROCESSABLE_ENTITY, "Attempt Limit Exceeded", ex, request);
    }

    @ExceptionHandler(DuplicateActiveResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateActiveResource(
            DuplicateActiveResourceException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Duplicate active resource [correlationId={}]: {}", correlationId, ex.getMessage());
        return workflowError(HttpStatus.CONFLICT, "Duplicate Active Resource", ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.error("Validation failed [correlationId={}]: {}", correlationId, fields);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "Request validation failed",
                request.getRequestURI(),
                fields
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Bad request [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Bad Request",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal argument [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Argument",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Invalid State",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static ResponseEntity<ErrorResponse> workflowError(HttpStatus status, String title, WorkflowException ex,
                                                               HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.of(
                status.value(),
                title,
                ex.getMessage(),
                request.getRequestURI(),
                ex.getDetails()
        );
        return ResponseEntity.status(status).body(error);
    }
}

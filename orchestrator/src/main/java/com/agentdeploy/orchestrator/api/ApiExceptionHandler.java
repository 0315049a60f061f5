package com.agentdeploy.orchestrator.api;

import com.agentdeploy.orchestrator.api.dto.ErrorResponse;
import com.agentdeploy.orchestrator.error.DeploymentException;
import com.agentdeploy.orchestrator.error.ErrorCode;
import com.agentdeploy.orchestrator.store.JobStoreException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps every failure to {@code {code, message}} with a matching HTTP status.
 *
 *   NOT_FOUND      → 404
 *   CONFLICT       → 409
 *   INVALID_CONFIG → 400
 *   TIMEOUT        → 504
 *   INTERNAL       → 500 (503 when the job store is unreachable)
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DeploymentException.class)
    public ResponseEntity<ErrorResponse> handleDeployment(DeploymentException ex, HttpServletRequest request) {
        log.warn("{} {} → {}: {}", request.getMethod(), request.getRequestURI(), ex.getCode(), ex.getMessage());
        return ResponseEntity.status(statusFor(ex.getCode()))
                .body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message;
        if (ex instanceof MethodArgumentTypeMismatchException) {
            message = "Invalid value for '" + ((MethodArgumentTypeMismatchException) ex).getName() + "'";
        } else if (ex instanceof HttpMessageNotReadableException) {
            message = "Request body is not valid JSON";
        } else {
            message = ex.getMessage();
        }
        log.warn("{} {} → INVALID_CONFIG: {}", request.getMethod(), request.getRequestURI(), message);
        return ResponseEntity.badRequest().body(new ErrorResponse(ErrorCode.INVALID_CONFIG, message));
    }

    @ExceptionHandler(JobStoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(JobStoreException ex, HttpServletRequest request) {
        log.error("{} {} → job store unavailable: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(ErrorCode.INTERNAL, "Job store unavailable, retry later"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("{} {} → unhandled {}", request.getMethod(), request.getRequestURI(),
                ex.getClass().getSimpleName(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ErrorCode.INTERNAL, "Internal error"));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case NOT_FOUND      -> HttpStatus.NOT_FOUND;
            case CONFLICT       -> HttpStatus.CONFLICT;
            case INVALID_CONFIG -> HttpStatus.BAD_REQUEST;
            case TIMEOUT        -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL       -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}

package com.di.sqlpulse.exception;

import com.di.sqlpulse.config.MdcRequestFilter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps exceptions escaping the controllers to an {@link ErrorResponse}, categorized with
 * {@link ErrorCategory}.
 * <ul>
 *   <li>400: invalid identifiers, invalid settings, malformed or missing parameters</li>
 *   <li>404: unknown statement or connection</li>
 *   <li>503: a telemetry tier failure that escaped the service layer</li>
 *   <li>500: anything else</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidSettingsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSettings(InvalidSettingsException e) {
        ErrorResponse body = respond("INVALID_SETTINGS", e, HttpStatus.BAD_REQUEST);
        body.addDetail("violations", e.getViolations());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(InvalidIdentifierException.class)
    public ResponseEntity<ErrorResponse> handleInvalidIdentifier(InvalidIdentifierException e) {
        ErrorResponse body = respond("INVALID_IDENTIFIER", e, HttpStatus.BAD_REQUEST);
        body.addDetail("field", e.getField());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({StatementNotFoundException.class, ConnectionNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(respond("NOT_FOUND", e, HttpStatus.NOT_FOUND));
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeParseException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        List<String> fieldErrors = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.toList());
        ErrorResponse body = respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
        body.setCategory(ErrorCategory.VALIDATION_ERROR.name());
        body.setMessage(String.join("; ", fieldErrors));
        body.addDetail("violations", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(TierUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleTierUnavailable(TierUnavailableException e) {
        ErrorResponse body = respond("TIER_UNAVAILABLE", e, HttpStatus.SERVICE_UNAVAILABLE);
        if (e.getTier() != null) {
            body.addDetail("tier", e.getTier().getCode());
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private ErrorResponse respond(String eventType, Throwable exception, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        if (status.is5xxServerError()) {
            log.error("[API] {} [{}]: {}", eventType, category, exception.getMessage(), exception);
        } else {
            log.warn("[API] {} [{}]: {}", eventType, category, exception.getMessage());
        }
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setCategory(category.name());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        String path = MDC.get(MdcRequestFilter.REQUEST_PATH);
        response.setPath(path != null ? path : "/unknown");
        response.setRequestId(MDC.get(MdcRequestFilter.REQUEST_ID));
        return response;
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}

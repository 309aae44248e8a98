package io.github.shiftlog.workforce.presentation.controller;

import io.github.shiftlog.workforce.domain.exception.ErrorCode;
import io.github.shiftlog.workforce.domain.exception.InvalidStateTransitionException;
import io.github.shiftlog.workforce.domain.exception.WorkforceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WorkforceException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleWorkforceException(WorkforceException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        log.info("Request rejected: {} {}", e.getErrorCode(), e.getMessage());

        Map<String, Object> response = body(e.getErrorCode().name(), e.getMessage());
        if (e instanceof InvalidStateTransitionException) {
            InvalidStateTransitionException ist = (InvalidStateTransitionException) e;
            response.put("transition", ist.getTransition());
            response.put("currentStatus", ist.getCurrentStatus());
        }
        return new ResponseEntity<>(response, status);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return new ResponseEntity<>(body(ErrorCode.VALIDATION.name(), message), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return new ResponseEntity<>(body(ErrorCode.VALIDATION.name(), e.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unhandled exception occurred", e);

        Map<String, Object> response = body("Internal Server Error", e.getMessage());
        response.put("exceptionType", e.getClass().getSimpleName());

        Throwable rootCause = getRootCause(e);
        response.put("rootCause", rootCause.getClass().getSimpleName());
        response.put("rootCauseMessage", rootCause.getMessage());

        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVALID_STATE_TRANSITION:
            case CONFLICT:
            case ALREADY_USED:
                return HttpStatus.CONFLICT;
            case SCOPE_MISMATCH:
                return HttpStatus.FORBIDDEN;
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case RULE_INACTIVE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("message", message);
        return response;
    }

    private Throwable getRootCause(Throwable throwable) {
        Throwable rootCause = throwable;
        while (rootCause.getCause() != null) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }
}

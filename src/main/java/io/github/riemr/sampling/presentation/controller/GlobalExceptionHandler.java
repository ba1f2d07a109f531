package io.github.riemr.sampling.presentation.controller;

import io.github.riemr.sampling.application.dto.FailureDto;
import io.github.riemr.sampling.domain.exception.DayOptimizationException;
import io.github.riemr.sampling.domain.exception.InvalidInputException;
import io.github.riemr.sampling.domain.exception.ResultNotAvailableException;
import io.github.riemr.sampling.domain.exception.ScheduleDateNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({InvalidInputException.class, ResultNotAvailableException.class,
            MethodArgumentTypeMismatchException.class})
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return new ResponseEntity<>(failure(e.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ScheduleDateNotFoundException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleNotFound(ScheduleDateNotFoundException e) {
        return new ResponseEntity<>(failure(e.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(DayOptimizationException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleDayFailure(DayOptimizationException e) {
        log.warn("Day optimization failed: {}", e.getMessage());
        Map<String, Object> response = failure(e.getMessage());
        response.put("failure", FailureDto.from(e.getFailure()));
        return new ResponseEntity<>(response, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(Exception.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unhandled exception occurred", e);

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", "Internal Server Error");
        response.put("message", e.getMessage());
        response.put("exceptionType", e.getClass().getSimpleName());

        Throwable rootCause = getRootCause(e);
        response.put("rootCause", rootCause.getClass().getSimpleName());
        response.put("rootCauseMessage", rootCause.getMessage());

        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static Map<String, Object> failure(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", message);
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

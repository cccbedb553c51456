package com.trustplatform.trust.controller;

import com.trustplatform.common.exception.DependencyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(DependencyUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleDependencyUnavailable(DependencyUnavailableException ex) {
        log.warn("Evaluation aborted, dependency unavailable. dependency={}", ex.getDependency());
        return Map.of(
                "code", "DEPENDENCY_UNAVAILABLE",
                "message", "Trust facts could not be loaded, no decision was made",
                "dependency", ex.getDependency()
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException ex) {
        return Map.of(
                "code", "INVALID_REQUEST",
                "message", String.valueOf(ex.getMessage())
        );
    }
}

package com.serveos.engine.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CatalogConfigurationException.class)
    public ResponseEntity<ProblemDetail> handleCatalogConfiguration(
            CatalogConfigurationException ex, HttpServletRequest request) {
        log.warn("Rejected catalog configuration: path={}, issues={}", request.getRequestURI(), ex.getIssues().size());

        var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
        problem.setTitle("Invalid catalog configuration");
        problem.setDetail(ex.getMessage());
        problem.setProperty("issues", ex.getIssues());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(InvalidPathwayOverrideException.class)
    public ResponseEntity<ProblemDetail> handleInvalidOverride(
            InvalidPathwayOverrideException ex, HttpServletRequest request) {
        log.warn("Rejected pathway override: path={}, reason={}", request.getRequestURI(), ex.getBody().getDetail());
        return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
    }
}

package com.trainingplatform.engine.controller;

import com.trainingplatform.common.exception.TrainingEngineException;
import com.trainingplatform.engine.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class EngineExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(EngineExceptionHandler.class);

    @ExceptionHandler(TrainingEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngine(TrainingEngineException ex) {
        log.warn("Rejected request component={} operation={} field={} message={}",
            ex.getComponent(), ex.getOperation(), ex.getField(), ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("invalid_request", ex.getComponent(), ex.getOperation(),
                ex.getField(), ex.getMessage()));
    }

    /** Framework-level rejections such as unreadable bodies keep their own status. */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        log.warn("Request failed status={} reason={}", ex.getStatusCode(), ex.getReason());
        return ResponseEntity.status(ex.getStatusCode())
            .body(ErrorResponse.of("request_failed", ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("internal_error", "Unexpected error"));
    }
}

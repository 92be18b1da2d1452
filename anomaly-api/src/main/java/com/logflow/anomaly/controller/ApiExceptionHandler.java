package com.logflow.anomaly.controller;

import com.logflow.anomaly.dto.ErrorResponseDto;
import com.logflow.anomaly.engine.exception.InvalidDetectionConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidDetectionConfigException.class)
    public ResponseEntity<ErrorResponseDto> invalidConfiguration(InvalidDetectionConfigException e) {
        log.warn("Rejected detection request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponseDto.builder()
                .error("invalid_configuration")
                .message(e.getMessage())
                .field(e.getField())
                .build());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponseDto> upstreamFailure(DataAccessException e) {
        log.error("Time series fetch failed", e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponseDto.builder()
                .error("upstream_fetch_failure")
                .message(e.getMostSpecificCause().getMessage())
                .build());
    }
}

package com.troveindexer.api.controller;

import com.troveindexer.api.dto.ErrorBody;
import com.troveindexer.pricing.PriceUnavailableException;
import com.troveindexer.query.UnknownPositionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps read-side failures to ErrorBody (error, message, timestamp): unknown position 404, bad input 400,
 * no oracle price 503.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(UnknownPositionException.class)
    public ResponseEntity<ErrorBody> handleUnknownPosition(UnknownPositionException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("POSITION_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(PriceUnavailableException.class)
    public ResponseEntity<ErrorBody> handlePriceUnavailable(PriceUnavailableException ex) {
        log.warn("Price unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("PRICE_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleBadInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }
}

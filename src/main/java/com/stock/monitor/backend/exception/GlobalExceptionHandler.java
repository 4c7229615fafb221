package com.stock.monitor.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 첫 사이클이 끝나기 전: 빈 데이터 대신 "로딩 중"을 명시적으로 내려준다.
     */
    @ExceptionHandler(SnapshotNotReadyException.class)
    public ResponseEntity<LoadingResponse> handleNotReady(SnapshotNotReadyException e) {
        return ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(new LoadingResponse(true, e.getMessage()));
    }

    @ExceptionHandler(SymbolNotTrackedException.class)
    public ResponseEntity<ErrorResponse> handleNotTracked(SymbolNotTrackedException e) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(
                        "SYMBOL_NOT_TRACKED",
                        e.getMessage()
                ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorResponse(
                        "BAD_REQUEST",
                        e.getMessage()
                ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled API error", e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(
                        "INTERNAL_ERROR",
                        e.getMessage()
                ));
    }
}

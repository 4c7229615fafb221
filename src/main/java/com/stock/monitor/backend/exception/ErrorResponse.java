package com.stock.monitor.backend.exception;

public record ErrorResponse(String code, String message) {
}

package com.stock.monitor.backend.exception;

public record LoadingResponse(boolean loading, String message) {
}

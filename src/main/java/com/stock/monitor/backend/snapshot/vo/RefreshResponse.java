package com.stock.monitor.backend.snapshot.vo;

public record RefreshResponse(boolean accepted) {
}

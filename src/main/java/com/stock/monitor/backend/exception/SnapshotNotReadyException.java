package com.stock.monitor.backend.exception;

public class SnapshotNotReadyException extends RuntimeException {

    public SnapshotNotReadyException() {
        super("Data is loading, please wait...");
    }
}

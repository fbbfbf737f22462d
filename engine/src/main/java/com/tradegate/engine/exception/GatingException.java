package com.tradegate.engine.exception;

public class GatingException extends RuntimeException {
    public GatingException(String message) {
        super(message);
    }

    public GatingException(String message, Throwable cause) {
        super(message, cause);
    }
}

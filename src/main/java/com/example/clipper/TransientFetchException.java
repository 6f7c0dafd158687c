package com.example.clipper;

public class TransientFetchException extends RuntimeException {
    private final int httpStatus;

    public TransientFetchException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = 0;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}

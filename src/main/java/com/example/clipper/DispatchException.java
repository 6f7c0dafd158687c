package com.example.clipper;

/**
 * Raised when the remote platform refuses a workflow dispatch. A status of {@code 0} means the request
 * never got an HTTP answer.
 */
public class DispatchException extends RuntimeException {
    private final int httpStatus;
    private final String body;

    public DispatchException(int httpStatus, String body) {
        super("Workflow dispatch failed status=" + httpStatus + " body=" + body);
        this.httpStatus = httpStatus;
        this.body = body;
    }

    public DispatchException(int httpStatus, String body, Throwable cause) {
        super("Workflow dispatch failed status=" + httpStatus + " body=" + body, cause);
        this.httpStatus = httpStatus;
        this.body = body;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getBody() {
        return body;
    }
}

package com.example.clipper.util;

/**
 * Result of one orchestrated dispatch as reported to the caller.
 */
public enum OutcomeType {
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED,
    DISPATCH_ERROR
}

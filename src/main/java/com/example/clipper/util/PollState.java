package com.example.clipper.util;

/**
 * How a poll loop ended.
 */
public enum PollState {
    COMPLETED,
    TIMED_OUT,
    CANCELLED
}

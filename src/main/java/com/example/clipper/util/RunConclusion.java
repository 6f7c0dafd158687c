package com.example.clipper.util;

import java.util.Locale;

/**
 * Final verdict of a completed run. Everything except {@code success} counts as a failure.
 */
public enum RunConclusion {
    SUCCESS,
    FAILURE;

    public static RunConclusion fromRemote(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return "success".equals(value.trim().toLowerCase(Locale.ROOT)) ? SUCCESS : FAILURE;
    }
}

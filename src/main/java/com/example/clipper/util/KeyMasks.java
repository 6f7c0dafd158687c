package com.example.clipper.util;

public final class KeyMasks {
    private static final int VISIBLE = 4;

    private KeyMasks() {
    }

    public static String mask(String key) {
        if (key == null || key.length() <= VISIBLE * 2) {
            return "****";
        }
        return key.substring(0, VISIBLE) + "…" + key.substring(key.length() - VISIBLE);
    }
}

package com.example.clipper.service;

import com.example.clipper.config.CorrelationProperties;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates tokens shaped {@code <prefix>-<millis>-<6 base36 chars>}. The millisecond part never repeats
 * within one process, even when two tokens are requested in the same millisecond.
 */
@Component
public class CorrelationTokenGenerator {
    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int SUFFIX_LENGTH = 6;

    private final Clock clock;
    private final String prefix;
    private final SecureRandom random = new SecureRandom();
    private final AtomicLong lastMillis = new AtomicLong();

    public CorrelationTokenGenerator(CorrelationProperties props, Clock clock) {
        this.clock = clock;
        this.prefix = props.getTokenPrefix() == null || props.getTokenPrefix().isBlank() ? "clipper" : props.getTokenPrefix();
    }

    public String next() {
        long now = clock.millis();
        long stamp = lastMillis.updateAndGet(previous -> Math.max(previous + 1, now));
        return prefix + "-" + stamp + "-" + suffix();
    }

    private String suffix() {
        char[] chars = new char[SUFFIX_LENGTH];
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            chars[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(chars);
    }
}

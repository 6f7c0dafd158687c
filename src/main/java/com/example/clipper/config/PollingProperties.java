package com.example.clipper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Interval and overall budget for watching a dispatched run.
 */
@ConfigurationProperties(prefix = "clipper.polling")
public class PollingProperties {

    private long intervalSeconds = 5;
    private long timeoutSeconds = 600;

    public Duration interval() {
        return Duration.ofSeconds(Math.max(1, intervalSeconds));
    }

    public Duration timeout() {
        return Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}

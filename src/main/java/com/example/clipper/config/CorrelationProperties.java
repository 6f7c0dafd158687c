package com.example.clipper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "clipper.correlation")
public class CorrelationProperties {

    private String tokenPrefix = "clipper";
    private String tokenInputKey = "worker_id";
    private String urlInputKey = "youtube_url";
    private long toleranceSeconds = 10;
    private int listPageSize = 10;

    public Duration tolerance() {
        return Duration.ofSeconds(Math.max(0, toleranceSeconds));
    }

    public String getTokenPrefix() {
        return tokenPrefix;
    }

    public void setTokenPrefix(String tokenPrefix) {
        this.tokenPrefix = tokenPrefix;
    }

    public String getTokenInputKey() {
        return tokenInputKey;
    }

    public void setTokenInputKey(String tokenInputKey) {
        this.tokenInputKey = tokenInputKey;
    }

    public String getUrlInputKey() {
        return urlInputKey;
    }

    public void setUrlInputKey(String urlInputKey) {
        this.urlInputKey = urlInputKey;
    }

    public long getToleranceSeconds() {
        return toleranceSeconds;
    }

    public void setToleranceSeconds(long toleranceSeconds) {
        this.toleranceSeconds = toleranceSeconds;
    }

    public int getListPageSize() {
        return listPageSize;
    }

    public void setListPageSize(int listPageSize) {
        this.listPageSize = listPageSize;
    }
}

package com.example.clipper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "clipper.telegram")
public class TelegramProperties {

    private String baseUrl = "https://api.telegram.org";
    private String token;
    private String chatId;
    private long timeoutSeconds = 60;

    public TelegramProperties() {
    }

    public boolean isConfigured() {
        return token != null && !token.isBlank() && chatId != null && !chatId.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getChatId() {
        return chatId;
    }

    public void setChatId(String chatId) {
        this.chatId = chatId;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}

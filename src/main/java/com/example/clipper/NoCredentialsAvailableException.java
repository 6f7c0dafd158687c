package com.example.clipper;

public class NoCredentialsAvailableException extends RuntimeException {
    private final String service;

    public NoCredentialsAvailableException(String service, String keyFile, String envVar) {
        super("No API keys available for service: " + service
                + ". Either add keys to " + keyFile + " or set " + envVar + " environment variable.");
        this.service = service;
    }

    public String getService() {
        return service;
    }
}

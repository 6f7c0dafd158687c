package com.example.clipper.service.keys;

/**
 * Tests one key of a service against that service's live API.
 */
public interface KeyValidator {
    String service();

    boolean validate(String key);
}

package com.example.clipper.controller;

import com.example.clipper.dto.web.KeyPoolResponse;
import com.example.clipper.service.keys.CredentialRotator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.regex.Pattern;

/**
 * Read-only view of the key pools. Keys themselves are never returned.
 */
@RestController
@RequestMapping("/v1/clipper/keys")
public class KeysController {
    private static final Pattern SERVICE_NAME = Pattern.compile("[a-z0-9][a-z0-9-]{0,31}");

    private final CredentialRotator rotator;

    public KeysController(CredentialRotator rotator) {
        this.rotator = rotator;
    }

    @GetMapping("/{service}")
    public KeyPoolResponse pool(@PathVariable String service) {
        validateService(service);
        int count = rotator.getCount(service);
        return new KeyPoolResponse(service, count, count > 0);
    }

    @DeleteMapping("/{service}/cache")
    public ResponseEntity<Void> reload(@PathVariable String service) {
        validateService(service);
        rotator.clearCache(service);
        return ResponseEntity.noContent().build();
    }

    private void validateService(String service) {
        // service names end up in a file name
        if (service == null || !SERVICE_NAME.matcher(service).matches()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "SERVICE_INVALID");
        }
    }
}

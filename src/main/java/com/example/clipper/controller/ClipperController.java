package com.example.clipper.controller;

import com.example.clipper.NoCredentialsAvailableException;
import com.example.clipper.dto.JobInput;
import com.example.clipper.dto.Outcome;
import com.example.clipper.dto.web.RunRequest;
import com.example.clipper.service.ClipperOrchestrator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/v1/clipper/runs")
public class ClipperController {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipperController.class);

    private final ClipperOrchestrator orchestrator;

    public ClipperController(ClipperOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<Outcome> run(@Valid @RequestBody RunRequest request) {
        if (request.url() == null || request.url().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "URL_REQUIRED");
        }
        Outcome outcome;
        try {
            outcome = orchestrator.run(new JobInput(request.url().trim(), request.inputs()), request.watchOrDefault());
        } catch (NoCredentialsAvailableException ex) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "NO_CREDENTIALS", ex);
        }

        LOGGER.info("clipper run url={} watch={} outcome={} token={}",
                request.url(), request.watchOrDefault(), outcome.type(), outcome.correlationToken());
        HttpStatus status = switch (outcome.type()) {
            case DISPATCHED -> HttpStatus.ACCEPTED;
            case DISPATCH_ERROR -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.OK;
        };
        return ResponseEntity.status(status).body(outcome);
    }

    @DeleteMapping("/{token}")
    public ResponseEntity<Void> cancel(@PathVariable String token) {
        if (!orchestrator.cancel(token)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "RUN_NOT_WATCHED");
        }
        return ResponseEntity.noContent().build();
    }
}

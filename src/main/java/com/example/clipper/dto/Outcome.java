package com.example.clipper.dto;

import com.example.clipper.util.OutcomeType;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Outcome(OutcomeType type,
                      String correlationToken,
                      String artifactRef,
                      String reason,
                      String followUpUrl,
                      String runUrl) {

    public static Outcome dispatched(String token, String followUpUrl) {
        return new Outcome(OutcomeType.DISPATCHED, token, null, null, followUpUrl, null);
    }

    public static Outcome succeeded(String token, String artifactRef, String runUrl) {
        return new Outcome(OutcomeType.SUCCEEDED, token, artifactRef, null, null, runUrl);
    }

    public static Outcome failed(String token, String reason, String runUrl) {
        return new Outcome(OutcomeType.FAILED, token, null, reason, null, runUrl);
    }

    public static Outcome timedOut(String token, String followUpUrl, String runUrl) {
        return new Outcome(OutcomeType.TIMED_OUT, token, null, null, followUpUrl, runUrl);
    }

    public static Outcome cancelled(String token, String followUpUrl, String runUrl) {
        return new Outcome(OutcomeType.CANCELLED, token, null, null, followUpUrl, runUrl);
    }

    public static Outcome dispatchError(String token, String reason) {
        return new Outcome(OutcomeType.DISPATCH_ERROR, token, null, reason, null, null);
    }
}

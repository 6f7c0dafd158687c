package com.example.clipper.dto;

import com.example.clipper.util.RunConclusion;
import com.example.clipper.util.RunStatus;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only snapshot of a workflow run as returned by the platform. {@code artifactRef} and
 * {@code failureDetail} are filled in locally once the run has completed.
 */
public record RemoteRun(long id,
                        String name,
                        String displayTitle,
                        String event,
                        RunStatus status,
                        RunConclusion conclusion,
                        String rawConclusion,
                        Instant createdAt,
                        String htmlUrl,
                        Map<String, String> inputs,
                        String artifactRef,
                        String failureDetail) {

    public RemoteRun {
        status = status == null ? RunStatus.UNKNOWN : status;
        // conclusion only means something once the run is done
        if (status != RunStatus.COMPLETED) {
            conclusion = null;
        }
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
    }

    public static RemoteRun snapshot(long id, Instant createdAt, RunStatus status, RunConclusion conclusion) {
        return new RemoteRun(id, null, null, "workflow_dispatch", status, conclusion,
                conclusion == null ? null : conclusion.name().toLowerCase(Locale.ROOT), createdAt, null, Map.of(), null, null);
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    public boolean succeeded() {
        return isCompleted() && conclusion == RunConclusion.SUCCESS;
    }

    /**
     * @return true when the run's title, name or echoed inputs carry the correlation token.
     */
    public boolean mentions(String token, String tokenKey) {
        if (token == null || token.isBlank()) {
            return false;
        }
        if (displayTitle != null && displayTitle.contains(token)) {
            return true;
        }
        if (name != null && name.contains(token)) {
            return true;
        }
        if (tokenKey != null && token.equals(inputs.get(tokenKey))) {
            return true;
        }
        return inputs.values().stream().anyMatch(token::equals);
    }

    public RemoteRun withArtifactRef(String ref) {
        return new RemoteRun(id, name, displayTitle, event, status, conclusion, rawConclusion, createdAt, htmlUrl,
                inputs, ref, failureDetail);
    }

    public RemoteRun withFailureDetail(String detail) {
        return new RemoteRun(id, name, displayTitle, event, status, conclusion, rawConclusion, createdAt, htmlUrl,
                inputs, artifactRef, detail);
    }
}

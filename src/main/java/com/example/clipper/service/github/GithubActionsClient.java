package com.example.clipper.service.github;

import com.example.clipper.DispatchException;
import com.example.clipper.TransientFetchException;
import com.example.clipper.config.GithubProperties;
import com.example.clipper.dto.DispatchRequest;
import com.example.clipper.dto.RemoteRun;
import com.example.clipper.service.keys.CredentialRotator;
import com.example.clipper.util.RunConclusion;
import com.example.clipper.util.RunStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin wrapper over the GitHub Actions REST endpoints the dispatch flow needs. Every request is
 * authenticated with the next key from the {@code github} pool.
 */
@Component
public class GithubActionsClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(GithubActionsClient.class);
    static final String DISPATCH_EVENT = "workflow_dispatch";
    private static final int LOG_SNIPPET_MAX = 500;

    private final WebClient client;
    private final CredentialRotator rotator;
    private final GithubProperties props;
    private final Duration timeout;

    public GithubActionsClient(@Qualifier("githubWebClient") WebClient client,
                               CredentialRotator rotator,
                               GithubProperties props) {
        this.client = client;
        this.rotator = rotator;
        this.props = props;
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
    }

    /**
     * Fires a {@code workflow_dispatch} event. GitHub answers 204 without any run identifier.
     *
     * @throws DispatchException when GitHub rejects the request or cannot be reached.
     */
    public void dispatch(DispatchRequest request) {
        String key = rotator.getNext(props.getKeyService());
        Map<String, Object> body = Map.of("ref", request.ref(), "inputs", request.inputs());
        try {
            client.post()
                    .uri("/repos/{owner}/{repo}/actions/workflows/{workflow}/dispatches",
                            props.getOwner(), props.getRepo(), request.workflowId())
                    .headers(h -> h.setBearerAuth(key))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(errorBody -> new DispatchException(resp.statusCode().value(), truncate(errorBody))))
                    .toBodilessEntity()
                    .block(timeout);
        } catch (DispatchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new DispatchException(0, ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Most recent dispatch-triggered runs of the configured workflow, newest first.
     */
    public List<RemoteRun> listRecentDispatchRuns(int perPage) {
        JsonNode root = get("list runs",
                "/repos/{owner}/{repo}/actions/workflows/{workflow}/runs?event={event}&per_page={perPage}",
                props.getOwner(), props.getRepo(), props.getWorkflowId(), DISPATCH_EVENT, perPage);
        List<RemoteRun> runs = new ArrayList<>();
        JsonNode items = root.path("workflow_runs");
        if (items.isArray()) {
            for (JsonNode item : items) {
                runs.add(toRemoteRun(item));
            }
        }
        return runs;
    }

    public RemoteRun getRun(long runId) {
        JsonNode node = get("run detail", "/repos/{owner}/{repo}/actions/runs/{runId}",
                props.getOwner(), props.getRepo(), runId);
        return toRemoteRun(node);
    }

    /**
     * @return download URL of the first artifact that has not expired yet.
     */
    public Optional<String> findArtifactUrl(long runId) {
        JsonNode root = get("run artifacts", "/repos/{owner}/{repo}/actions/runs/{runId}/artifacts",
                props.getOwner(), props.getRepo(), runId);
        for (JsonNode artifact : root.path("artifacts")) {
            if (artifact.path("expired").asBoolean(false)) {
                continue;
            }
            String url = textOrNull(artifact, "archive_download_url");
            if (url != null) {
                return Optional.of(url);
            }
        }
        return Optional.empty();
    }

    /**
     * Names the first failed job and, when GitHub reports it, the failed step inside it.
     */
    public Optional<String> describeFailedJob(long runId) {
        JsonNode root = get("run jobs", "/repos/{owner}/{repo}/actions/runs/{runId}/jobs",
                props.getOwner(), props.getRepo(), runId);
        for (JsonNode job : root.path("jobs")) {
            String conclusion = textOrNull(job, "conclusion");
            if (conclusion == null || "success".equals(conclusion) || "skipped".equals(conclusion)) {
                continue;
            }
            String jobName = textOrNull(job, "name");
            for (JsonNode step : job.path("steps")) {
                String stepConclusion = textOrNull(step, "conclusion");
                if (stepConclusion != null && !"success".equals(stepConclusion) && !"skipped".equals(stepConclusion)) {
                    return Optional.of("job '%s' %s at step '%s'".formatted(jobName, conclusion, textOrNull(step, "name")));
                }
            }
            return Optional.of("job '%s' %s".formatted(jobName, conclusion));
        }
        return Optional.empty();
    }

    private JsonNode get(String what, String uriTemplate, Object... uriVariables) {
        String key = rotator.getNext(props.getKeyService());
        JsonNode node;
        try {
            node = client.get()
                    .uri(uriTemplate, uriVariables)
                    .headers(h -> h.setBearerAuth(key))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(errorBody -> new TransientFetchException(
                                            "GitHub %s failed %s: %s".formatted(what, resp.statusCode(), truncate(errorBody)),
                                            resp.statusCode().value())))
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (TransientFetchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new TransientFetchException("GitHub %s failed: %s".formatted(what, ex.getMessage()), ex);
        }
        if (node == null) {
            throw new TransientFetchException("GitHub " + what + " returned an empty body", 0);
        }
        return node;
    }

    RemoteRun toRemoteRun(JsonNode node) {
        String rawConclusion = textOrNull(node, "conclusion");
        return new RemoteRun(
                node.path("id").asLong(),
                textOrNull(node, "name"),
                textOrNull(node, "display_title"),
                textOrNull(node, "event"),
                RunStatus.fromRemote(textOrNull(node, "status")),
                RunConclusion.fromRemote(rawConclusion),
                rawConclusion,
                parseInstant(textOrNull(node, "created_at")),
                textOrNull(node, "html_url"),
                readInputs(node.path("inputs")),
                null,
                null
        );
    }

    private Map<String, String> readInputs(JsonNode inputs) {
        if (inputs == null || !inputs.isObject()) {
            return Map.of();
        }
        Map<String, String> values = new LinkedHashMap<>();
        inputs.fields().forEachRemaining(entry -> {
            if (!entry.getValue().isNull()) {
                values.put(entry.getKey(), entry.getValue().asText());
            }
        });
        return values;
    }

    private Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            LOGGER.warn("Unparseable run timestamp value={}", value);
            return null;
        }
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        var value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= LOG_SNIPPET_MAX) {
            return value;
        }
        return value.substring(0, LOG_SNIPPET_MAX) + "...";
    }
}

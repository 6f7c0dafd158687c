package com.example.clipper.service;

import com.example.clipper.DispatchException;
import com.example.clipper.config.CorrelationProperties;
import com.example.clipper.config.GithubProperties;
import com.example.clipper.config.PollingProperties;
import com.example.clipper.dto.JobInput;
import com.example.clipper.dto.Outcome;
import com.example.clipper.dto.RemoteRun;
import com.example.clipper.service.Interfaces.ArtifactDelivery;
import com.example.clipper.service.dispatch.JobDispatcher;
import com.example.clipper.service.polling.PollCancellation;
import com.example.clipper.service.polling.PollResult;
import com.example.clipper.service.polling.StatusPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one render attempt end to end: dispatch the workflow, optionally watch it, then deliver the clip
 * or report the failure.
 */
@Service
public class ClipperOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipperOrchestrator.class);

    private final CorrelationTokenGenerator tokens;
    private final JobDispatcher dispatcher;
    private final StatusPoller poller;
    private final ArtifactDelivery delivery;
    private final GithubProperties github;
    private final PollingProperties polling;
    private final CorrelationProperties correlation;
    private final Clock clock;
    private final Map<String, PollCancellation> activeWatches = new ConcurrentHashMap<>();

    public ClipperOrchestrator(CorrelationTokenGenerator tokens,
                               JobDispatcher dispatcher,
                               StatusPoller poller,
                               ArtifactDelivery delivery,
                               GithubProperties github,
                               PollingProperties polling,
                               CorrelationProperties correlation,
                               Clock clock) {
        this.tokens = tokens;
        this.dispatcher = dispatcher;
        this.poller = poller;
        this.delivery = delivery;
        this.github = github;
        this.polling = polling;
        this.correlation = correlation;
        this.clock = clock;
    }

    public Outcome run(JobInput input, boolean watch) {
        return run(input, watch, new PollCancellation());
    }

    /**
     * Dispatches the render workflow for {@code input}.
     *
     * @param watch when false the call returns right after the dispatch with a {@code DISPATCHED} outcome.
     * @param cancellation stops the watch early; the outcome is then {@code CANCELLED}.
     * @return the outcome of the attempt. Dispatch rejections come back as {@code DISPATCH_ERROR}.
     */
    public Outcome run(JobInput input, boolean watch, PollCancellation cancellation) {
        String token = tokens.next();
        LOGGER.info("Clipper START token={} url={} watch={}", token, input.url(), watch);

        try {
            Instant dispatchTime = clock.instant();
            dispatcher.trigger(github.getWorkflowId(), github.getRef(), workflowInputs(input), token);

            if (!watch) {
                LOGGER.info("Clipper DISPATCHED token={} followUp={}", token, github.actionsUrl());
                return Outcome.dispatched(token, github.actionsUrl());
            }

            activeWatches.put(token, cancellation);
            PollResult result;
            try {
                result = poller.poll(token, dispatchTime, polling.interval(), polling.timeout(),
                        run -> LOGGER.info("Clipper PROGRESS token={} runId={} status={}", token, run.id(), run.status()),
                        cancellation);
            } finally {
                activeWatches.remove(token);
            }
            return toOutcome(token, result);
        } catch (DispatchException ex) {
            String reason = "Workflow dispatch rejected (HTTP %d): %s".formatted(ex.getHttpStatus(), ex.getBody());
            LOGGER.error("Clipper DISPATCH_ERROR token={} reason={}", token, reason);
            notifyFailure(token, reason);
            return Outcome.dispatchError(token, reason);
        } catch (RuntimeException ex) {
            LOGGER.error("Clipper ERROR token={} error={}", token, ex.toString(), ex);
            notifyFailure(token, ex.getMessage());
            throw ex;
        }
    }

    /**
     * Stops the watch for {@code token} if one is running.
     *
     * @return true when a running watch was signalled.
     */
    public boolean cancel(String token) {
        PollCancellation cancellation = activeWatches.get(token);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel();
        LOGGER.info("Clipper CANCEL requested token={}", token);
        return true;
    }

    private Outcome toOutcome(String token, PollResult result) {
        RemoteRun run = result.run();
        String runUrl = run == null ? null : run.htmlUrl();
        return switch (result.state()) {
            case COMPLETED -> completed(token, run);
            case CANCELLED -> {
                LOGGER.info("Clipper CANCELLED token={} attempts={}", token, result.attempts());
                yield Outcome.cancelled(token, github.actionsUrl(), runUrl);
            }
            case TIMED_OUT -> {
                LOGGER.info("Clipper TIMED_OUT token={} attempts={} lastStatus={} followUp={}", token, result.attempts(),
                        run == null ? "none" : run.status(), github.actionsUrl());
                yield Outcome.timedOut(token, github.actionsUrl(), runUrl);
            }
        };
    }

    private Outcome completed(String token, RemoteRun run) {
        if (run.succeeded()) {
            String artifact = run.artifactRef() != null ? run.artifactRef() : run.htmlUrl();
            LOGGER.info("Clipper SUCCEEDED token={} runId={} artifact={}", token, run.id(), artifact);
            deliver(artifact, token);
            return Outcome.succeeded(token, artifact, run.htmlUrl());
        }
        String reason = failureReason(run);
        LOGGER.warn("Clipper FAILED token={} runId={} reason={}", token, run.id(), reason);
        notifyFailure(token, reason);
        return Outcome.failed(token, reason, run.htmlUrl());
    }

    private Map<String, String> workflowInputs(JobInput input) {
        Map<String, String> inputs = new LinkedHashMap<>(input.extraInputs());
        inputs.put(correlation.getUrlInputKey(), input.url());
        return inputs;
    }

    private String failureReason(RemoteRun run) {
        StringBuilder reason = new StringBuilder("Workflow run ")
                .append(run.id())
                .append(" concluded '")
                .append(run.rawConclusion() == null ? "failure" : run.rawConclusion())
                .append("'");
        if (run.failureDetail() != null) {
            reason.append(": ").append(run.failureDetail());
        }
        if (run.htmlUrl() != null) {
            reason.append(" (").append(run.htmlUrl()).append(")");
        }
        return reason.toString();
    }

    private void deliver(String artifact, String token) {
        try {
            delivery.sendArtifact(artifact, token);
        } catch (RuntimeException ex) {
            LOGGER.warn("Artifact delivery failed token={} error={}", token, ex.toString());
        }
    }

    private void notifyFailure(String token, String reason) {
        try {
            delivery.sendFailureNotice(token, reason);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failure notice failed token={} error={}", token, ex.toString());
        }
    }
}

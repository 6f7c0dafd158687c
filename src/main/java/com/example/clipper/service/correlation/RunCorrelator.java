package com.example.clipper.service.correlation;

import com.example.clipper.TransientFetchException;
import com.example.clipper.config.CorrelationProperties;
import com.example.clipper.dto.RemoteRun;
import com.example.clipper.service.Interfaces.RunStatusSource;
import com.example.clipper.service.github.GithubActionsClient;
import com.example.clipper.util.RunConclusion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the run created by a dispatch among the workflow's most recent dispatch runs.
 *
 * <p>The listing endpoint does not echo the correlation token, so each candidate's detail record is
 * checked for it. When no candidate carries the token, any run created after
 * {@code dispatchTime - tolerance} is accepted and the one created closest to the dispatch wins. That
 * fallback is best-effort: two dispatches inside the tolerance window can be mixed up.
 *
 * <p>Within one lookup, detail and enrichment calls stop once the caller's deadline has passed or a
 * detail call has failed; the remaining candidates are judged on their listed snapshot.
 */
@Component
public class RunCorrelator implements RunStatusSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunCorrelator.class);
    private static final String DISPATCH_EVENT = "workflow_dispatch";

    private final GithubActionsClient github;
    private final CorrelationProperties props;
    private final Clock clock;

    public RunCorrelator(GithubActionsClient github, CorrelationProperties props, Clock clock) {
        this.github = github;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public Optional<RemoteRun> find(String token, Instant dispatchTime) {
        return find(token, dispatchTime, Instant.MAX);
    }

    @Override
    public Optional<RemoteRun> find(String token, Instant dispatchTime, Instant deadline) {
        List<RemoteRun> listed = github.listRecentDispatchRuns(Math.max(1, props.getListPageSize()));
        List<RemoteRun> candidates = new ArrayList<>(listed.size());
        boolean fetchDetails = true;
        for (RemoteRun run : listed) {
            if (run.mentions(token, props.getTokenInputKey())) {
                candidates.add(run);
                continue;
            }
            if (fetchDetails && pastDeadline(deadline)) {
                LOGGER.debug("Skipping remaining run details token={} reason=deadline", token);
                fetchDetails = false;
            }
            if (!fetchDetails) {
                candidates.add(run);
                continue;
            }
            try {
                candidates.add(github.getRun(run.id()));
            } catch (TransientFetchException ex) {
                LOGGER.warn("Run detail unavailable runId={} reason={}", run.id(), ex.getMessage());
                candidates.add(run);
                fetchDetails = false;
            }
        }

        Optional<RemoteRun> match = select(candidates, token, dispatchTime);
        if (match.isEmpty()) {
            LOGGER.debug("Correlation miss token={} candidates={}", token, candidates.size());
            return Optional.empty();
        }
        RemoteRun run = match.get();
        LOGGER.debug("Correlated token={} runId={} status={} conclusion={}", token, run.id(), run.status(), run.conclusion());
        if (pastDeadline(deadline)) {
            return Optional.of(run);
        }
        return Optional.of(enrichCompleted(run));
    }

    /**
     * Picks the run belonging to {@code token} out of {@code candidates}. Token matches win; otherwise
     * runs created inside the tolerance window are considered. Ties go to the creation time closest to
     * {@code dispatchTime}.
     */
    public Optional<RemoteRun> select(List<RemoteRun> candidates, String token, Instant dispatchTime) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        Comparator<RemoteRun> closest = Comparator.comparing(run -> distance(run, dispatchTime));

        Optional<RemoteRun> byToken = candidates.stream()
                .filter(run -> run.mentions(token, props.getTokenInputKey()))
                .min(closest);
        if (byToken.isPresent()) {
            return byToken;
        }

        Instant threshold = dispatchTime.minus(props.tolerance());
        return candidates.stream()
                .filter(run -> run.event() == null || DISPATCH_EVENT.equals(run.event()))
                .filter(run -> run.createdAt() != null && run.createdAt().isAfter(threshold))
                .min(closest);
    }

    private RemoteRun enrichCompleted(RemoteRun run) {
        if (!run.isCompleted()) {
            return run;
        }
        if (run.conclusion() == RunConclusion.SUCCESS) {
            String ref = run.htmlUrl();
            try {
                ref = github.findArtifactUrl(run.id()).orElse(run.htmlUrl());
            } catch (TransientFetchException ex) {
                LOGGER.warn("Artifact lookup failed runId={} reason={}", run.id(), ex.getMessage());
            }
            return run.withArtifactRef(ref);
        }
        try {
            return github.describeFailedJob(run.id())
                    .map(run::withFailureDetail)
                    .orElse(run);
        } catch (TransientFetchException ex) {
            LOGGER.warn("Failed job lookup failed runId={} reason={}", run.id(), ex.getMessage());
            return run;
        }
    }

    private boolean pastDeadline(Instant deadline) {
        return !clock.instant().isBefore(deadline);
    }

    private static Duration distance(RemoteRun run, Instant dispatchTime) {
        if (run.createdAt() == null) {
            return Duration.ofDays(36_500);
        }
        return Duration.between(run.createdAt(), dispatchTime).abs();
    }
}

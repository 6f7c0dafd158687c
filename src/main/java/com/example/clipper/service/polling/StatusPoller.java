package com.example.clipper.service.polling;

import com.example.clipper.TransientFetchException;
import com.example.clipper.dto.RemoteRun;
import com.example.clipper.service.Interfaces.RunStatusSource;
import com.example.clipper.util.PollState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Watches a dispatched run until it completes, the time budget runs out or the caller cancels.
 *
 * <p>Status changes are reported exactly as the platform declares them; nothing is inferred locally.
 * Lookup failures are logged and retried on the next tick, they only cost budget.
 */
@Service
public class StatusPoller {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatusPoller.class);

    private final RunStatusSource source;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public StatusPoller(RunStatusSource source, Clock clock) {
        this(source, clock, Sleeper.interruptible());
    }

    public StatusPoller(RunStatusSource source, Clock clock, Sleeper sleeper) {
        this.source = source;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public PollResult poll(String token, Instant dispatchTime, Duration interval, Duration timeout) {
        return poll(token, dispatchTime, interval, timeout, PollListener.none(), new PollCancellation());
    }

    /**
     * Runs the poll loop on the calling thread. The first attempt happens immediately; later attempts
     * are {@code interval} apart and no sleep reaches past {@code timeout}.
     *
     * @return {@link PollState#COMPLETED} with the terminal snapshot, {@link PollState#TIMED_OUT} when the
     * budget ran out (the run may still be going), or {@link PollState#CANCELLED}.
     */
    public PollResult poll(String token,
                           Instant dispatchTime,
                           Duration interval,
                           Duration timeout,
                           PollListener listener,
                           PollCancellation cancellation) {
        Objects.requireNonNull(token, "token");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        Instant start = clock.instant();
        int attempts = 0;
        RemoteRun last = null;

        LOGGER.info("POLL START token={} interval={}ms timeout={}ms", token, interval.toMillis(), timeout.toMillis());
        while (true) {
            if (stopRequested(cancellation)) {
                return finish(PollState.CANCELLED, token, last, attempts, start);
            }
            if (elapsedSince(start).compareTo(timeout) >= 0) {
                return finish(PollState.TIMED_OUT, token, last, attempts, start);
            }

            attempts++;
            Optional<RemoteRun> observed = fetch(token, dispatchTime, start.plus(timeout), attempts);
            if (observed.isPresent()) {
                RemoteRun run = observed.get();
                if (last == null || last.status() != run.status()) {
                    LOGGER.info("POLL status token={} runId={} status={} attempt={}", token, run.id(), run.status(), attempts);
                }
                last = run;
                notify(listener, run);
                if (run.isCompleted()) {
                    return finish(PollState.COMPLETED, token, run, attempts, start);
                }
            }

            Duration remaining = timeout.minus(elapsedSince(start));
            if (remaining.isNegative() || remaining.isZero()) {
                return finish(PollState.TIMED_OUT, token, last, attempts, start);
            }
            sleeper.sleep(interval.compareTo(remaining) < 0 ? interval : remaining, cancellation);
            if (stopRequested(cancellation)) {
                return finish(PollState.CANCELLED, token, last, attempts, start);
            }
        }
    }

    private Optional<RemoteRun> fetch(String token, Instant dispatchTime, Instant deadline, int attempt) {
        try {
            Optional<RemoteRun> run = source.find(token, dispatchTime, deadline);
            return run == null ? Optional.empty() : run;
        } catch (TransientFetchException | WebClientException ex) {
            LOGGER.warn("POLL transient failure token={} attempt={} type={} message={}",
                    token, attempt, ex.getClass().getSimpleName(), ex.getMessage());
            return Optional.empty();
        }
    }

    private void notify(PollListener listener, RemoteRun run) {
        try {
            listener.onProgress(run);
        } catch (RuntimeException ex) {
            LOGGER.warn("Progress listener failed runId={} error={}", run.id(), ex.toString());
        }
    }

    private boolean stopRequested(PollCancellation cancellation) {
        if (Thread.currentThread().isInterrupted()) {
            cancellation.cancel();
        }
        return cancellation.isCancelled();
    }

    private Duration elapsedSince(Instant start) {
        return Duration.between(start, clock.instant());
    }

    private PollResult finish(PollState state, String token, RemoteRun last, int attempts, Instant start) {
        Duration elapsed = elapsedSince(start);
        LOGGER.info("POLL {} token={} attempts={} in={}ms lastStatus={}", state, token, attempts, elapsed.toMillis(),
                last == null ? "none" : last.status());
        return new PollResult(state, last, attempts, elapsed);
    }
}

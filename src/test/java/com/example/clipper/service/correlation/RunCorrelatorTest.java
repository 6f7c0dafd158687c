package com.example.clipper.service.correlation;

import com.example.clipper.TransientFetchException;
import com.example.clipper.config.CorrelationProperties;
import com.example.clipper.dto.RemoteRun;
import com.example.clipper.service.github.GithubActionsClient;
import com.example.clipper.support.MutableClock;
import com.example.clipper.util.RunConclusion;
import com.example.clipper.util.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunCorrelatorTest {

    private static final Instant DISPATCHED_AT = Instant.parse("2024-05-01T10:00:00Z");
    private static final String TOKEN = "clipper-1714557600000-ab12cd";

    @Mock
    GithubActionsClient github;

    private final MutableClock clock = new MutableClock(DISPATCHED_AT);
    private RunCorrelator correlator;

    @BeforeEach
    void setup() {
        CorrelationProperties props = new CorrelationProperties();
        props.setToleranceSeconds(10);
        correlator = new RunCorrelator(github, props, clock);
    }

    private static RemoteRun run(long id, Instant createdAt, RunStatus status, RunConclusion conclusion, Map<String, String> inputs) {
        return new RemoteRun(id, "Render", "Render", "workflow_dispatch", status, conclusion,
                conclusion == null ? null : conclusion.name().toLowerCase(Locale.ROOT), createdAt,
                "https://github.com/acme/shorts/actions/runs/" + id, inputs, null, null);
    }

    private static RemoteRun listed(long id, Instant createdAt, RunStatus status) {
        return run(id, createdAt, status, null, Map.of());
    }

    @Test
    void selectReturnsEmptyForNoCandidates() {
        assertThat(correlator.select(List.of(), TOKEN, DISPATCHED_AT)).isEmpty();
    }

    @Test
    void selectPrefersTheRunCarryingTheToken() {
        RemoteRun closer = listed(2, DISPATCHED_AT.plusSeconds(1), RunStatus.QUEUED);
        RemoteRun tagged = run(1, DISPATCHED_AT.plusSeconds(8), RunStatus.QUEUED, null, Map.of("worker_id", TOKEN));

        Optional<RemoteRun> match = correlator.select(List.of(closer, tagged), TOKEN, DISPATCHED_AT);

        assertEquals(1L, match.orElseThrow().id());
    }

    @Test
    void selectMatchesTokenInDisplayTitle() {
        RemoteRun titled = new RemoteRun(5, "Render", "Render " + TOKEN, "workflow_dispatch", RunStatus.IN_PROGRESS,
                null, null, DISPATCHED_AT.minusSeconds(3600), null, Map.of(), null, null);

        assertEquals(5L, correlator.select(List.of(titled), TOKEN, DISPATCHED_AT).orElseThrow().id());
    }

    @Test
    void selectFallsBackToRunClosestToDispatchInsideWindow() {
        RemoteRun early = listed(1, DISPATCHED_AT.minusSeconds(8), RunStatus.QUEUED);
        RemoteRun close = listed(2, DISPATCHED_AT.plusSeconds(2), RunStatus.QUEUED);
        RemoteRun late = listed(3, DISPATCHED_AT.plusSeconds(30), RunStatus.QUEUED);

        Optional<RemoteRun> match = correlator.select(List.of(late, early, close), TOKEN, DISPATCHED_AT);

        assertEquals(2L, match.orElseThrow().id());
    }

    @Test
    void selectIgnoresRunsCreatedBeforeTheWindow() {
        RemoteRun stale = listed(1, DISPATCHED_AT.minusSeconds(11), RunStatus.COMPLETED);

        assertThat(correlator.select(List.of(stale), TOKEN, DISPATCHED_AT)).isEmpty();
    }

    @Test
    void selectIgnoresOtherEventsInFallback() {
        RemoteRun pushRun = new RemoteRun(4, "Render", "Render", "push", RunStatus.QUEUED, null, null,
                DISPATCHED_AT.plusSeconds(1), null, Map.of(), null, null);

        assertThat(correlator.select(List.of(pushRun), TOKEN, DISPATCHED_AT)).isEmpty();
    }

    @Test
    void findChecksDetailForTokenAndReturnsInProgressRunAsIs() {
        RemoteRun other = listed(7, DISPATCHED_AT.plusSeconds(1), RunStatus.IN_PROGRESS);
        RemoteRun mine = listed(8, DISPATCHED_AT.plusSeconds(4), RunStatus.IN_PROGRESS);
        when(github.listRecentDispatchRuns(10)).thenReturn(List.of(other, mine));
        when(github.getRun(7L)).thenReturn(other);
        when(github.getRun(8L)).thenReturn(run(8, DISPATCHED_AT.plusSeconds(4), RunStatus.IN_PROGRESS, null, Map.of("worker_id", TOKEN)));

        RemoteRun found = correlator.find(TOKEN, DISPATCHED_AT).orElseThrow();

        assertEquals(8L, found.id());
        assertEquals(RunStatus.IN_PROGRESS, found.status());
        verify(github, never()).findArtifactUrl(anyLong());
    }

    @Test
    void findUsesListedSnapshotWhenDetailFails() {
        RemoteRun mine = listed(8, DISPATCHED_AT.plusSeconds(2), RunStatus.QUEUED);
        when(github.listRecentDispatchRuns(anyInt())).thenReturn(List.of(mine));
        when(github.getRun(8L)).thenThrow(new TransientFetchException("GitHub run detail failed 502", 502));

        assertEquals(8L, correlator.find(TOKEN, DISPATCHED_AT).orElseThrow().id());
    }

    @Test
    void findResolvesArtifactForSuccessfulRun() {
        RemoteRun done = run(9, DISPATCHED_AT.plusSeconds(2), RunStatus.COMPLETED, RunConclusion.SUCCESS, Map.of("worker_id", TOKEN));
        when(github.listRecentDispatchRuns(anyInt())).thenReturn(List.of(done));
        when(github.findArtifactUrl(9L)).thenReturn(Optional.of("https://api.github.test/clip.zip"));

        RemoteRun found = correlator.find(TOKEN, DISPATCHED_AT).orElseThrow();

        assertEquals("https://api.github.test/clip.zip", found.artifactRef());
        verify(github, never()).getRun(anyLong());
    }

    @Test
    void findFallsBackToRunPageWhenArtifactLookupFails() {
        RemoteRun done = run(9, DISPATCHED_AT.plusSeconds(2), RunStatus.COMPLETED, RunConclusion.SUCCESS, Map.of("worker_id", TOKEN));
        when(github.listRecentDispatchRuns(anyInt())).thenReturn(List.of(done));
        when(github.findArtifactUrl(9L)).thenThrow(new TransientFetchException("timeout", new RuntimeException("timeout")));

        assertEquals(done.htmlUrl(), correlator.find(TOKEN, DISPATCHED_AT).orElseThrow().artifactRef());
    }

    @Test
    void findAddsFailedJobToFailedRun() {
        RemoteRun failed = run(9, DISPATCHED_AT.plusSeconds(2), RunStatus.COMPLETED, RunConclusion.FAILURE, Map.of("worker_id", TOKEN));
        when(github.listRecentDispatchRuns(anyInt())).thenReturn(List.of(failed));
        when(github.describeFailedJob(9L)).thenReturn(Optional.of("job 'render' failure at step 'Run ffmpeg'"));

        RemoteRun found = correlator.find(TOKEN, DISPATCHED_AT).orElseThrow();

        assertEquals(RunConclusion.FAILURE, found.conclusion());
        assertEquals("job 'render' failure at step 'Run ffmpeg'", found.failureDetail());
    }

    @Test
    void findReturnsEmptyWhenNothingListed() {
        when(github.listRecentDispatchRuns(anyInt())).thenReturn(List.of());

        assertThat(correlator.find(TOKEN, DISPATCHED_AT)).isEmpty();
    }

    @Test
    void listingFailurePropagatesToCaller() {
        when(github.listRecentDispatchRuns(anyInt())).thenThrow(new TransientFetchException("GitHub list runs failed 503", 503));

        assertThrows(TransientFetchException.class, () -> correlator.find(TOKEN, DISPATCHED_AT));
    }

    @Test
    void firstFailedDetailEndsDetailLookupsForThisTick() {
        RemoteRun first = listed(1, DISPATCHED_AT.plusSeconds(1), RunStatus.QUEUED);
        RemoteRun second = listed(2, DISPATCHED_AT.plusSeconds(2), RunStatus.QUEUED);
        RemoteRun third = listed(3, DISPATCHED_AT.plusSeconds(3), RunStatus.QUEUED);
        when(github.listRecentDispatchRuns(anyInt())).thenReturn(List.of(first, second, third));
        when(github.getRun(1L)).thenThrow(new TransientFetchException("GitHub run detail failed 503", 503));

        Optional<RemoteRun> found = correlator.find(TOKEN, DISPATCHED_AT, DISPATCHED_AT.plusSeconds(60));

        assertEquals(1L, found.orElseThrow().id());
        verify(github, times(1)).getRun(anyLong());
    }

    @Test
    void noDetailOrEnrichmentCallsOnceDeadlineHasPassed() {
        RemoteRun done = run(9, DISPATCHED_AT.plusSeconds(2), RunStatus.COMPLETED, RunConclusion.SUCCESS, Map.of());
        when(github.listRecentDispatchRuns(anyInt())).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(30));
            return List.of(done);
        });

        RemoteRun found = correlator.find(TOKEN, DISPATCHED_AT, DISPATCHED_AT.plusSeconds(20)).orElseThrow();

        assertEquals(9L, found.id());
        assertThat(found.artifactRef()).isNull();
        verify(github, never()).getRun(anyLong());
        verify(github, never()).findArtifactUrl(anyLong());
    }

    @Test
    void detailLookupsStopWhenDeadlinePassesMidway() {
        RemoteRun first = listed(1, DISPATCHED_AT.plusSeconds(1), RunStatus.QUEUED);
        RemoteRun second = listed(2, DISPATCHED_AT.plusSeconds(2), RunStatus.QUEUED);
        when(github.listRecentDispatchRuns(anyInt())).thenReturn(List.of(first, second));
        when(github.getRun(1L)).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(30));
            return first;
        });

        correlator.find(TOKEN, DISPATCHED_AT, DISPATCHED_AT.plusSeconds(20));

        verify(github, never()).getRun(2L);
    }
}

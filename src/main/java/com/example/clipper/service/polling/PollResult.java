package com.example.clipper.service.polling;

import com.example.clipper.dto.RemoteRun;
import com.example.clipper.util.PollState;

import java.time.Duration;

/**
 * How a poll loop ended. {@code run} is the last snapshot seen, null when the run never showed up.
 */
public record PollResult(PollState state, RemoteRun run, int attempts, Duration elapsed) {
}

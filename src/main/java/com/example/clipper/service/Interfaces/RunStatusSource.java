package com.example.clipper.service.Interfaces;

import com.example.clipper.dto.RemoteRun;

import java.time.Instant;
import java.util.Optional;

/**
 * Looks up the remote run that belongs to a dispatch attempt.
 */
public interface RunStatusSource {

    /**
     * @return the current snapshot of the matching run, or empty while it has not shown up yet.
     * @throws com.example.clipper.TransientFetchException when the platform could not be queried this time.
     */
    Optional<RemoteRun> find(String token, Instant dispatchTime);

    /**
     * Same as {@link #find(String, Instant)} but stops issuing further requests once {@code deadline} has
     * passed, answering from whatever it already has.
     */
    default Optional<RemoteRun> find(String token, Instant dispatchTime, Instant deadline) {
        return find(token, dispatchTime);
    }
}

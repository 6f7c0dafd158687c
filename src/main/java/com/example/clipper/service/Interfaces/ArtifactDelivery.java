package com.example.clipper.service.Interfaces;

/**
 * Sends results to the user. Implementations handle their own errors; callers treat both calls as
 * fire-and-forget.
 */
public interface ArtifactDelivery {

    void sendArtifact(String reference, String correlationLabel);

    void sendFailureNotice(String correlationLabel, String reason);
}

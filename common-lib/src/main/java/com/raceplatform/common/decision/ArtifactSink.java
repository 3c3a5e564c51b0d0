package com.raceplatform.common.decision;

import com.raceplatform.common.model.DecisionArtifact;

/**
 * Receives every completed {@link DecisionArtifact} for persistence and post-race tracking.
 *
 * <p>Current implementation: {@code RestArtifactSink}, a fire-and-forget POST to the tracking
 * service. The decision core never writes files or calls the network itself.
 */
public interface ArtifactSink {

    /**
     * Publishes one artifact. Implementations must be non-blocking; no {@code .block()}.
     *
     * @param artifact a complete artifact; partial artifacts are never published
     */
    void publish(DecisionArtifact artifact);
}

package com.raceplatform.orchestrator.adapter;

import com.raceplatform.common.model.Phase;
import com.raceplatform.common.model.RaceSnapshot;
import com.raceplatform.common.source.SnapshotSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Reads normalized snapshots from the acquisition service. A 404 means no snapshot was
 * captured for that phase and completes empty; other failures propagate to the caller.
 */
@Component
public class WebClientSnapshotSource implements SnapshotSource {

    private static final Logger log = LoggerFactory.getLogger(WebClientSnapshotSource.class);

    private final WebClient snapshotClient;

    public WebClientSnapshotSource(WebClient snapshotClient) {
        this.snapshotClient = snapshotClient;
    }

    @Override
    public Mono<RaceSnapshot> fetch(String meetingId, String raceId, Phase phase) {
        return snapshotClient.get()
            .uri("/api/v1/snapshots/{meetingId}/{raceId}/{phase}", meetingId, raceId, phase.name())
            .retrieve()
            .bodyToMono(RaceSnapshot.class)
            .doOnNext(s -> log.debug("[SnapshotSource] fetched. race={} phase={} runners={} capturedAt={}",
                raceId, phase, s.runners().size(), s.capturedAt()))
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.info("[SnapshotSource] no snapshot. race={} phase={}", raceId, phase);
                return Mono.empty();
            });
    }
}

package com.raceplatform.common.source;

import com.raceplatform.common.model.Phase;
import com.raceplatform.common.model.RaceSnapshot;
import reactor.core.publisher.Mono;

/**
 * Normalized market snapshots, one per (race, phase). An empty {@link Mono} means no snapshot
 * was captured for that phase.
 */
public interface SnapshotSource {

    Mono<RaceSnapshot> fetch(String meetingId, String raceId, Phase phase);
}

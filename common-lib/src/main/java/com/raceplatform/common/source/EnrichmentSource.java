package com.raceplatform.common.source;

import com.raceplatform.common.model.Enrichment;
import reactor.core.publisher.Mono;

/**
 * Jockey/trainer statistics and chrono data required before H5.
 */
public interface EnrichmentSource {

    Mono<Enrichment> fetch(String meetingId, String raceId);
}

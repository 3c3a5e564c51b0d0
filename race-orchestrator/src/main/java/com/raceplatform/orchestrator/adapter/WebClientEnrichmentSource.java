package com.raceplatform.orchestrator.adapter;

import com.raceplatform.common.model.Enrichment;
import com.raceplatform.common.source.EnrichmentSource;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

@Component
public class WebClientEnrichmentSource implements EnrichmentSource {

    private final WebClient enrichmentClient;

    public WebClientEnrichmentSource(WebClient enrichmentClient) {
        this.enrichmentClient = enrichmentClient;
    }

    @Override
    public Mono<Enrichment> fetch(String meetingId, String raceId) {
        return enrichmentClient.get()
            .uri("/api/v1/enrichment/{meetingId}/{raceId}", meetingId, raceId)
            .retrieve()
            .bodyToMono(Enrichment.class)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }
}

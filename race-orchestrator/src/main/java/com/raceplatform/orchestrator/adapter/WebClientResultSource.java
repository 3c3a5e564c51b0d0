package com.raceplatform.orchestrator.adapter;

import com.raceplatform.common.model.OfficialResult;
import com.raceplatform.common.source.ResultSource;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Official arrivals. Empty (404) until the result is published.
 */
@Component
public class WebClientResultSource implements ResultSource {

    private final WebClient resultsClient;

    public WebClientResultSource(WebClient resultsClient) {
        this.resultsClient = resultsClient;
    }

    @Override
    public Mono<OfficialResult> fetch(String meetingId, String raceId) {
        return resultsClient.get()
            .uri("/api/v1/results/{meetingId}/{raceId}", meetingId, raceId)
            .retrieve()
            .bodyToMono(OfficialResult.class)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }
}

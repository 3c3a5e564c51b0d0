package com.raceplatform.orchestrator.publisher;

import com.raceplatform.common.decision.ArtifactSink;
import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.DecisionArtifact;
import com.raceplatform.common.trace.RaceTrace;
import com.raceplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Posts each artifact to the tracking service, fire-and-forget. A failed post is logged and
 * never affects the decision already emitted.
 */
@Component
public class RestArtifactSink implements ArtifactSink {

    private static final Logger log = LoggerFactory.getLogger(RestArtifactSink.class);

    private final WebClient trackingClient;

    public RestArtifactSink(WebClient trackingClient) {
        this.trackingClient = trackingClient;
    }

    @Override
    public void publish(DecisionArtifact artifact) {
        Decision decision = artifact.decision();
        RaceTrace trace = RaceTrace.of(decision);
        trackingClient.post()
            .uri("/api/v1/tracking/decisions")
            .header("X-Trace-Id", trace.traceId())
            .bodyValue(artifact)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> TraceContextUtil.withMdc(trace, () ->
                           log.info("[ArtifactSink] published. race={} phase={} key={} status={} traceId={}",
                                    decision.raceId(), decision.phase(), decision.decisionKey(),
                                    r.getStatusCode(), trace.traceId())),
                err -> TraceContextUtil.withMdc(trace, () ->
                           log.warn("[ArtifactSink] publish failed (non-critical). race={} phase={} traceId={}",
                                    decision.raceId(), decision.phase(), trace.traceId(), err))
            );
    }
}

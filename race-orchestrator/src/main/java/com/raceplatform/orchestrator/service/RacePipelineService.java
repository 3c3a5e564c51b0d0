package com.raceplatform.orchestrator.service;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.decision.ArtifactSink;
import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.DecisionArtifact;
import com.raceplatform.common.model.Phase;
import com.raceplatform.common.source.CalibrationSource;
import com.raceplatform.common.source.EnrichmentSource;
import com.raceplatform.common.source.ResultSource;
import com.raceplatform.common.source.SnapshotSource;
import com.raceplatform.common.trace.RaceTrace;
import com.raceplatform.common.trace.TraceContextUtil;
import com.raceplatform.orchestrator.guard.ConcurrentInvocationException;
import com.raceplatform.orchestrator.guard.InvocationGuard;
import com.raceplatform.orchestrator.ledger.DecisionLedger;
import com.raceplatform.orchestrator.logger.DecisionFlowLogger;
import com.raceplatform.orchestrator.pipeline.DecisionPipelineEngine;
import com.raceplatform.orchestrator.pipeline.PhaseInputs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Coordinates one phase invocation: guard, fetch, decide, record, publish.
 *
 * <p>Inputs are fetched in parallel. A fetch that fails or completes empty becomes a missing
 * input, and the engine abstains on it. The artifact is recorded and published only once the
 * engine has returned it, so a cancelled invocation persists nothing.
 */
@Service
public class RacePipelineService {

    private static final Logger log = LoggerFactory.getLogger(RacePipelineService.class);

    private final SnapshotSource snapshotSource;
    private final CalibrationSource calibrationSource;
    private final EnrichmentSource enrichmentSource;
    private final ResultSource resultSource;
    private final DecisionPipelineEngine engine;
    private final DecisionLedger ledger;
    private final ArtifactSink artifactSink;
    private final InvocationGuard invocationGuard;
    private final DecisionFlowLogger decisionFlowLogger;
    private final GpiConfig gpiConfig;
    private final Clock clock;

    public RacePipelineService(SnapshotSource snapshotSource,
                               CalibrationSource calibrationSource,
                               EnrichmentSource enrichmentSource,
                               ResultSource resultSource,
                               DecisionPipelineEngine engine,
                               DecisionLedger ledger,
                               ArtifactSink artifactSink,
                               InvocationGuard invocationGuard,
                               DecisionFlowLogger decisionFlowLogger,
                               GpiConfig gpiConfig,
                               Clock clock) {
        this.snapshotSource     = snapshotSource;
        this.calibrationSource  = calibrationSource;
        this.enrichmentSource   = enrichmentSource;
        this.resultSource       = resultSource;
        this.engine             = engine;
        this.ledger             = ledger;
        this.artifactSink       = artifactSink;
        this.invocationGuard    = invocationGuard;
        this.decisionFlowLogger = decisionFlowLogger;
        this.gpiConfig          = gpiConfig;
        this.clock              = clock;
    }

    /**
     * Runs {@code phase} for one race.
     *
     * @return the emitted decision; errors with {@link ConcurrentInvocationException} when the
     *         same (meeting, race, phase) is already running
     */
    public Mono<Decision> run(String meetingId, String raceId, Phase phase) {
        RaceTrace trace = new RaceTrace(meetingId, raceId, phase);
        Mono<Decision> invocation = Mono.defer(() -> {
            decisionFlowLogger.logStage(DecisionFlowLogger.TRIGGER_RECEIVED, trace);

            if (!invocationGuard.tryAcquire(meetingId, raceId, phase)) {
                log.warn("[RacePipeline] rejected concurrent invocation. meeting={} race={} phase={} traceId={}",
                    meetingId, raceId, phase, trace.traceId());
                return Mono.<Decision>error(new ConcurrentInvocationException(meetingId, raceId, phase));
            }

            Instant asOf = clock.instant();
            // Assembled lazily so that a source throwing on call still reaches doFinally.
            return Mono.defer(() -> fetchInputs(trace, asOf))
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.INPUTS_FETCHED))
                .map(inputs -> engine.run(phase, inputs, gpiConfig))
                .doOnNext(artifact -> decisionFlowLogger.logDecision(artifact.decision()))
                .map(artifact -> {
                    if (ledger.record(artifact)) {
                        artifactSink.publish(artifact);
                    }
                    decisionFlowLogger.logStage(DecisionFlowLogger.ARTIFACT_DISPATCHED, trace);
                    return artifact.decision();
                })
                .doOnError(e -> log.error("[RacePipeline] invocation failed. meeting={} race={} phase={} traceId={}",
                    meetingId, raceId, phase, trace.traceId(), e))
                .doFinally(signal -> invocationGuard.release(meetingId, raceId, phase));
        });
        return TraceContextUtil.withRaceTrace(invocation, trace);
    }

    private Mono<PhaseInputs> fetchInputs(RaceTrace trace, Instant asOf) {
        String meetingId = trace.meetingId();
        String raceId = trace.raceId();
        return switch (trace.phase()) {
            case H30 -> Mono.zip(
                    optional(() -> snapshotSource.fetch(meetingId, raceId, Phase.H30), "snapshot", trace),
                    optional(() -> calibrationSource.fetch(meetingId, raceId), "calibration", trace))
                .map(t -> PhaseInputs.h30(meetingId, raceId, asOf,
                    t.getT1().orElse(null), t.getT2().orElse(null)));
            case H5 -> Mono.zip(
                    optional(() -> snapshotSource.fetch(meetingId, raceId, Phase.H5), "snapshot", trace),
                    optional(() -> snapshotSource.fetch(meetingId, raceId, Phase.H30), "h30 snapshot", trace),
                    optional(() -> calibrationSource.fetch(meetingId, raceId), "calibration", trace),
                    optional(() -> enrichmentSource.fetch(meetingId, raceId), "enrichment", trace))
                .map(t -> PhaseInputs.h5(meetingId, raceId, asOf,
                    t.getT1().orElse(null), t.getT2().orElse(null),
                    t.getT3().orElse(null), t.getT4().orElse(null),
                    ledger.decision(meetingId, raceId, Phase.H30).orElse(null)));
            case RESULT -> optional(() -> resultSource.fetch(meetingId, raceId), "result", trace)
                .map(result -> PhaseInputs.result(meetingId, raceId, asOf,
                    ledger.decision(meetingId, raceId, Phase.H5).orElse(null), result.orElse(null)));
        };
    }

    /**
     * Empty or failed fetch → {@link Optional#empty()}; the engine abstains fail-closed. A source
     * that throws or returns {@code null} instead of a Mono counts as a failed fetch.
     */
    private static <T> Mono<Optional<T>> optional(Supplier<Mono<T>> fetch, String what, RaceTrace trace) {
        return Mono.defer(fetch)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(trace, () ->
                    log.warn("[RacePipeline] {} fetch failed, treating as missing. race={} traceId={} reason={}",
                        what, trace.raceId(), trace.traceId(), e.toString()));
                return Mono.just(Optional.empty());
            });
    }

    /** Latest recorded artifact for the meeting, race and phase, if any. */
    public Optional<DecisionArtifact> latest(String meetingId, String raceId, Phase phase) {
        return ledger.artifact(meetingId, raceId, phase);
    }
}

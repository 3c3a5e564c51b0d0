package com.raceplatform.orchestrator.pipeline;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.drift.DriftAnalyzer;
import com.raceplatform.common.estimate.Estimator;
import com.raceplatform.common.estimate.PayoutModel;
import com.raceplatform.common.exception.DataUnavailableException;
import com.raceplatform.common.guard.GuardrailEvaluator;
import com.raceplatform.common.guard.OverroundPolicy;
import com.raceplatform.common.model.BetKind;
import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.DecisionArtifact;
import com.raceplatform.common.model.DroppedLeg;
import com.raceplatform.common.model.Estimate;
import com.raceplatform.common.model.ExoticType;
import com.raceplatform.common.model.GuardrailStage;
import com.raceplatform.common.model.GuardrailVerdict;
import com.raceplatform.common.model.Phase;
import com.raceplatform.common.model.RaceSnapshot;
import com.raceplatform.common.model.ReasonCode;
import com.raceplatform.common.model.Reconciliation;
import com.raceplatform.common.model.RejectionReason;
import com.raceplatform.common.model.Runner;
import com.raceplatform.common.model.RunnerDrift;
import com.raceplatform.common.model.Ticket;
import com.raceplatform.common.staking.AllocationResult;
import com.raceplatform.common.staking.StakingAllocator;
import com.raceplatform.common.tracking.ResultReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Phase state machine of the GPI v5.1 decision pipeline.
 *
 * <p>Synchronous and side-effect free: inputs are fetched by {@code RacePipelineService}
 * beforehand, and the returned {@link DecisionArtifact} is the only output. The decision's
 * timestamps come from the inputs, so the same inputs always give the same decision key.
 *
 * <h3>H30</h3>
 * <ol>
 *   <li>snapshot missing → abstain {@code DATA_UNAVAILABLE}</li>
 *   <li>market stage (freshness, overround) → annotation; never tickets</li>
 * </ol>
 *
 * <h3>H5</h3>
 * <ol>
 *   <li>snapshot missing → abstain {@code DATA_UNAVAILABLE}</li>
 *   <li>enrichment missing or incomplete → abstain {@code ENRICHMENT_MISSING}, no estimate computed</li>
 *   <li>H30 rejected the market and the H5 snapshot is not newer → abstain {@code NO_FRESH_DATA_SINCE_H30}</li>
 *   <li>payout model missing → abstain {@code DATA_UNAVAILABLE}</li>
 *   <li>market stage; failure → abstain</li>
 *   <li>estimate SP per active runner and COMBO per basket of each allowed exotic type drawn from
 *       the top pool</li>
 *   <li>SP and COMBO stages, best candidate first; the first passing candidate of each kind is
 *       kept. Exotics are skipped entirely when the place overround fails.</li>
 *   <li>GLOBAL stage; a failure drops the COMBO leg</li>
 *   <li>staking allocation; no ticket left → abstain</li>
 * </ol>
 *
 * <h3>RESULT</h3>
 * <p>Reconciles the recorded H5 tickets against the official result. Always an abstention.
 */
@Component
public class DecisionPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipelineEngine.class);

    private static final Set<ReasonCode> MARKET_REJECTIONS = EnumSet.of(
        ReasonCode.STALE_INPUT, ReasonCode.INVALID_MARKET, ReasonCode.OVERROUND_ABOVE_CEILING);

    /** Best first: highest evRatio, then highest expected payout, then runner ids. */
    static final Comparator<Estimate> BEST_CANDIDATE = Comparator
        .comparingDouble(Estimate::evRatio).reversed()
        .thenComparing(Comparator.comparingDouble(Estimate::expectedPayout).reversed())
        .thenComparing(e -> String.join(",", e.involvedRunners()));

    private final Estimator estimator;

    public DecisionPipelineEngine(Estimator estimator) {
        this.estimator = estimator;
    }

    /**
     * Runs one phase.
     *
     * @throws com.raceplatform.common.exception.ConfigInvalidException      when {@code config} is malformed
     * @throws com.raceplatform.common.exception.AllocationFailureException  when staking arithmetic cannot proceed
     */
    public DecisionArtifact run(Phase phase, PhaseInputs inputs, GpiConfig config) {
        config.validate();
        DecisionArtifact artifact = switch (phase) {
            case H30    -> runH30(inputs, config);
            case H5     -> runH5(inputs, config);
            case RESULT -> runResult(inputs);
        };
        Decision d = artifact.decision();
        log.info("[DecisionPipeline] phase={} meeting={} race={} abstain={} tickets={} totalStake={} codes={} key={}",
            phase, inputs.meetingId(), inputs.raceId(), d.abstain(), d.tickets().size(),
            d.totalStake().toPlainString(), d.reasonCodes(), d.decisionKey());
        return artifact;
    }

    // ── H30 ────────────────────────────────────────────────────────────────────

    private DecisionArtifact runH30(PhaseInputs in, GpiConfig config) {
        RaceSnapshot snapshot = in.snapshot();
        if (snapshot == null) {
            return DecisionArtifact.bare(unavailable(Phase.H30, in, "H30 snapshot unavailable"));
        }
        GuardrailVerdict market = GuardrailEvaluator.evaluateMarket(snapshot, calibratedAt(in.payoutModel()),
                                                                     config, in.asOf());
        double ceiling = OverroundPolicy.ceilingFor(snapshot, config);
        Double overround = boxed(snapshot.overround());

        String message;
        List<ReasonCode> codes;
        if (market.passed()) {
            message = String.format(Locale.ROOT,
                "H30 market check passed: overround %.4f within ceiling %.2f; tickets deferred to H5",
                overround, ceiling);
            codes = List.of(ReasonCode.PHASE_NEVER_BETS);
        } else {
            message = "H30 market rejected: " + String.join("; ", market.notes());
            codes = market.codes();
        }
        Decision decision = Decision.abstain(Phase.H30, in.meetingId(), in.raceId(), message, codes,
                                             overround, snapshot.capturedAt(), snapshot.capturedAt(), null);
        return new DecisionArtifact(decision, List.of(), List.of(market), ceiling, List.of(), List.of());
    }

    // ── H5 ─────────────────────────────────────────────────────────────────────

    private DecisionArtifact runH5(PhaseInputs in, GpiConfig config) {
        RaceSnapshot snapshot = in.snapshot();
        if (snapshot == null) {
            return DecisionArtifact.bare(unavailable(Phase.H5, in, "H5 snapshot unavailable"));
        }
        Double overround = boxed(snapshot.overround());

        if (in.enrichment() == null || !in.enrichment().isComplete()) {
            return DecisionArtifact.bare(Decision.abstain(Phase.H5, in.meetingId(), in.raceId(),
                "enrichment missing", List.of(ReasonCode.ENRICHMENT_MISSING),
                overround, snapshot.capturedAt(), snapshot.capturedAt(), null));
        }

        if (regressesFromH30(in, snapshot)) {
            return DecisionArtifact.bare(Decision.abstain(Phase.H5, in.meetingId(), in.raceId(),
                "H30 rejected the market and no fresher snapshot is available: "
                    + in.priorH30().message(),
                List.of(ReasonCode.NO_FRESH_DATA_SINCE_H30),
                overround, snapshot.capturedAt(), snapshot.capturedAt(), null));
        }

        PayoutModel model = in.payoutModel();
        if (model == null) {
            return DecisionArtifact.bare(Decision.abstain(Phase.H5, in.meetingId(), in.raceId(),
                "calibration unavailable", List.of(ReasonCode.DATA_UNAVAILABLE),
                overround, snapshot.capturedAt(), snapshot.capturedAt(), null));
        }

        List<RunnerDrift> drift = DriftAnalyzer.analyze(in.h30Snapshot(), snapshot, config.driftThreshold());
        double ceiling = OverroundPolicy.ceilingFor(snapshot, config);

        GuardrailVerdict market = GuardrailEvaluator.evaluateMarket(snapshot, model.calibratedAt(), config, in.asOf());
        if (!market.passed()) {
            Decision decision = Decision.abstain(Phase.H5, in.meetingId(), in.raceId(),
                "H5 market rejected: " + String.join("; ", market.notes()), market.codes(),
                overround, snapshot.capturedAt(), snapshot.capturedAt(), null);
            return new DecisionArtifact(decision, List.of(), List.of(market), ceiling, List.of(), drift);
        }

        List<GuardrailVerdict> verdicts = new ArrayList<>();
        verdicts.add(market);
        List<Estimate> estimates = new ArrayList<>();
        List<Estimate> proposed = new ArrayList<>();
        List<DroppedLeg> dropped = new ArrayList<>();

        Selection sp = select(spCandidates(snapshot, model, config), c -> GuardrailEvaluator.evaluateSp(c, config));
        if (sp != null) {
            sp.record(estimates, verdicts, proposed, dropped);
        }
        List<Estimate> baskets = comboCandidates(snapshot, model, config);
        if (!baskets.isEmpty()) {
            GuardrailVerdict placeMarket = GuardrailEvaluator.evaluateExoticMarket(snapshot, config);
            if (placeMarket.passed()) {
                select(baskets, c -> GuardrailEvaluator.evaluateCombo(c, config))
                    .record(estimates, verdicts, proposed, dropped);
            } else {
                verdicts.add(placeMarket);
                dropped.add(new DroppedLeg(BetKind.COMBO, List.of(), placeMarket.reasons().get(0)));
            }
        }

        GuardrailVerdict global = GuardrailEvaluator.evaluateGlobal(proposed, config);
        verdicts.add(global);
        if (!global.passed()) {
            proposed.removeIf(e -> {
                if (e.kind() != BetKind.COMBO) return false;
                dropped.add(new DroppedLeg(e.kind(), e.involvedRunners(), global.reasons().get(0)));
                return true;
            });
        }

        AllocationResult allocation = proposed.isEmpty()
            ? new AllocationResult(List.of(), List.of())
            : StakingAllocator.allocate(proposed, config);
        dropped.addAll(allocation.droppedLegs());

        Decision decision;
        if (allocation.isEmpty()) {
            List<ReasonCode> codes = abstentionCodes(verdicts, dropped);
            String detail = dropped.isEmpty()
                ? "no qualifying candidate"
                : dropped.stream().map(d -> d.reason().note()).collect(Collectors.joining("; "));
            decision = Decision.abstain(Phase.H5, in.meetingId(), in.raceId(), "H5 abstain: " + detail, codes,
                                        overround, snapshot.capturedAt(), snapshot.capturedAt(), null);
        } else {
            List<Ticket> tickets = allocation.tickets();
            List<ReasonCode> codes = dropped.stream().map(d -> d.reason().code()).distinct().toList();
            decision = Decision.bet(Phase.H5, in.meetingId(), in.raceId(), tickets, betMessage(tickets), codes,
                                    stakeWeightedEv(tickets), overround, snapshot.capturedAt(),
                                    snapshot.capturedAt());
        }
        return new DecisionArtifact(decision, estimates, verdicts, ceiling, dropped, drift);
    }

    private static boolean regressesFromH30(PhaseInputs in, RaceSnapshot h5Snapshot) {
        Decision h30 = in.priorH30();
        if (!sameRace(h30, in) || h30.reasonCodes().stream().noneMatch(MARKET_REJECTIONS::contains)) {
            return false;
        }
        Instant h30CapturedAt = h30.snapshotCapturedAt();
        return h30CapturedAt != null
            && (h5Snapshot.capturedAt() == null || !h5Snapshot.capturedAt().isAfter(h30CapturedAt));
    }

    private List<Estimate> spCandidates(RaceSnapshot snapshot, PayoutModel model, GpiConfig config) {
        List<Estimate> candidates = new ArrayList<>();
        for (Runner runner : snapshot.activeRunners()) {
            candidates.add(estimator.estimate(snapshot, List.of(runner.id()), model, config));
        }
        return candidates;
    }

    /** Every basket of every allowed exotic type that the top pool can fill. */
    private List<Estimate> comboCandidates(RaceSnapshot snapshot, PayoutModel model, GpiConfig config) {
        List<String> pool = comboPool(snapshot, model, config.comboPoolSize());
        List<Estimate> candidates = new ArrayList<>();
        for (ExoticType type : config.allowedExotics()) {
            if (pool.size() < type.legs()) {
                continue;
            }
            List<List<String>> baskets = new ArrayList<>();
            subsets(pool, type.legs(), 0, new ArrayDeque<>(), baskets);
            for (List<String> basket : baskets) {
                candidates.add(estimator.estimate(snapshot, basket, model, config));
            }
        }
        return candidates;
    }

    /**
     * Gates candidates best first and keeps the first that passes. When the top-ranked candidate
     * failed but a lower one passed, the top one is reported as dropped. With no passing
     * candidate the top one is returned with its failing verdict.
     */
    static Selection select(List<Estimate> candidates, Function<Estimate, GuardrailVerdict> gate) {
        if (candidates.isEmpty()) {
            return null;
        }
        List<Estimate> ranked = candidates.stream().sorted(BEST_CANDIDATE).toList();
        Estimate top = ranked.get(0);
        GuardrailVerdict topVerdict = gate.apply(top);
        if (topVerdict.passed()) {
            return new Selection(top, topVerdict, null);
        }
        for (Estimate next : ranked.subList(1, ranked.size())) {
            GuardrailVerdict verdict = gate.apply(next);
            if (verdict.passed()) {
                return new Selection(next, verdict,
                    new DroppedLeg(top.kind(), top.involvedRunners(), topVerdict.reasons().get(0)));
            }
        }
        return new Selection(top, topVerdict, null);
    }

    record Selection(Estimate chosen, GuardrailVerdict verdict, DroppedLeg passedOver) {

        void record(List<Estimate> estimates, List<GuardrailVerdict> verdicts, List<Estimate> proposed,
                    List<DroppedLeg> dropped) {
            estimates.add(chosen);
            if (passedOver != null) {
                dropped.add(passedOver);
            }
            legVerdict(verdict, chosen, verdicts, proposed, dropped);
        }
    }

    /** Active runners with a calibrated probability, highest first, ties by id. */
    static List<String> comboPool(RaceSnapshot snapshot, PayoutModel model, int poolSize) {
        record Ranked(String id, double p) {}
        List<Ranked> ranked = new ArrayList<>();
        for (Runner runner : snapshot.activeRunners()) {
            OptionalDouble p = model.winProbability(runner.id());
            if (p.isPresent()) {
                ranked.add(new Ranked(runner.id(), p.getAsDouble()));
            }
        }
        ranked.sort(Comparator.comparingDouble(Ranked::p).reversed().thenComparing(Ranked::id));
        return ranked.stream().limit(poolSize).map(Ranked::id).toList();
    }

    private static void subsets(List<String> pool, int k, int start, Deque<String> current, List<List<String>> out) {
        if (current.size() == k) {
            out.add(List.copyOf(current));
            return;
        }
        for (int i = start; i < pool.size(); i++) {
            current.addLast(pool.get(i));
            subsets(pool, k, i + 1, current, out);
            current.removeLast();
        }
    }

    private static void legVerdict(GuardrailVerdict verdict, Estimate leg, List<GuardrailVerdict> verdicts,
                                   List<Estimate> proposed, List<DroppedLeg> dropped) {
        verdicts.add(verdict);
        if (verdict.passed()) {
            proposed.add(leg);
        } else {
            dropped.add(new DroppedLeg(leg.kind(), leg.involvedRunners(), verdict.reasons().get(0)));
        }
    }

    private static List<ReasonCode> abstentionCodes(List<GuardrailVerdict> verdicts, List<DroppedLeg> dropped) {
        Set<ReasonCode> codes = new LinkedHashSet<>();
        for (GuardrailVerdict v : verdicts) {
            codes.addAll(v.codes());
        }
        for (DroppedLeg d : dropped) {
            codes.add(d.reason().code());
        }
        if (codes.isEmpty()) {
            codes.add(ReasonCode.NO_QUALIFYING_CANDIDATE);
        }
        return List.copyOf(codes);
    }

    private static String betMessage(List<Ticket> tickets) {
        return "H5 bet: " + tickets.stream()
            .map(t -> String.format(Locale.ROOT, "%s %s stake %s ev %.4f roi %.4f", t.kind(),
                String.join("-", t.runners()), t.stake().toPlainString(),
                t.estimate().evRatio(), t.estimate().roiRatio()))
            .collect(Collectors.joining("; "));
    }

    /** Σ stake·ev / Σ stake over the committed tickets. */
    static Double stakeWeightedEv(List<Ticket> tickets) {
        double weighted = 0.0;
        double total = 0.0;
        for (Ticket t : tickets) {
            double stake = t.stake().doubleValue();
            weighted += stake * t.estimate().evRatio();
            total += stake;
        }
        return total > 0.0 ? weighted / total : null;
    }

    // ── RESULT ─────────────────────────────────────────────────────────────────

    private DecisionArtifact runResult(PhaseInputs in) {
        Decision h5 = in.priorH5();
        if (!sameRace(h5, in)) {
            if (h5 != null) {
                log.warn("[DecisionPipeline] ignoring H5 decision of another race. expected={}/{} got={}/{}",
                    in.meetingId(), in.raceId(), h5.meetingId(), h5.raceId());
            }
            return DecisionArtifact.bare(resultUnavailable(in,
                "no H5 decision recorded for meeting " + in.meetingId() + " race " + in.raceId(), null));
        }
        if (in.officialResult() == null) {
            return DecisionArtifact.bare(resultUnavailable(in, "official result not published", null));
        }
        Instant publishedAt = in.officialResult().publishedAt();
        Reconciliation reconciliation;
        try {
            reconciliation = ResultReconciler.reconcile(h5, in.officialResult());
        } catch (DataUnavailableException e) {
            log.warn("[DecisionPipeline] reconciliation failed. race={} reason={}", in.raceId(), e.getMessage());
            return DecisionArtifact.bare(resultUnavailable(in, e.getMessage(), publishedAt));
        }
        String message = String.format(Locale.ROOT, "RESULT reconciled %d ticket(s): stake %s return %s roi %s",
            reconciliation.outcomes().size(),
            reconciliation.totalStake().toPlainString(),
            reconciliation.totalReturn().toPlainString(),
            reconciliation.realizedRoi() == null ? "n/a" : String.format(Locale.ROOT, "%.4f", reconciliation.realizedRoi()));
        return DecisionArtifact.bare(Decision.abstain(Phase.RESULT, in.meetingId(), in.raceId(), message,
            List.of(ReasonCode.PHASE_NEVER_BETS), null, publishedAt, publishedAt, reconciliation));
    }

    private static Decision resultUnavailable(PhaseInputs in, String message, Instant publishedAt) {
        return Decision.abstain(Phase.RESULT, in.meetingId(), in.raceId(), message,
            List.of(ReasonCode.RESULTS_UNAVAILABLE), null, publishedAt, publishedAt, null);
    }

    // ── helpers ────────────────────────────────────────────────────────────────

    private static Decision unavailable(Phase phase, PhaseInputs in, String message) {
        log.warn("[DecisionPipeline] {} race={}", message, in.raceId());
        return Decision.abstain(phase, in.meetingId(), in.raceId(), message,
            List.of(ReasonCode.DATA_UNAVAILABLE), null, null, null, null);
    }

    /** A prior decision only counts for the meeting and race it was made for. */
    private static boolean sameRace(Decision prior, PhaseInputs in) {
        return prior != null
            && Objects.equals(prior.meetingId(), in.meetingId())
            && Objects.equals(prior.raceId(), in.raceId());
    }

    private static Instant calibratedAt(PayoutModel model) {
        return model == null ? null : model.calibratedAt();
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}

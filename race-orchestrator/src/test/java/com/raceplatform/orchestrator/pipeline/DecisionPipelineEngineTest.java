package com.raceplatform.orchestrator.pipeline;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.estimate.Estimator;
import com.raceplatform.common.estimate.EvRoiEstimator;
import com.raceplatform.common.exception.ConfigInvalidException;
import com.raceplatform.common.model.BetKind;
import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.DecisionArtifact;
import com.raceplatform.common.model.DriftStatus;
import com.raceplatform.common.model.Estimate;
import com.raceplatform.common.model.ExoticType;
import com.raceplatform.common.model.GuardrailStage;
import com.raceplatform.common.model.OfficialResult;
import com.raceplatform.common.model.Phase;
import com.raceplatform.common.model.RaceSnapshot;
import com.raceplatform.common.model.ReasonCode;
import com.raceplatform.common.model.RunnerDrift;
import com.raceplatform.common.model.Ticket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.raceplatform.orchestrator.support.TestRaces.T0;
import static com.raceplatform.orchestrator.support.TestRaces.config;
import static com.raceplatform.orchestrator.support.TestRaces.enrichment;
import static com.raceplatform.orchestrator.support.TestRaces.fairField;
import static com.raceplatform.orchestrator.support.TestRaces.forMeeting;
import static com.raceplatform.orchestrator.support.TestRaces.overroundField;
import static com.raceplatform.orchestrator.support.TestRaces.payoutModel;
import static com.raceplatform.orchestrator.support.TestRaces.snapshot;
import static com.raceplatform.orchestrator.support.TestRaces.withPlaceOdds;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class DecisionPipelineEngineTest {

    private static final Instant AS_OF = T0.plusSeconds(60);

    private final DecisionPipelineEngine engine = new DecisionPipelineEngine(new EvRoiEstimator());

    private static PhaseInputs h5Inputs(RaceSnapshot snapshot) {
        return PhaseInputs.h5("M1", "R1", AS_OF, snapshot, fairField(Phase.H30, T0.minusSeconds(1500)),
                              payoutModel(T0), enrichment(), null);
    }

    /**
     * SP r1 priced at ev 0.50 / roi 0.38 with probability 0.30. Every two-runner basket
     * carries the given combo figures.
     */
    private static Estimator stubEstimator(double comboEv, double comboRoi, double comboPayout) {
        return (snapshot, subset, model, config) -> {
            if (subset.size() == 1) {
                return "r1".equals(subset.get(0))
                    ? Estimate.of(BetKind.SP, 0.50, 0.38, 5.0, subset, 0.30, 5.0)
                    : Estimate.of(BetKind.SP, -0.40, -0.45, 4.0, subset, 0.15, 4.0);
            }
            double p = (1.0 + comboEv) / comboPayout;
            return Estimate.of(BetKind.COMBO, comboEv, comboRoi, comboPayout, subset, p, comboPayout);
        };
    }

    private static Ticket ticket(Decision decision, BetKind kind) {
        return decision.tickets().stream().filter(t -> t.kind() == kind).findFirst().orElseThrow();
    }

    // ── H5 ──────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("H5 betting")
    class H5Betting {

        @Test
        @DisplayName("value SP on a fair field → single SP ticket floored to the increment")
        void valueSpBets() {
            DecisionArtifact artifact = engine.run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config());
            Decision d = artifact.decision();

            assertFalse(d.abstain());
            assertEquals(1, d.tickets().size());
            Ticket sp = ticket(d, BetKind.SP);
            assertEquals(List.of("r1"), sp.runners());
            assertEquals(0, sp.stake().compareTo(new BigDecimal("0.30")));
            assertEquals(0.50, sp.estimate().evRatio(), 1e-9);
            assertEquals(0.38, sp.estimate().roiRatio(), 1e-9);
            assertEquals(0.50, d.evGlobalEstimate(), 1e-9);
            assertEquals(1.10, d.overround(), 1e-9);
            assertTrue(d.message().startsWith("H5 bet: SP r1 stake 0.3"));
        }

        @Test
        @DisplayName("combo failing the payout floor in a short field is dropped, not fatal")
        void shortFieldComboDropped() {
            DecisionArtifact artifact = engine.run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config());

            assertTrue(artifact.droppedLegs().stream().anyMatch(l -> l.kind() == BetKind.COMBO));
            assertTrue(artifact.verdicts().stream()
                .anyMatch(v -> v.stage() == GuardrailStage.COMBO && !v.passed()));
            assertFalse(artifact.decision().reasonCodes().isEmpty());
        }

        @Test
        @DisplayName("decision timestamps come from the snapshot, not the evaluation instant")
        void timestampsFromEvidence() {
            Decision d = engine.run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config()).decision();
            assertEquals(T0, d.snapshotCapturedAt());
            assertEquals(T0, d.decidedAt());
        }

        @Test
        @DisplayName("artifact carries estimates, verdicts, ceiling and drift")
        void artifactContents() {
            RaceSnapshot h30 = snapshot(Phase.H30, T0.minusSeconds(1500), 5.5, 2.5, 4.0, 4.0);
            PhaseInputs in = PhaseInputs.h5("M1", "R1", AS_OF, fairField(Phase.H5, T0), h30,
                                            payoutModel(T0), enrichment(), null);

            DecisionArtifact artifact = engine.run(Phase.H5, in, config());

            assertEquals(2, artifact.estimates().size());
            assertEquals(1.30, artifact.overroundCeiling(), 1e-9);
            assertEquals(GuardrailStage.MARKET, artifact.verdicts().get(0).stage());
            assertEquals(4, artifact.drift().size());
            RunnerDrift r1 = artifact.drift().get(0);
            assertEquals("r1", r1.runnerId());
            assertEquals(DriftStatus.STEAM, r1.status());
            assertEquals(DriftStatus.STABLE, artifact.drift().get(1).status());
        }

        @Test
        @DisplayName("both legs passing → SP and COMBO tickets within budget and runner cap")
        void bothLegs() {
            DecisionPipelineEngine stubbed = new DecisionPipelineEngine(stubEstimator(0.45, 0.30, 12.0));
            Decision d = stubbed.run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config()).decision();

            assertEquals(2, d.tickets().size());
            assertTrue(d.totalStake().doubleValue() <= 5.0);
            BigDecimal r1Exposure = d.tickets().stream().filter(t -> t.involves("r1"))
                .map(Ticket::stake).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertTrue(r1Exposure.doubleValue() <= 3.0);
            assertEquals(List.of(), d.reasonCodes());
        }

        @Test
        @DisplayName("combo with ev 0.38 is dropped and the SP leg still bets")
        void comboBelowEvDropped() {
            DecisionPipelineEngine stubbed = new DecisionPipelineEngine(stubEstimator(0.38, 0.30, 12.0));
            DecisionArtifact artifact = stubbed.run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config());
            Decision d = artifact.decision();

            assertFalse(d.abstain());
            assertEquals(1, d.tickets().size());
            assertEquals(BetKind.SP, d.tickets().get(0).kind());
            assertEquals(List.of(ReasonCode.EV_BELOW_MIN_COMBO), d.reasonCodes());
            assertEquals(ReasonCode.EV_BELOW_MIN_COMBO, artifact.droppedLegs().get(0).reason().code());
        }

        @Test
        @DisplayName("global EV gate failure drops the combo and keeps the SP")
        void globalGateDropsCombo() {
            Estimator estimator = (snapshot, subset, model, config) -> subset.size() == 1
                ? Estimate.of(BetKind.SP, 0.20, 0.11, 4.0, subset, 0.30, 4.0)
                : Estimate.of(BetKind.COMBO, 0.45, 0.30, 12.0, subset, 1.45 / 12.0, 12.0);
            DecisionArtifact artifact = new DecisionPipelineEngine(estimator)
                .run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config());
            Decision d = artifact.decision();

            assertEquals(1, d.tickets().size());
            assertEquals(BetKind.SP, d.tickets().get(0).kind());
            assertEquals(List.of(ReasonCode.EV_BELOW_MIN_GLOBAL), d.reasonCodes());
            assertTrue(artifact.verdicts().stream()
                .anyMatch(v -> v.stage() == GuardrailStage.GLOBAL && !v.passed()));
        }

        @Test
        @DisplayName("maxTicketsPerRace = 1 → combo dropped with TICKET_CAP")
        void ticketCap() {
            DecisionPipelineEngine stubbed = new DecisionPipelineEngine(stubEstimator(0.45, 0.30, 12.0));
            Decision d = stubbed.run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config(1)).decision();

            assertEquals(1, d.tickets().size());
            assertEquals(BetKind.SP, d.tickets().get(0).kind());
            assertEquals(List.of(ReasonCode.TICKET_CAP), d.reasonCodes());
        }

        @Test
        @DisplayName("no leg qualifies → abstain with the rejection codes")
        void nothingQualifies() {
            Estimator estimator = (snapshot, subset, model, config) -> subset.size() == 1
                ? Estimate.of(BetKind.SP, 0.05, 0.01, 4.0, subset, 0.21, 4.0)
                : Estimate.failed(BetKind.COMBO, subset, "payout model returned no payout");
            Decision d = new DecisionPipelineEngine(estimator)
                .run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config()).decision();

            assertTrue(d.abstain());
            assertTrue(d.tickets().isEmpty());
            assertTrue(d.reasonCodes().contains(ReasonCode.EV_BELOW_MIN_SP));
            assertTrue(d.reasonCodes().contains(ReasonCode.ESTIMATION_FAILURE));
            assertTrue(d.message().startsWith("H5 abstain: "));
            assertNull(d.evGlobalEstimate());
        }
    }

    @Nested
    @DisplayName("H5 abstentions")
    class H5Abstentions {

        @Test
        @DisplayName("overround 1.35 → abstain before any estimate")
        void overroundRejected() {
            DecisionArtifact artifact = engine.run(Phase.H5, h5Inputs(overroundField(Phase.H5, T0)), config());
            Decision d = artifact.decision();

            assertTrue(d.abstain());
            assertEquals(List.of(ReasonCode.OVERROUND_ABOVE_CEILING), d.reasonCodes());
            assertTrue(d.message().contains("overround 1.3500 above ceiling 1.30"), d.message());
            assertTrue(artifact.estimates().isEmpty());
        }

        @Test
        @DisplayName("overround 1.31 just above the ceiling is rejected")
        void overroundJustAbove() {
            RaceSnapshot field = snapshot(Phase.H5, T0, 2.0, 2.0, 100.0 / 31.0);
            Decision d = engine.run(Phase.H5, h5Inputs(field), config()).decision();

            assertTrue(d.abstain());
            assertEquals(List.of(ReasonCode.OVERROUND_ABOVE_CEILING), d.reasonCodes());
        }

        @Test
        @DisplayName("snapshot older than the freshness window → STALE_INPUT")
        void staleSnapshot() {
            PhaseInputs in = PhaseInputs.h5("M1", "R1", T0.plusSeconds(421), fairField(Phase.H5, T0), null,
                                            payoutModel(T0.plusSeconds(300)), enrichment(), null);
            Decision d = engine.run(Phase.H5, in, config()).decision();

            assertTrue(d.abstain());
            assertEquals(List.of(ReasonCode.STALE_INPUT), d.reasonCodes());
            assertTrue(d.message().contains("stale input"));
        }

        @Test
        @DisplayName("missing enrichment → abstain without calling the estimator")
        void enrichmentMissing() {
            Estimator estimator = mock(Estimator.class);
            PhaseInputs in = PhaseInputs.h5("M1", "R1", AS_OF, fairField(Phase.H5, T0), null,
                                            payoutModel(T0), null, null);

            Decision d = new DecisionPipelineEngine(estimator).run(Phase.H5, in, config()).decision();

            assertTrue(d.abstain());
            assertEquals("enrichment missing", d.message());
            assertEquals(List.of(ReasonCode.ENRICHMENT_MISSING), d.reasonCodes());
            verifyNoInteractions(estimator);
        }

        @Test
        @DisplayName("enrichment without chrono data counts as missing")
        void enrichmentIncomplete() {
            var partial = new com.raceplatform.common.model.Enrichment(Map.of("r1", 14.0), Map.of(), Map.of(), T0);
            PhaseInputs in = PhaseInputs.h5("M1", "R1", AS_OF, fairField(Phase.H5, T0), null,
                                            payoutModel(T0), partial, null);

            Decision d = engine.run(Phase.H5, in, config()).decision();
            assertEquals(List.of(ReasonCode.ENRICHMENT_MISSING), d.reasonCodes());
        }

        @Test
        @DisplayName("missing snapshot → DATA_UNAVAILABLE")
        void snapshotMissing() {
            Decision d = engine.run(Phase.H5, h5Inputs(null), config()).decision();

            assertTrue(d.abstain());
            assertEquals(List.of(ReasonCode.DATA_UNAVAILABLE), d.reasonCodes());
            assertEquals("H5 snapshot unavailable", d.message());
            assertNull(d.decidedAt());
        }

        @Test
        @DisplayName("missing calibration → DATA_UNAVAILABLE")
        void calibrationMissing() {
            PhaseInputs in = PhaseInputs.h5("M1", "R1", AS_OF, fairField(Phase.H5, T0), null, null,
                                            enrichment(), null);
            Decision d = engine.run(Phase.H5, in, config()).decision();

            assertEquals(List.of(ReasonCode.DATA_UNAVAILABLE), d.reasonCodes());
            assertEquals("calibration unavailable", d.message());
        }
    }

    @Nested
    @DisplayName("H30 → H5 no-regression")
    class NoRegression {

        private Decision rejectedH30() {
            PhaseInputs in = PhaseInputs.h30("M1", "R1", T0.plusSeconds(10), overroundField(Phase.H30, T0),
                                             payoutModel(T0));
            return engine.run(Phase.H30, in, config()).decision();
        }

        @Test
        @DisplayName("H30 rejected the market and H5 has no newer snapshot → abstain")
        void noFreshData() {
            Decision h30 = rejectedH30();
            PhaseInputs in = PhaseInputs.h5("M1", "R1", AS_OF, fairField(Phase.H5, T0), null,
                                            payoutModel(T0), enrichment(), h30);

            Decision d = engine.run(Phase.H5, in, config()).decision();

            assertTrue(d.abstain());
            assertEquals(List.of(ReasonCode.NO_FRESH_DATA_SINCE_H30), d.reasonCodes());
        }

        @Test
        @DisplayName("an H30 rejection from another meeting does not block H5")
        void otherMeetingIgnored() {
            Decision h30 = rejectedH30();
            PhaseInputs in = PhaseInputs.h5("M2", "R1", AS_OF, forMeeting(fairField(Phase.H5, T0), "M2"), null,
                                            payoutModel(T0), enrichment(), h30);

            Decision d = engine.run(Phase.H5, in, config()).decision();

            assertFalse(d.abstain());
            assertEquals("M2", d.meetingId());
        }

        @Test
        @DisplayName("a newer H5 snapshot is evaluated on its own merits")
        void freshDataEvaluated() {
            Decision h30 = rejectedH30();
            PhaseInputs in = PhaseInputs.h5("M1", "R1", T0.plusSeconds(120), fairField(Phase.H5, T0.plusSeconds(60)),
                                            null, payoutModel(T0), enrichment(), h30);

            Decision d = engine.run(Phase.H5, in, config()).decision();

            assertFalse(d.abstain());
        }
    }

    // ── H30 ─────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("H30")
    class H30 {

        @Test
        @DisplayName("passing market → annotated abstention, never a ticket")
        void neverBets() {
            PhaseInputs in = PhaseInputs.h30("M1", "R1", AS_OF, fairField(Phase.H30, T0), payoutModel(T0));
            DecisionArtifact artifact = engine.run(Phase.H30, in, config());
            Decision d = artifact.decision();

            assertTrue(d.abstain());
            assertTrue(d.tickets().isEmpty());
            assertEquals(List.of(ReasonCode.PHASE_NEVER_BETS), d.reasonCodes());
            assertTrue(d.message().contains("tickets deferred to H5"));
            assertTrue(artifact.verdicts().get(0).passed());
        }

        @Test
        @DisplayName("overround above ceiling → market rejection codes")
        void rejected() {
            PhaseInputs in = PhaseInputs.h30("M1", "R1", AS_OF, overroundField(Phase.H30, T0), payoutModel(T0));
            Decision d = engine.run(Phase.H30, in, config()).decision();

            assertEquals(List.of(ReasonCode.OVERROUND_ABOVE_CEILING), d.reasonCodes());
            assertTrue(d.message().startsWith("H30 market rejected: "));
        }

        @Test
        @DisplayName("missing snapshot → DATA_UNAVAILABLE")
        void snapshotMissing() {
            PhaseInputs in = PhaseInputs.h30("M1", "R1", AS_OF, null, payoutModel(T0));
            Decision d = engine.run(Phase.H30, in, config()).decision();

            assertEquals(List.of(ReasonCode.DATA_UNAVAILABLE), d.reasonCodes());
            assertEquals("H30 snapshot unavailable", d.message());
        }
    }

    // ── RESULT ──────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("RESULT")
    class Result {

        private final Decision h5 = engine.run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config()).decision();
        private final Instant published = T0.plusSeconds(900);

        @Test
        @DisplayName("winning SP ticket is settled at the official dividend")
        void reconciles() {
            OfficialResult result = new OfficialResult("R1", List.of("r1", "r2", "r3", "r4"), published,
                                                       Map.of("r1", 5.2), Map.of());
            Decision d = engine.run(Phase.RESULT, PhaseInputs.result("M1", "R1", published, h5, result), config())
                .decision();

            assertTrue(d.abstain());
            assertEquals(List.of(ReasonCode.PHASE_NEVER_BETS), d.reasonCodes());
            assertNotNull(d.reconciliation());
            assertTrue(d.reconciliation().outcomes().get(0).won());
            assertEquals(0, d.reconciliation().totalReturn().compareTo(new BigDecimal("1.56")));
            assertEquals(published, d.decidedAt());
        }

        @Test
        @DisplayName("losing SP ticket returns nothing")
        void losingTicket() {
            OfficialResult result = new OfficialResult("R1", List.of("r2", "r1", "r3", "r4"), published,
                                                       Map.of("r2", 2.4), Map.of());
            Decision d = engine.run(Phase.RESULT, PhaseInputs.result("M1", "R1", published, h5, result), config())
                .decision();

            assertEquals(0, d.reconciliation().totalReturn().signum());
            assertEquals(-1.0, d.reconciliation().realizedRoi(), 1e-9);
        }

        @Test
        @DisplayName("no recorded H5 decision → RESULTS_UNAVAILABLE")
        void noH5() {
            OfficialResult result = new OfficialResult("R1", List.of("r1"), published, Map.of("r1", 5.2), Map.of());
            Decision d = engine.run(Phase.RESULT, PhaseInputs.result("M1", "R1", published, null, result), config())
                .decision();

            assertEquals(List.of(ReasonCode.RESULTS_UNAVAILABLE), d.reasonCodes());
            assertNull(d.reconciliation());
        }

        @Test
        @DisplayName("H5 decision of the same race id at another meeting is not reconciled")
        void otherMeetingH5() {
            OfficialResult result = new OfficialResult("R1", List.of("r1", "r2"), published, Map.of("r1", 5.2), Map.of());
            Decision d = engine.run(Phase.RESULT, PhaseInputs.result("M2", "R1", published, h5, result), config())
                .decision();

            assertEquals(List.of(ReasonCode.RESULTS_UNAVAILABLE), d.reasonCodes());
            assertEquals("no H5 decision recorded for meeting M2 race R1", d.message());
            assertNull(d.reconciliation());
        }

        @Test
        @DisplayName("result not published → RESULTS_UNAVAILABLE")
        void noResult() {
            Decision d = engine.run(Phase.RESULT, PhaseInputs.result("M1", "R1", published, h5, null), config())
                .decision();

            assertEquals(List.of(ReasonCode.RESULTS_UNAVAILABLE), d.reasonCodes());
            assertEquals("official result not published", d.message());
        }

        @Test
        @DisplayName("winner without a published dividend → RESULTS_UNAVAILABLE")
        void missingDividend() {
            OfficialResult result = new OfficialResult("R1", List.of("r1", "r2"), published, Map.of(), Map.of());
            Decision d = engine.run(Phase.RESULT, PhaseInputs.result("M1", "R1", published, h5, result), config())
                .decision();

            assertEquals(List.of(ReasonCode.RESULTS_UNAVAILABLE), d.reasonCodes());
            assertEquals(published, d.decidedAt());
        }
    }

    // ── cross-cutting ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Determinism and config")
    class Determinism {

        @Test
        @DisplayName("identical inputs → equal decisions and keys")
        void idempotent() {
            PhaseInputs in = h5Inputs(fairField(Phase.H5, T0));
            Decision first = engine.run(Phase.H5, in, config()).decision();
            Decision second = new DecisionPipelineEngine(new EvRoiEstimator()).run(Phase.H5, in, config()).decision();

            assertEquals(first, second);
            assertEquals(first.decisionKey(), second.decisionKey());
        }

        @Test
        @DisplayName("a later evaluation instant within the window does not change the key")
        void asOfIndependent() {
            Decision first = engine.run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config()).decision();
            PhaseInputs later = PhaseInputs.h5("M1", "R1", T0.plusSeconds(300), fairField(Phase.H5, T0),
                                               fairField(Phase.H30, T0.minusSeconds(1500)),
                                               payoutModel(T0), enrichment(), null);
            Decision second = engine.run(Phase.H5, later, config()).decision();

            assertEquals(first.decisionKey(), second.decisionKey());
        }

        @Test
        @DisplayName("malformed config → ConfigInvalidException before anything runs")
        void invalidConfig() {
            GpiConfig bad = new GpiConfig(-1.0, 0.5, 0.60, 1.30, 1.25, 14, 0.15, 0.10, 0.60, 0.40, 0.20, 10.0,
                                          0.35, 0.10, 2, 420, List.of(ExoticType.COUPLE_PLACE), 1.30, 4,
                                          1.0, 20_000, 42L, 0.10, 0.07);
            PhaseInputs in = h5Inputs(fairField(Phase.H5, T0));

            ConfigInvalidException e = assertThrows(ConfigInvalidException.class,
                () -> engine.run(Phase.H5, in, bad));
            assertFalse(e.getViolations().isEmpty());
        }
    }

    @Nested
    @DisplayName("Gating before selection")
    class GatingBeforeSelection {

        @Test
        @DisplayName("top-EV SP over the probability cap → runner-up SP is staked")
        void spRunnerUpStaked() {
            Estimator estimator = (snapshot, subset, model, config) -> {
                if (subset.size() > 1) {
                    return Estimate.failed(BetKind.COMBO, subset, "no combo price");
                }
                return switch (subset.get(0)) {
                    case "r2" -> Estimate.of(BetKind.SP, 0.90, 0.80, 2.92, subset, 0.65, 1.90 / 0.65);
                    case "r1" -> Estimate.of(BetKind.SP, 0.50, 0.38, 5.0, subset, 0.30, 5.0);
                    default   -> Estimate.of(BetKind.SP, -0.40, -0.45, 4.0, subset, 0.15, 4.0);
                };
            };
            DecisionArtifact artifact = new DecisionPipelineEngine(estimator)
                .run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config());
            Decision d = artifact.decision();

            assertFalse(d.abstain());
            assertEquals(1, d.tickets().size());
            Ticket sp = ticket(d, BetKind.SP);
            assertEquals(List.of("r1"), sp.runners());
            assertEquals(0, sp.stake().compareTo(new BigDecimal("0.30")));
            assertTrue(d.reasonCodes().contains(ReasonCode.SP_PROBABILITY_ABOVE_MAX));
            assertTrue(artifact.droppedLegs().stream()
                .anyMatch(l -> l.kind() == BetKind.SP && l.runners().equals(List.of("r2"))
                    && l.reason().code() == ReasonCode.SP_PROBABILITY_ABOVE_MAX));
        }

        @Test
        @DisplayName("top-EV basket under the payout floor → next passing basket is staked")
        void comboRunnerUpStaked() {
            Estimator base = stubEstimator(0.45, 0.30, 12.0);
            Estimator estimator = (snapshot, subset, model, config) ->
                subset.equals(List.of("r2", "r1")) || subset.equals(List.of("r1", "r2"))
                    ? Estimate.of(BetKind.COMBO, 1.50, 1.00, 8.0, subset, 2.5 / 8.0, 8.0)
                    : base.estimate(snapshot, subset, model, config);
            DecisionArtifact artifact = new DecisionPipelineEngine(estimator)
                .run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config());
            Decision d = artifact.decision();

            assertEquals(2, d.tickets().size());
            assertEquals(List.of("r1", "r3"), ticket(d, BetKind.COMBO).runners());
            assertEquals(List.of(ReasonCode.PAYOUT_BELOW_MIN_COMBO), d.reasonCodes());
        }

        @Test
        @DisplayName("TRIO allowed → the best basket across exotic types wins")
        void trioAcrossTypes() {
            Estimator base = stubEstimator(0.45, 0.30, 12.0);
            Estimator estimator = (snapshot, subset, model, config) -> subset.size() == 3
                ? Estimate.of(BetKind.COMBO, 1.50, 1.00, 12.0, subset, 2.5 / 12.0, 12.0)
                : base.estimate(snapshot, subset, model, config);
            GpiConfig withTrio = config(2, List.of(ExoticType.COUPLE_PLACE, ExoticType.TRIO));

            Decision d = new DecisionPipelineEngine(estimator)
                .run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), withTrio).decision();

            Ticket combo = ticket(d, BetKind.COMBO);
            assertEquals(ExoticType.TRIO, combo.exoticType());
            assertEquals(List.of("r1", "r2", "r3"), combo.runners());
        }

        @Test
        @DisplayName("ZE4 needs four pooled runners; a three-runner field only prices smaller types")
        void typeNeedsFullPool() {
            List<Integer> sizes = new ArrayList<>();
            Estimator base = stubEstimator(0.45, 0.30, 12.0);
            Estimator estimator = (snapshot, subset, model, config) -> {
                sizes.add(subset.size());
                return base.estimate(snapshot, subset, model, config);
            };
            RaceSnapshot field = snapshot(Phase.H5, T0, 5.0, 2.5, 4.0);
            GpiConfig withZe4 = config(2, List.of(ExoticType.COUPLE_PLACE, ExoticType.ZE4));

            new DecisionPipelineEngine(estimator).run(Phase.H5, h5Inputs(field), withZe4);

            assertTrue(sizes.contains(2));
            assertFalse(sizes.contains(4));
        }

        @Test
        @DisplayName("place overround above the exotics ceiling → no combo, SP still bets")
        void placeOverroundBlocksExotics() {
            RaceSnapshot field = withPlaceOdds(fairField(Phase.H5, T0), 1.5);
            DecisionArtifact artifact = new DecisionPipelineEngine(stubEstimator(0.45, 0.30, 12.0))
                .run(Phase.H5, h5Inputs(field), config());
            Decision d = artifact.decision();

            assertEquals(1, d.tickets().size());
            assertEquals(BetKind.SP, d.tickets().get(0).kind());
            assertEquals(List.of(ReasonCode.PLACE_OVERROUND_ABOVE_CEILING), d.reasonCodes());
            assertTrue(artifact.estimates().stream().noneMatch(e -> e.kind() == BetKind.COMBO));
            assertTrue(artifact.verdicts().stream().anyMatch(v -> v.stage() == GuardrailStage.COMBO
                && v.codes().contains(ReasonCode.PLACE_OVERROUND_ABOVE_CEILING)));
        }

        @Test
        @DisplayName("place overround within the exotics ceiling → combo still offered")
        void placeOverroundWithinCeiling() {
            RaceSnapshot field = withPlaceOdds(fairField(Phase.H5, T0), 4.0);
            Decision d = new DecisionPipelineEngine(stubEstimator(0.45, 0.30, 12.0))
                .run(Phase.H5, h5Inputs(field), config()).decision();

            assertEquals(2, d.tickets().size());
            assertEquals(ExoticType.COUPLE_PLACE, ticket(d, BetKind.COMBO).exoticType());
        }

        @Test
        @DisplayName("no allowed exotic → SP only, no combo estimate")
        void exoticsDisabled() {
            DecisionArtifact artifact = new DecisionPipelineEngine(stubEstimator(0.45, 0.30, 12.0))
                .run(Phase.H5, h5Inputs(fairField(Phase.H5, T0)), config(2, List.of()));

            assertEquals(1, artifact.decision().tickets().size());
            assertTrue(artifact.estimates().stream().allMatch(e -> e.kind() == BetKind.SP));
            assertTrue(artifact.decision().reasonCodes().isEmpty());
        }
    }

    @Nested
    @DisplayName("Candidate selection")
    class CandidateSelection {

        @Test
        @DisplayName("combo pool ranks by calibrated probability, ties by id")
        void comboPool() {
            List<String> pool = DecisionPipelineEngine.comboPool(fairField(Phase.H5, T0), payoutModel(T0), 3);
            assertEquals(List.of("r2", "r1", "r3"), pool);
        }

        @Test
        @DisplayName("best candidate: ev, then expected payout, then runner ids")
        void ordering() {
            Estimate a = Estimate.of(BetKind.SP, 0.30, 0.2, 4.0, List.of("r2"), 0.3, 4.0);
            Estimate b = Estimate.of(BetKind.SP, 0.30, 0.2, 6.0, List.of("r3"), 0.2, 6.0);
            Estimate c = Estimate.of(BetKind.SP, 0.30, 0.2, 6.0, List.of("r1"), 0.2, 6.0);
            Estimate d = Estimate.of(BetKind.SP, 0.10, 0.0, 9.0, List.of("r4"), 0.1, 9.0);

            List<Estimate> sorted = List.of(a, b, c, d).stream()
                .sorted(DecisionPipelineEngine.BEST_CANDIDATE).toList();
            assertEquals(List.of(c, b, a, d), sorted);
        }

        @Test
        @DisplayName("stake-weighted EV over committed tickets")
        void stakeWeighted() {
            Ticket sp = new Ticket(BetKind.SP, new BigDecimal("0.30"), List.of("r1"),
                Estimate.of(BetKind.SP, 0.50, 0.38, 5.0, List.of("r1"), 0.3, 5.0));
            Ticket combo = new Ticket(BetKind.COMBO, new BigDecimal("0.10"), List.of("r1", "r2"),
                Estimate.of(BetKind.COMBO, 0.90, 0.6, 12.0, List.of("r1", "r2"), 0.16, 12.0));

            assertEquals(0.60, DecisionPipelineEngine.stakeWeightedEv(List.of(sp, combo)), 1e-9);
            assertNull(DecisionPipelineEngine.stakeWeightedEv(List.of()));
        }
    }
}

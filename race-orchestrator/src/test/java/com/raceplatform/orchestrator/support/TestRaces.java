package com.raceplatform.orchestrator.support;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.estimate.CalibrationSnapshot;
import com.raceplatform.common.estimate.ParimutuelPayoutModel;
import com.raceplatform.common.estimate.PayoutModel;
import com.raceplatform.common.model.Enrichment;
import com.raceplatform.common.model.ExoticType;
import com.raceplatform.common.model.Phase;
import com.raceplatform.common.model.RaceProfile;
import com.raceplatform.common.model.RaceSnapshot;
import com.raceplatform.common.model.Runner;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Race fixtures for orchestrator tests. The "fair" field has overround 1.10 and one value runner:
 * r1 at 5.0 with calibrated probability 0.30 (ev 0.50).
 */
public final class TestRaces {

    public static final Instant T0 = Instant.parse("2026-05-10T13:25:00Z");

    public static final Map<String, Double> PROBABILITIES =
        Map.of("r1", 0.30, "r2", 0.40, "r3", 0.15, "r4", 0.15);

    private TestRaces() {}

    public static GpiConfig config() {
        return config(2);
    }

    public static GpiConfig config(int maxTickets) {
        return config(maxTickets, List.of(ExoticType.COUPLE_PLACE));
    }

    public static GpiConfig config(int maxTickets, List<ExoticType> exotics) {
        return new GpiConfig(5.0, 0.5, 0.60, 1.30, 1.25, 14, 0.15, 0.10, 0.60, 0.40, 0.20, 10.0, 0.35,
                             0.10, maxTickets, 420, exotics, 1.30, 4, 1.0, 20_000, 42L, 0.10, 0.07);
    }

    public static Runner runner(String id, int number, double odds) {
        return new Runner(id, number, "Horse " + id, odds, null, false);
    }

    public static RaceSnapshot snapshot(Phase phase, Instant capturedAt, double... odds) {
        Runner[] runners = new Runner[odds.length];
        for (int i = 0; i < odds.length; i++) {
            runners[i] = runner("r" + (i + 1), i + 1, odds[i]);
        }
        return new RaceSnapshot("M1", "R1", phase, capturedAt, RaceProfile.standard("Plat"), null, List.of(runners));
    }

    /** Overround 1.10. */
    public static RaceSnapshot fairField(Phase phase, Instant capturedAt) {
        return snapshot(phase, capturedAt, 5.0, 2.5, 4.0, 4.0);
    }

    /** Overround 1.35. */
    public static RaceSnapshot overroundField(Phase phase, Instant capturedAt) {
        return snapshot(phase, capturedAt, 5.0, 2.0, 4.0, 2.5);
    }

    /** Same field with every runner priced at {@code placeOdds} in the place pool. */
    public static RaceSnapshot withPlaceOdds(RaceSnapshot snapshot, double placeOdds) {
        List<Runner> runners = snapshot.runners().stream()
            .map(r -> new Runner(r.id(), r.number(), r.name(), r.winOdds(), placeOdds, r.scratched()))
            .toList();
        return new RaceSnapshot(snapshot.meetingId(), snapshot.raceId(), snapshot.phase(), snapshot.capturedAt(),
                                snapshot.profile(), snapshot.timestamps(), runners);
    }

    /** Same field published under another meeting. */
    public static RaceSnapshot forMeeting(RaceSnapshot snapshot, String meetingId) {
        return new RaceSnapshot(meetingId, snapshot.raceId(), snapshot.phase(), snapshot.capturedAt(),
                                snapshot.profile(), snapshot.timestamps(), snapshot.runners());
    }

    public static PayoutModel payoutModel(Instant calibratedAt) {
        return new ParimutuelPayoutModel(new CalibrationSnapshot(calibratedAt, PROBABILITIES, 0.25, 1.0),
                                         20_000, 42L);
    }

    public static Enrichment enrichment() {
        return new Enrichment(Map.of("r1", 14.0, "r2", 11.0), Map.of("r1", 9.0), Map.of("r1", 72.4, "r2", 73.1), T0);
    }
}

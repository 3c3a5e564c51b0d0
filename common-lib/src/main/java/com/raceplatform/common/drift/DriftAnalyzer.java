package com.raceplatform.common.drift;

import com.raceplatform.common.model.DriftStatus;
import com.raceplatform.common.model.RaceSnapshot;
import com.raceplatform.common.model.Runner;
import com.raceplatform.common.model.RunnerDrift;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Classifies each runner's win-odds movement between the H30 and H5 snapshots.
 *
 * <pre>
 *   change = (oddsH5 − oddsH30) / oddsH30
 *   change ≤ −threshold  → STEAM   (market backing the runner)
 *   change ≥ +threshold  → DRIFT
 *   otherwise            → STABLE
 * </pre>
 *
 * <p>Audit only: the report is attached to the artifact and never feeds staking.
 * Runners scratched at H5, or without valid odds at either phase, are left out.
 */
public final class DriftAnalyzer {

    private DriftAnalyzer() {}

    public static List<RunnerDrift> analyze(RaceSnapshot h30, RaceSnapshot h5, double threshold) {
        if (h30 == null || h5 == null) {
            return List.of();
        }
        List<RunnerDrift> report = new ArrayList<>();
        for (Runner now : h5.activeRunners()) {
            Optional<Runner> before = h30.runner(now.id());
            if (before.isEmpty() || !before.get().hasValidWinOdds() || !now.hasValidWinOdds()) {
                continue;
            }
            double oddsH30 = before.get().winOdds();
            double oddsH5  = now.winOdds();
            double change  = (oddsH5 - oddsH30) / oddsH30;
            report.add(new RunnerDrift(now.id(), oddsH30, oddsH5, change, classify(change, threshold)));
        }
        report.sort(Comparator.comparing(RunnerDrift::runnerId));
        return List.copyOf(report);
    }

    public static DriftStatus classify(double changeRatio, double threshold) {
        if (changeRatio <= -threshold) return DriftStatus.STEAM;
        if (changeRatio >= threshold)  return DriftStatus.DRIFT;
        return DriftStatus.STABLE;
    }
}

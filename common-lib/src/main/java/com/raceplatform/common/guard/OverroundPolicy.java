package com.raceplatform.common.guard;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.model.RaceProfile;
import com.raceplatform.common.model.RaceSnapshot;

import java.util.Locale;

/**
 * Selects the overround ceiling from the race type.
 *
 * <pre>
 *   handicap AND starters ≥ handicapMinStarters → overroundCeilingHandicap (default 1.25)
 *   otherwise                                   → overroundCeiling         (default 1.30)
 * </pre>
 *
 * <p>A race is a handicap when its profile says so or when the discipline/label mentions it.
 */
public final class OverroundPolicy {

    private OverroundPolicy() {}

    public static double ceilingFor(RaceSnapshot snapshot, GpiConfig config) {
        return isLargeHandicap(snapshot, config)
            ? config.overroundCeilingHandicap()
            : config.overroundCeiling();
    }

    public static boolean isLargeHandicap(RaceSnapshot snapshot, GpiConfig config) {
        return isHandicap(snapshot.profile()) && snapshot.starters() >= config.handicapMinStarters();
    }

    static boolean isHandicap(RaceProfile profile) {
        if (profile == null) {
            return false;
        }
        return profile.handicap() || mentionsHandicap(profile.discipline()) || mentionsHandicap(profile.label());
    }

    private static boolean mentionsHandicap(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains("handicap");
    }
}

package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Normalized market picture of one race at a checkpoint.
 *
 * <p>Owned by the acquisition collaborator and treated as read-only input. Scratched runners
 * stay in {@link #runners()} for audit but are excluded from {@link #activeRunners()} and
 * from every probability or overround computation.
 *
 * <p>The overround is never read from upstream: {@link #overround()} recomputes it from the
 * active runners' win odds on every call.
 */
public record RaceSnapshot(
    @JsonProperty("meetingId")  String meetingId,
    @JsonProperty("raceId")     String raceId,
    @JsonProperty("phase")      Phase phase,
    @JsonProperty("capturedAt") Instant capturedAt,
    @JsonProperty("profile")    RaceProfile profile,
    @JsonProperty("timestamps") InputTimestamps timestamps,
    @JsonProperty("runners")    List<Runner> runners
) {
    public RaceSnapshot {
        if (raceId == null || raceId.isBlank()) {
            throw new IllegalArgumentException("raceId is required");
        }
        runners = runners == null ? List.of() : List.copyOf(runners);
        Set<String> seen = new HashSet<>();
        for (Runner runner : runners) {
            if (!seen.add(runner.id())) {
                throw new IllegalArgumentException(
                    "duplicate runner id '" + runner.id() + "' in snapshot " + raceId);
            }
        }
        if (timestamps == null && capturedAt != null) {
            timestamps = InputTimestamps.uniform(capturedAt);
        }
    }

    /** Runners that will start. Order of the published list is preserved. */
    @JsonIgnore
    public List<Runner> activeRunners() {
        return runners.stream().filter(r -> !r.scratched()).toList();
    }

    @JsonIgnore
    public int starters() {
        return activeRunners().size();
    }

    public Optional<Runner> runner(String runnerId) {
        return runners.stream().filter(r -> r.id().equals(runnerId)).findFirst();
    }

    /**
     * Sum of implied win probabilities ({@code Σ 1/odds}) over active runners.
     * Empty when the field is empty or any active runner lacks a valid price.
     */
    public OptionalDouble overround() {
        List<Runner> active = activeRunners();
        if (active.isEmpty()) {
            return OptionalDouble.empty();
        }
        double sum = 0.0;
        for (Runner runner : active) {
            if (!runner.hasValidWinOdds()) {
                return OptionalDouble.empty();
            }
            sum += 1.0 / runner.winOdds();
        }
        return OptionalDouble.of(sum);
    }

    /**
     * Sum of implied place probabilities over active runners. A runner without a valid place
     * price counts at its win price. Empty when the field is empty or a runner has neither.
     */
    public OptionalDouble placeOverround() {
        List<Runner> active = activeRunners();
        if (active.isEmpty()) {
            return OptionalDouble.empty();
        }
        double sum = 0.0;
        for (Runner runner : active) {
            if (runner.placeOdds() != null && runner.placeOdds() > 1.0) {
                sum += 1.0 / runner.placeOdds();
            } else if (runner.hasValidWinOdds()) {
                sum += 1.0 / runner.winOdds();
            } else {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.of(sum);
    }

    /** Capture instant of a snapshot-borne mandatory input; {@code null} when missing. */
    public Instant capturedAt(MandatoryInput input) {
        if (timestamps == null) {
            return null;
        }
        return switch (input) {
            case ODDS      -> timestamps.odds();
            case RUNNERS   -> timestamps.runners();
            case SCRATCHES -> timestamps.scratches();
            case CALIBRATION -> null;
        };
    }
}

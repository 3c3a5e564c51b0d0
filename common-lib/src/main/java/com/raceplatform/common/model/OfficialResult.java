package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Official arrival as published after the race.
 *
 * @param raceId         race identifier
 * @param arrival        runner ids in finishing order
 * @param publishedAt    publication instant
 * @param winDividends   official win dividend per unit staked, keyed by runner id
 * @param comboDividends official place-basket dividend per unit staked, keyed by
 *                       {@link #basketKey(List)}
 */
public record OfficialResult(
    @JsonProperty("raceId")         String raceId,
    @JsonProperty("arrival")        List<String> arrival,
    @JsonProperty("publishedAt")    Instant publishedAt,
    @JsonProperty("winDividends")   Map<String, Double> winDividends,
    @JsonProperty("comboDividends") Map<String, Double> comboDividends
) {
    public OfficialResult {
        arrival        = arrival == null ? List.of() : List.copyOf(arrival);
        winDividends   = winDividends == null ? Map.of() : Map.copyOf(winDividends);
        comboDividends = comboDividends == null ? Map.of() : Map.copyOf(comboDividends);
    }

    /** Canonical dividend key of a basket: sorted runner ids joined with {@code '-'}. */
    public static String basketKey(List<String> runners) {
        return String.join("-", runners.stream().sorted().toList());
    }

    /** True when every runner finished within the first {@code depth} places. */
    public boolean allWithin(List<String> runners, int depth) {
        List<String> top = arrival.subList(0, Math.min(depth, arrival.size()));
        return !runners.isEmpty() && top.containsAll(runners);
    }
}

package com.raceplatform.common.model;

import com.raceplatform.common.exception.UnknownPhaseException;

import java.util.Locale;

/**
 * Checkpoints of a race day, in their logical order.
 *
 * <ul>
 *   <li>{@link #H30}: thirty minutes before the off. Market annotation only.</li>
 *   <li>{@link #H5}: five minutes before the off. The only phase that may emit tickets.</li>
 *   <li>{@link #RESULT}: after the official arrival. Reconciliation only.</li>
 * </ul>
 */
public enum Phase {
    H30,
    H5,
    RESULT;

    /**
     * Parses an externally supplied phase label ({@code "H30"}, {@code "h-5"}, {@code "result"}).
     *
     * @throws UnknownPhaseException for null, blank or unrecognised labels
     */
    public static Phase parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnknownPhaseException(String.valueOf(raw));
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace("-", "");
        for (Phase phase : values()) {
            if (phase.name().equals(normalized)) {
                return phase;
            }
        }
        throw new UnknownPhaseException(raw);
    }

    public boolean mayEmitTickets() {
        return this == H5;
    }
}

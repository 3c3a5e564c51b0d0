package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * Outcome of one phase invocation for one race. Created fresh per invocation and never
 * mutated after emission.
 *
 * <p>Invariants: {@code tickets} is empty iff {@code abstain}, and only a phase that
 * {@link Phase#mayEmitTickets() may emit tickets} carries any.
 *
 * <p>{@code decisionKey} is a SHA-256 digest of the canonical content, so two invocations
 * with identical inputs produce equal keys and equal decisions.
 */
public record Decision(
    @JsonProperty("decisionKey")        String decisionKey,
    @JsonProperty("phase")              Phase phase,
    @JsonProperty("meetingId")          String meetingId,
    @JsonProperty("raceId")             String raceId,
    @JsonProperty("abstain")            boolean abstain,
    @JsonProperty("tickets")            List<Ticket> tickets,
    @JsonProperty("message")            String message,
    @JsonProperty("reasonCodes")        List<ReasonCode> reasonCodes,
    @JsonProperty("evGlobalEstimate")   Double evGlobalEstimate,
    @JsonProperty("overround")          Double overround,
    @JsonProperty("snapshotCapturedAt") Instant snapshotCapturedAt,
    @JsonProperty("decidedAt")          Instant decidedAt,
    @JsonProperty("reconciliation")     Reconciliation reconciliation
) {
    public Decision {
        tickets     = tickets == null ? List.of() : List.copyOf(tickets);
        reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
        if (abstain != tickets.isEmpty()) {
            throw new IllegalArgumentException(
                "decision abstain=" + abstain + " inconsistent with " + tickets.size() + " ticket(s)");
        }
        if (!tickets.isEmpty() && phase != null && !phase.mayEmitTickets()) {
            throw new IllegalArgumentException("phase " + phase + " never emits tickets");
        }
    }

    /** Builds an abstention. */
    public static Decision abstain(Phase phase, String meetingId, String raceId, String message,
                                   List<ReasonCode> reasonCodes, Double overround,
                                   Instant snapshotCapturedAt, Instant decidedAt,
                                   Reconciliation reconciliation) {
        return create(phase, meetingId, raceId, List.of(), message, reasonCodes, null,
                      overround, snapshotCapturedAt, decidedAt, reconciliation);
    }

    /** Builds a betting decision. {@code abstain} follows from {@code tickets}. */
    public static Decision bet(Phase phase, String meetingId, String raceId, List<Ticket> tickets,
                               String message, List<ReasonCode> reasonCodes, Double evGlobalEstimate,
                               Double overround, Instant snapshotCapturedAt, Instant decidedAt) {
        return create(phase, meetingId, raceId, tickets, message, reasonCodes, evGlobalEstimate,
                      overround, snapshotCapturedAt, decidedAt, null);
    }

    private static Decision create(Phase phase, String meetingId, String raceId, List<Ticket> tickets,
                                   String message, List<ReasonCode> reasonCodes, Double evGlobalEstimate,
                                   Double overround, Instant snapshotCapturedAt, Instant decidedAt,
                                   Reconciliation reconciliation) {
        boolean abstain = tickets.isEmpty();
        String key = digest(canonical(phase, meetingId, raceId, abstain, tickets, message, reasonCodes,
                                      evGlobalEstimate, overround, snapshotCapturedAt, decidedAt,
                                      reconciliation));
        return new Decision(key, phase, meetingId, raceId, abstain, tickets, message, reasonCodes,
                            evGlobalEstimate, overround, snapshotCapturedAt, decidedAt, reconciliation);
    }

    @JsonIgnore
    public BigDecimal totalStake() {
        return tickets.stream().map(Ticket::stake).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static String canonical(Phase phase, String meetingId, String raceId, boolean abstain,
                                    List<Ticket> tickets, String message, List<ReasonCode> codes,
                                    Double ev, Double overround, Instant capturedAt, Instant decidedAt,
                                    Reconciliation reconciliation) {
        StringBuilder sb = new StringBuilder()
            .append(phase).append('|').append(meetingId).append('|').append(raceId).append('|')
            .append(abstain).append('|');
        for (Ticket t : tickets) {
            sb.append(t.kind()).append(':').append(t.stake().toPlainString()).append(':')
              .append(String.join(",", t.runners())).append(':')
              .append(t.estimate().evRatio()).append(':').append(t.estimate().roiRatio()).append(';');
        }
        sb.append('|').append(message).append('|').append(codes)
          .append('|').append(ev).append('|').append(overround)
          .append('|').append(capturedAt).append('|').append(decidedAt);
        if (reconciliation != null) {
            sb.append('|').append(reconciliation.totalStake().toPlainString())
              .append(':').append(reconciliation.totalReturn().toPlainString())
              .append(':').append(reconciliation.outcomes().size());
        }
        return sb.toString();
    }

    private static String digest(String canonical) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}

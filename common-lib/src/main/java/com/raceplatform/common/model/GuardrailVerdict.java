package com.raceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Outcome of one guardrail stage. A rejection is a normal value, not an exception.
 *
 * <p>Invariant: {@code reasons} is empty iff {@code passed}. Duplicate reasons are collapsed,
 * first occurrence wins.
 */
public record GuardrailVerdict(
    @JsonProperty("stage")   GuardrailStage stage,
    @JsonProperty("passed")  boolean passed,
    @JsonProperty("reasons") List<RejectionReason> reasons
) {
    public GuardrailVerdict {
        reasons = reasons == null ? List.of() : List.copyOf(new LinkedHashSet<>(reasons));
        if (passed != reasons.isEmpty()) {
            throw new IllegalArgumentException(
                "verdict passed=" + passed + " inconsistent with " + reasons.size() + " reason(s)");
        }
    }

    public static GuardrailVerdict pass(GuardrailStage stage) {
        return new GuardrailVerdict(stage, true, List.of());
    }

    public static GuardrailVerdict of(GuardrailStage stage, List<RejectionReason> reasons) {
        return new GuardrailVerdict(stage, reasons.isEmpty(), reasons);
    }

    /** Merges several verdicts into one, keeping reason order. */
    public static GuardrailVerdict combine(GuardrailStage stage, List<GuardrailVerdict> verdicts) {
        List<RejectionReason> all = new ArrayList<>();
        for (GuardrailVerdict v : verdicts) {
            all.addAll(v.reasons());
        }
        return of(stage, all);
    }

    @JsonIgnore
    public List<String> notes() {
        return reasons.stream().map(RejectionReason::note).toList();
    }

    @JsonIgnore
    public List<ReasonCode> codes() {
        return reasons.stream().map(RejectionReason::code).distinct().toList();
    }
}

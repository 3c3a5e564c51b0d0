package com.raceplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.raceplatform.common.fixture.RaceFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class DecisionTest {

    private static Ticket spTicket(String stake) {
        Estimate e = Estimate.of(BetKind.SP, 0.5, 0.38, 5.0, List.of("r1"), 0.30, 5.0);
        return new Ticket(BetKind.SP, new BigDecimal(stake), List.of("r1"), e);
    }

    @Test
    @DisplayName("abstain iff no tickets")
    void abstainInvariant() {
        assertThrows(IllegalArgumentException.class, () -> new Decision("k", Phase.H5, "M1", "R1", true,
            List.of(spTicket("0.30")), "x", List.of(), null, null, T0, T0, null));
        assertThrows(IllegalArgumentException.class, () -> new Decision("k", Phase.H5, "M1", "R1", false,
            List.of(), "x", List.of(), null, null, T0, T0, null));
    }

    @Test
    @DisplayName("H30 and RESULT decisions cannot carry tickets")
    void ticketsOnlyAtH5() {
        for (Phase phase : List.of(Phase.H30, Phase.RESULT)) {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Decision.bet(
                phase, "M1", "R1", List.of(spTicket("0.30")), "bet", List.of(), 0.5, 1.1, T0, T0));
            assertTrue(e.getMessage().contains("never emits tickets"));
        }
        assertDoesNotThrow(() -> Decision.abstain(Phase.H30, "M1", "R1", "annotation", List.of(), 1.1, T0, T0, null));
    }

    @Test
    @DisplayName("combo estimate and ticket expose the exotic type derived from the leg count")
    void exoticTypeFromLegs() {
        Estimate trio = Estimate.of(BetKind.COMBO, 0.6, 0.4, 20.0, List.of("r3", "r1", "r2"), 0.08, 20.0);
        Ticket ticket = new Ticket(BetKind.COMBO, new BigDecimal("0.50"), trio.involvedRunners(), trio);

        assertEquals(ExoticType.TRIO, trio.exoticType());
        assertEquals(ExoticType.TRIO, ticket.exoticType());
        assertNull(Estimate.of(BetKind.SP, 0.5, 0.38, 5.0, List.of("r1"), 0.30, 5.0).exoticType());
        assertNull(Estimate.of(BetKind.COMBO, 0.6, 0.4, 20.0, List.of("r1", "r2", "r3", "r4", "r5"), 0.01, 90.0)
            .exoticType());
    }

    @Test
    @DisplayName("identical content → identical key; any change → different key")
    void keyIsContentDerived() {
        Decision a = Decision.bet(Phase.H5, "M1", "R1", List.of(spTicket("0.30")), "bet", List.of(), 0.5, 1.1, T0, T0);
        Decision b = Decision.bet(Phase.H5, "M1", "R1", List.of(spTicket("0.30")), "bet", List.of(), 0.5, 1.1, T0, T0);
        Decision c = Decision.bet(Phase.H5, "M1", "R1", List.of(spTicket("0.40")), "bet", List.of(), 0.5, 1.1, T0, T0);
        assertEquals(a, b);
        assertEquals(64, a.decisionKey().length());
        assertNotEquals(a.decisionKey(), c.decisionKey());
        assertFalse(a.abstain());
        assertEquals(0, new BigDecimal("0.30").compareTo(a.totalStake()));
    }

    @Test
    @DisplayName("tickets must carry a positive stake")
    void positiveStake() {
        assertThrows(IllegalArgumentException.class, () -> spTicket("0"));
    }

    @Test
    @DisplayName("verdict: duplicate reasons collapse and passed follows reasons")
    void verdictInvariant() {
        RejectionReason r = RejectionReason.of(ReasonCode.STALE_INPUT, "stale input: odds");
        GuardrailVerdict v = GuardrailVerdict.of(GuardrailStage.MARKET, List.of(r, r));
        assertFalse(v.passed());
        assertEquals(1, v.reasons().size());
        assertTrue(GuardrailVerdict.of(GuardrailStage.SP, List.of()).passed());
        assertThrows(IllegalArgumentException.class,
            () -> new GuardrailVerdict(GuardrailStage.SP, true, List.of(r)));
    }
}

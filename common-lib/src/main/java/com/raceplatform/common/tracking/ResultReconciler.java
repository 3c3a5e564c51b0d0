package com.raceplatform.common.tracking;

import com.raceplatform.common.estimate.HarvilleCombinatorics;
import com.raceplatform.common.exception.DataUnavailableException;
import com.raceplatform.common.model.BetKind;
import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.OfficialResult;
import com.raceplatform.common.model.Reconciliation;
import com.raceplatform.common.model.Ticket;
import com.raceplatform.common.model.TicketOutcome;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Settles the tickets of an H5 decision against the official result.
 *
 * <p>SP wins when its runner finishes first and pays {@code stake × winDividend}. A COMBO
 * basket wins when every leg finishes within the first {@code max(3, legs)} places and pays
 * {@code stake × comboDividend}. Returns are rounded half-even to cents.
 */
public final class ResultReconciler {

    private ResultReconciler() {}

    /**
     * @throws DataUnavailableException when a winning ticket has no published dividend or the
     *                                  arrival is empty
     */
    public static Reconciliation reconcile(Decision h5Decision, OfficialResult result) {
        if (result.arrival().isEmpty()) {
            throw new DataUnavailableException(result.raceId(), "official arrival is empty");
        }
        List<TicketOutcome> outcomes = new ArrayList<>();
        BigDecimal totalStake  = BigDecimal.ZERO;
        BigDecimal totalReturn = BigDecimal.ZERO;

        for (Ticket ticket : h5Decision.tickets()) {
            boolean won = ticket.kind() == BetKind.SP
                ? ticket.runners().get(0).equals(result.arrival().get(0))
                : result.allWithin(ticket.runners(), HarvilleCombinatorics.depthFor(ticket.runners().size()));
            BigDecimal payout = won ? ticket.stake().multiply(dividend(ticket, result)) : BigDecimal.ZERO;
            payout = payout.setScale(2, RoundingMode.HALF_EVEN);

            outcomes.add(new TicketOutcome(ticket.kind(), ticket.runners(), ticket.stake(), won, payout));
            totalStake  = totalStake.add(ticket.stake());
            totalReturn = totalReturn.add(payout);
        }

        Double roi = totalStake.signum() == 0
            ? null
            : totalReturn.subtract(totalStake).doubleValue() / totalStake.doubleValue();
        return new Reconciliation(outcomes, totalStake, totalReturn, roi);
    }

    private static BigDecimal dividend(Ticket ticket, OfficialResult result) {
        Double value = ticket.kind() == BetKind.SP
            ? result.winDividends().get(ticket.runners().get(0))
            : result.comboDividends().get(OfficialResult.basketKey(ticket.runners()));
        if (value == null || !(value > 0.0)) {
            throw new DataUnavailableException(result.raceId(),
                "no official dividend for winning " + ticket.kind() + " ticket " + ticket.runners());
        }
        return BigDecimal.valueOf(value);
    }
}

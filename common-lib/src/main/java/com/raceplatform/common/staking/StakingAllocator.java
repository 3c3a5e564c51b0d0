package com.raceplatform.common.staking;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.exception.AllocationFailureException;
import com.raceplatform.common.model.BetKind;
import com.raceplatform.common.model.DroppedLeg;
import com.raceplatform.common.model.Estimate;
import com.raceplatform.common.model.ReasonCode;
import com.raceplatform.common.model.RejectionReason;
import com.raceplatform.common.model.Ticket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts the qualifying SP and COMBO candidates of one race into concrete stakes.
 *
 * <h3>Sizing order</h3>
 * <pre>
 *   1. ticket cap      maxTickets = 1 keeps the SP leg only
 *   2. raw stake       budget × kellyFraction × KellyCriterion.fraction(p, odds), clamped to [0, budget]
 *   3. SP              clamped to the per-runner cap (exposureCapFraction × budget), rounded down
 *   4. COMBO           clamped to budget − SP, then to the remaining headroom of every leg, rounded down
 *   5. any leg under one minStakeIncrement is dropped with a reason
 * </pre>
 *
 * <p>All arithmetic is {@link BigDecimal}; rounding is always {@link RoundingMode#FLOOR}, so the
 * emitted total never exceeds the budget and no runner exceeds its exposure cap.
 */
public final class StakingAllocator {

    private static final Logger log = LoggerFactory.getLogger(StakingAllocator.class);

    private static final MathContext MC = MathContext.DECIMAL64;

    private StakingAllocator() {}

    public static AllocationResult allocate(List<Estimate> candidates, GpiConfig config) {
        return allocate(candidates, config.budget(), config.kellyFraction(), config.exposureCapFraction(),
                        config.minStakeIncrement(), config.maxTicketsPerRace());
    }

    /**
     * @param candidates at most one SP and one COMBO estimate
     * @throws AllocationFailureException on a malformed budget, fraction, increment or ticket cap
     * @throws IllegalArgumentException   when two candidates share a kind
     */
    public static AllocationResult allocate(List<Estimate> candidates, double budget, double kellyFraction,
                                            double exposureCapFraction, double minStakeIncrement,
                                            int maxTickets) {
        validate(budget, kellyFraction, exposureCapFraction, minStakeIncrement, maxTickets);

        Estimate sp = null;
        Estimate combo = null;
        for (Estimate candidate : candidates) {
            if (candidate.kind() == BetKind.SP) {
                if (sp != null) throw new IllegalArgumentException("more than one SP candidate");
                sp = candidate;
            } else {
                if (combo != null) throw new IllegalArgumentException("more than one COMBO candidate");
                combo = candidate;
            }
        }

        BigDecimal budgetAmount = BigDecimal.valueOf(budget);
        BigDecimal increment    = BigDecimal.valueOf(minStakeIncrement);
        BigDecimal runnerCap    = budgetAmount.multiply(BigDecimal.valueOf(exposureCapFraction), MC);

        List<Ticket> tickets = new ArrayList<>();
        List<DroppedLeg> dropped = new ArrayList<>();

        if (sp != null && combo != null && maxTickets < 2) {
            dropped.add(drop(combo, ReasonCode.TICKET_CAP,
                "ticket cap " + maxTickets + " reached, SP leg has priority"));
            combo = null;
        }

        Ticket spTicket = null;
        if (sp != null) {
            BigDecimal raw = rawStake(sp, budgetAmount, kellyFraction);
            BigDecimal clamped = raw.min(runnerCap);
            BigDecimal stake = roundDown(clamped, increment);
            if (stake.compareTo(increment) < 0) {
                dropped.add(belowIncrement(sp, raw, stake, increment));
            } else {
                spTicket = new Ticket(BetKind.SP, stake, sp.involvedRunners(), sp);
                tickets.add(spTicket);
            }
        }

        if (combo != null) {
            BigDecimal raw = rawStake(combo, budgetAmount, kellyFraction);
            BigDecimal committed = spTicket == null ? BigDecimal.ZERO : spTicket.stake();
            BigDecimal clamped = raw.min(budgetAmount.subtract(committed));
            for (String runnerId : combo.involvedRunners()) {
                BigDecimal existing = spTicket != null && spTicket.involves(runnerId) ? spTicket.stake() : BigDecimal.ZERO;
                clamped = clamped.min(runnerCap.subtract(existing));
            }
            if (clamped.signum() < 0) {
                clamped = BigDecimal.ZERO;
            }
            BigDecimal stake = roundDown(clamped, increment);
            if (stake.compareTo(increment) < 0) {
                dropped.add(belowIncrement(combo, raw, stake, increment));
            } else {
                tickets.add(new Ticket(BetKind.COMBO, stake, combo.involvedRunners(), combo));
            }
        }

        AllocationResult result = new AllocationResult(tickets, dropped);
        log.debug("[StakingAllocator] tickets={} dropped={} totalStake={} budget={}",
            tickets.size(), dropped.size(), result.totalStake().toPlainString(), budgetAmount.toPlainString());
        return result;
    }

    private static void validate(double budget, double kellyFraction, double exposureCapFraction,
                                 double minStakeIncrement, int maxTickets) {
        if (!(budget > 0.0) || !Double.isFinite(budget)) {
            throw new AllocationFailureException("budget must be positive, got " + budget);
        }
        if (!(kellyFraction > 0.0) || kellyFraction > 1.0) {
            throw new AllocationFailureException("kelly fraction must be in (0, 1], got " + kellyFraction);
        }
        if (!(exposureCapFraction > 0.0) || exposureCapFraction > 1.0) {
            throw new AllocationFailureException("exposure cap fraction must be in (0, 1], got " + exposureCapFraction);
        }
        if (!(minStakeIncrement > 0.0) || !Double.isFinite(minStakeIncrement)) {
            throw new AllocationFailureException("stake increment must be positive, got " + minStakeIncrement);
        }
        if (maxTickets < 1) {
            throw new AllocationFailureException("ticket cap must be at least 1, got " + maxTickets);
        }
    }

    private static BigDecimal rawStake(Estimate estimate, BigDecimal budget, double kellyFraction) {
        if (!estimate.isUsable()) {
            return BigDecimal.ZERO;
        }
        double f = KellyCriterion.fraction(estimate.probability(), estimate.odds());
        BigDecimal raw = budget.multiply(BigDecimal.valueOf(kellyFraction), MC)
                               .multiply(BigDecimal.valueOf(f), MC);
        return raw.min(budget);
    }

    static BigDecimal roundDown(BigDecimal amount, BigDecimal increment) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal units = amount.divide(increment, 0, RoundingMode.FLOOR);
        return units.multiply(increment);
    }

    private static DroppedLeg belowIncrement(Estimate leg, BigDecimal raw, BigDecimal stake, BigDecimal increment) {
        boolean clampedAway = raw.compareTo(increment) >= 0;
        ReasonCode code = clampedAway ? ReasonCode.EXPOSURE_CAP : ReasonCode.STAKE_BELOW_INCREMENT;
        String note = clampedAway
            ? String.format(Locale.ROOT, "%s stake clamped to %s by budget or exposure cap, below increment %s",
                            leg.kind(), stake.toPlainString(), increment.toPlainString())
            : String.format(Locale.ROOT, "%s kelly stake %.4f below increment %s",
                            leg.kind(), raw.doubleValue(), increment.toPlainString());
        return drop(leg, code, note);
    }

    private static DroppedLeg drop(Estimate leg, ReasonCode code, String note) {
        return new DroppedLeg(leg.kind(), leg.involvedRunners(), RejectionReason.of(code, note));
    }
}

package com.raceplatform.common.staking;

import com.raceplatform.common.model.DroppedLeg;
import com.raceplatform.common.model.Ticket;

import java.math.BigDecimal;
import java.util.List;

/**
 * Output of {@link StakingAllocator#allocate}: committed tickets (SP first) and the legs that
 * did not survive sizing.
 */
public record AllocationResult(List<Ticket> tickets, List<DroppedLeg> droppedLegs) {

    public AllocationResult {
        tickets     = List.copyOf(tickets);
        droppedLegs = List.copyOf(droppedLegs);
    }

    public BigDecimal totalStake() {
        return tickets.stream().map(Ticket::stake).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isEmpty() {
        return tickets.isEmpty();
    }
}

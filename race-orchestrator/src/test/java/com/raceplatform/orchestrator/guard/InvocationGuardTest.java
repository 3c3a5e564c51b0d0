package com.raceplatform.orchestrator.guard;

import com.raceplatform.common.model.Phase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InvocationGuardTest {

    private final InvocationGuard guard = new InvocationGuard();

    @Test
    void oneSlotPerMeetingRaceAndPhase() {
        assertTrue(guard.tryAcquire("M1", "R1", Phase.H5));
        assertFalse(guard.tryAcquire("M1", "R1", Phase.H5));
        assertTrue(guard.tryAcquire("M1", "R1", Phase.H30));
        assertTrue(guard.tryAcquire("M1", "R2", Phase.H5));
        assertTrue(guard.tryAcquire("M2", "R1", Phase.H5));
    }

    @Test
    void releaseFreesTheSlot() {
        guard.tryAcquire("M1", "R1", Phase.H5);
        guard.release("M1", "R1", Phase.H5);

        assertFalse(guard.isRunning("M1", "R1", Phase.H5));
        assertTrue(guard.tryAcquire("M1", "R1", Phase.H5));
    }
}

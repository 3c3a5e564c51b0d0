package com.raceplatform.orchestrator.guard;

import com.raceplatform.common.model.Phase;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one in-flight invocation per (meeting, race, phase). Different races, or different
 * phases of the same race, run concurrently.
 */
@Component
public class InvocationGuard {

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    /** @return false when the slot is already taken */
    public boolean tryAcquire(String meetingId, String raceId, Phase phase) {
        return running.add(key(meetingId, raceId, phase));
    }

    public void release(String meetingId, String raceId, Phase phase) {
        running.remove(key(meetingId, raceId, phase));
    }

    public boolean isRunning(String meetingId, String raceId, Phase phase) {
        return running.contains(key(meetingId, raceId, phase));
    }

    private static String key(String meetingId, String raceId, Phase phase) {
        return meetingId + "|" + raceId + "|" + phase;
    }
}

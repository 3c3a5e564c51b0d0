package com.raceplatform.orchestrator.ledger;

import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.DecisionArtifact;
import com.raceplatform.common.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest artifact per (meeting, race, phase). H5 reads the H30 entry for the no-regression
 * rule and RESULT reads the H5 entry to reconcile. Entries are replaced, never edited.
 *
 * <p>Holds at most {@code ledger.max-entries} entries; the least recently written one is
 * evicted first. A race day is a few hundred entries, so eviction only touches past meetings.
 */
@Component
public class DecisionLedger {

    private static final Logger log = LoggerFactory.getLogger(DecisionLedger.class);

    private final int maxEntries;
    private final Map<String, DecisionArtifact> latest;

    public DecisionLedger(@Value("${ledger.max-entries}") int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("ledger.max-entries must be >= 1, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.latest = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DecisionArtifact> eldest) {
                boolean evict = size() > DecisionLedger.this.maxEntries;
                if (evict) {
                    log.info("[DecisionLedger] evicted. key={} decisionKey={}",
                        eldest.getKey(), eldest.getValue().decision().decisionKey());
                }
                return evict;
            }
        };
    }

    /**
     * Stores {@code artifact} as the latest for its meeting, race and phase.
     *
     * @return false when the stored artifact already carries the same decision key
     */
    public synchronized boolean record(DecisionArtifact artifact) {
        Decision decision = artifact.decision();
        String key = key(decision.meetingId(), decision.raceId(), decision.phase());
        DecisionArtifact previous = latest.remove(key);
        latest.put(key, artifact);
        boolean changed = previous == null
            || !previous.decision().decisionKey().equals(decision.decisionKey());
        if (!changed) {
            log.info("[DecisionLedger] unchanged decision. meeting={} race={} phase={} key={}",
                decision.meetingId(), decision.raceId(), decision.phase(), decision.decisionKey());
        }
        return changed;
    }

    public synchronized Optional<DecisionArtifact> artifact(String meetingId, String raceId, Phase phase) {
        return Optional.ofNullable(latest.get(key(meetingId, raceId, phase)));
    }

    public Optional<Decision> decision(String meetingId, String raceId, Phase phase) {
        return artifact(meetingId, raceId, phase).map(DecisionArtifact::decision);
    }

    public synchronized int size() {
        return latest.size();
    }

    private static String key(String meetingId, String raceId, Phase phase) {
        return meetingId + "|" + raceId + "|" + phase;
    }
}

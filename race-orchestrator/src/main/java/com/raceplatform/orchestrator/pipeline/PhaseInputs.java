package com.raceplatform.orchestrator.pipeline;

import com.raceplatform.common.estimate.PayoutModel;
import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.Enrichment;
import com.raceplatform.common.model.OfficialResult;
import com.raceplatform.common.model.RaceSnapshot;

import java.time.Instant;

/**
 * Everything one phase invocation needs, fetched before the engine runs. A {@code null}
 * component is an input that could not be obtained; the engine abstains on it rather than
 * substituting a default.
 *
 * @param meetingId      meeting identifier
 * @param raceId         race identifier
 * @param asOf           evaluation instant for freshness checks
 * @param snapshot       snapshot captured for the phase being run (H30 or H5)
 * @param h30Snapshot    H30 snapshot, used at H5 for the drift report
 * @param payoutModel    calibrated probability and payout model
 * @param enrichment     jockey/trainer/chrono data (H5)
 * @param priorH30       H30 decision recorded for this race, if any
 * @param priorH5        H5 decision recorded for this race, if any (RESULT)
 * @param officialResult official arrival (RESULT)
 */
public record PhaseInputs(
    String meetingId,
    String raceId,
    Instant asOf,
    RaceSnapshot snapshot,
    RaceSnapshot h30Snapshot,
    PayoutModel payoutModel,
    Enrichment enrichment,
    Decision priorH30,
    Decision priorH5,
    OfficialResult officialResult
) {
    public static PhaseInputs h30(String meetingId, String raceId, Instant asOf,
                                  RaceSnapshot snapshot, PayoutModel payoutModel) {
        return new PhaseInputs(meetingId, raceId, asOf, snapshot, null, payoutModel, null, null, null, null);
    }

    public static PhaseInputs h5(String meetingId, String raceId, Instant asOf, RaceSnapshot snapshot,
                                 RaceSnapshot h30Snapshot, PayoutModel payoutModel, Enrichment enrichment,
                                 Decision priorH30) {
        return new PhaseInputs(meetingId, raceId, asOf, snapshot, h30Snapshot, payoutModel, enrichment,
                               priorH30, null, null);
    }

    public static PhaseInputs result(String meetingId, String raceId, Instant asOf, Decision priorH5,
                                     OfficialResult officialResult) {
        return new PhaseInputs(meetingId, raceId, asOf, null, null, null, null, null, priorH5, officialResult);
    }
}

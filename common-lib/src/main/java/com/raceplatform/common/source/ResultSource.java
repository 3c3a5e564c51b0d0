package com.raceplatform.common.source;

import com.raceplatform.common.model.OfficialResult;
import reactor.core.publisher.Mono;

/**
 * Official arrivals and dividends, consumed by the RESULT phase. Empty until published.
 */
public interface ResultSource {

    Mono<OfficialResult> fetch(String meetingId, String raceId);
}

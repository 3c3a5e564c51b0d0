package com.raceplatform.orchestrator.adapter;

import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.estimate.CalibrationSnapshot;
import com.raceplatform.common.estimate.ParimutuelPayoutModel;
import com.raceplatform.common.estimate.PayoutModel;
import com.raceplatform.common.source.CalibrationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Fetches the calibration curve of a race and wraps it in a {@link ParimutuelPayoutModel}
 * simulated with the configured iterations and seed.
 */
@Component
public class WebClientCalibrationSource implements CalibrationSource {

    private static final Logger log = LoggerFactory.getLogger(WebClientCalibrationSource.class);

    private final WebClient calibrationClient;
    private final GpiConfig gpiConfig;

    public WebClientCalibrationSource(WebClient calibrationClient, GpiConfig gpiConfig) {
        this.calibrationClient = calibrationClient;
        this.gpiConfig         = gpiConfig;
    }

    @Override
    public Mono<PayoutModel> fetch(String meetingId, String raceId) {
        return calibrationClient.get()
            .uri("/api/v1/calibration/{meetingId}/{raceId}", meetingId, raceId)
            .retrieve()
            .bodyToMono(CalibrationSnapshot.class)
            .doOnNext(c -> log.debug("[CalibrationSource] fetched. race={} runners={} calibratedAt={}",
                raceId, c.winProbabilities().size(), c.calibratedAt()))
            .<PayoutModel>map(c -> new ParimutuelPayoutModel(
                c, gpiConfig.comboSimulationIterations(), gpiConfig.comboSimulationSeed()))
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }
}

package com.raceplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raceplatform.common.config.GpiConfig;
import com.raceplatform.common.estimate.Estimator;
import com.raceplatform.common.estimate.EvRoiEstimator;
import com.raceplatform.common.model.ExoticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${services.snapshot.base-url}")
    private String snapshotUrl;

    @Value("${services.calibration.base-url}")
    private String calibrationUrl;

    @Value("${services.enrichment.base-url}")
    private String enrichmentUrl;

    @Value("${services.results.base-url}")
    private String resultsUrl;

    @Value("${services.tracking.base-url}")
    private String trackingUrl;

    @Bean
    public WebClient snapshotClient(WebClient.Builder builder) {
        return builder.baseUrl(snapshotUrl).build();
    }

    @Bean
    public WebClient calibrationClient(WebClient.Builder builder) {
        return builder.baseUrl(calibrationUrl).build();
    }

    @Bean
    public WebClient enrichmentClient(WebClient.Builder builder) {
        return builder.baseUrl(enrichmentUrl).build();
    }

    @Bean
    public WebClient resultsClient(WebClient.Builder builder) {
        return builder.baseUrl(resultsUrl).build();
    }

    @Bean
    public WebClient trackingClient(WebClient.Builder builder) {
        return builder.baseUrl(trackingUrl).build();
    }

    /**
     * GPI thresholds. Every placeholder is mandatory: a missing {@code gpi.*} property fails
     * startup, and a malformed value fails {@link GpiConfig#validate()}.
     */
    @Bean
    public GpiConfig gpiConfig(
            @Value("${gpi.budget}") double budget,
            @Value("${gpi.kelly-fraction}") double kellyFraction,
            @Value("${gpi.exposure-cap-fraction}") double exposureCapFraction,
            @Value("${gpi.overround-ceiling}") double overroundCeiling,
            @Value("${gpi.overround-ceiling-handicap}") double overroundCeilingHandicap,
            @Value("${gpi.handicap-min-starters}") int handicapMinStarters,
            @Value("${gpi.ev-min-sp}") double evMinSp,
            @Value("${gpi.roi-min-sp}") double roiMinSp,
            @Value("${gpi.sp-max-probability}") double spMaxProbability,
            @Value("${gpi.ev-min-combo}") double evMinCombo,
            @Value("${gpi.roi-min-combo}") double roiMinCombo,
            @Value("${gpi.min-payout}") double minPayout,
            @Value("${gpi.ev-min-global}") double evMinGlobal,
            @Value("${gpi.min-stake-increment}") double minStakeIncrement,
            @Value("${gpi.max-tickets-per-race}") int maxTicketsPerRace,
            @Value("${gpi.freshness-max-age-seconds}") long freshnessMaxAgeSeconds,
            @Value("${gpi.allowed-exotics}") List<ExoticType> allowedExotics,
            @Value("${gpi.overround-ceiling-exotics}") double overroundCeilingExotics,
            @Value("${gpi.combo-pool-size}") int comboPoolSize,
            @Value("${gpi.combo-reference-stake}") double comboReferenceStake,
            @Value("${gpi.combo-simulation-iterations}") int comboSimulationIterations,
            @Value("${gpi.combo-simulation-seed}") long comboSimulationSeed,
            @Value("${gpi.roi-payout-haircut}") double roiPayoutHaircut,
            @Value("${gpi.drift-threshold}") double driftThreshold) {
        GpiConfig config = new GpiConfig(budget, kellyFraction, exposureCapFraction, overroundCeiling,
            overroundCeilingHandicap, handicapMinStarters, evMinSp, roiMinSp, spMaxProbability, evMinCombo,
            roiMinCombo, minPayout, evMinGlobal, minStakeIncrement, maxTicketsPerRace, freshnessMaxAgeSeconds,
            allowedExotics, overroundCeilingExotics, comboPoolSize, comboReferenceStake, comboSimulationIterations, comboSimulationSeed,
            roiPayoutHaircut, driftThreshold).validate();
        log.info("[GpiConfig] loaded. budget={} kelly={} exposureCap={} ceilings={}/{} maxTickets={} freshness={}s exotics={}",
            budget, kellyFraction, exposureCapFraction, overroundCeiling, overroundCeilingHandicap,
            maxTicketsPerRace, freshnessMaxAgeSeconds, config.allowedExotics());
        return config;
    }

    @Bean
    public Estimator estimator() {
        return new EvRoiEstimator();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}

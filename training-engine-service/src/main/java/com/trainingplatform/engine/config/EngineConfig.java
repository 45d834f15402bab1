package com.trainingplatform.engine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trainingplatform.common.suggestion.SuggestionEngine;
import com.trainingplatform.common.suggestion.SuggestionSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class EngineConfig {

    @Value("${training.engine.zone:Europe/Stockholm}")
    private String zone;

    @Value("${training.engine.long-run-threshold-km:15.0}")
    private double longRunThresholdKm;

    @Value("${training.engine.favorite-distance-tolerance-km:1.0}")
    private double favoriteDistanceToleranceKm;

    @Value("${training.engine.challenge-suggestions.enabled:false}")
    private boolean challengeEnabled;

    /** "Today" for requests that omit a date. */
    @Bean
    public Clock engineClock() {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public SuggestionSettings suggestionSettings() {
        return new SuggestionSettings(longRunThresholdKm, favoriteDistanceToleranceKm, challengeEnabled);
    }

    @Bean
    public SuggestionEngine suggestionEngine(SuggestionSettings settings) {
        return new SuggestionEngine(settings, SuggestionEngine.threadLocalRandom());
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}

package com.trainingplatform.engine.service;

import com.trainingplatform.common.exception.TrainingEngineException;
import com.trainingplatform.common.performance.CalorieEstimator;
import com.trainingplatform.common.performance.CalorieParams;
import com.trainingplatform.common.performance.PaceZones;
import com.trainingplatform.common.performance.PerformanceFormatter;
import com.trainingplatform.common.performance.PerformanceModel;
import com.trainingplatform.common.performance.StandardDistance;
import com.trainingplatform.engine.dto.CalorieCommand;
import com.trainingplatform.engine.dto.CalorieEstimate;
import com.trainingplatform.engine.dto.RaceAnalysis;
import com.trainingplatform.engine.dto.RaceCommand;
import com.trainingplatform.engine.dto.RacePrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class PerformanceService {

    private static final Logger log = LoggerFactory.getLogger(PerformanceService.class);

    public Mono<RaceAnalysis> analyzeRace(RaceCommand command) {
        if (command.targetDistanceKm() != null && !(command.targetDistanceKm() > 0)) {
            return Mono.error(new TrainingEngineException("PerformanceModel", "riegelPredict",
                "targetDistanceKm", "targetDistanceKm must be positive when given"));
        }
        log.info("Analyzing race distanceKm={} timeSeconds={} targetDistanceKm={}",
            command.distanceKm(), command.timeSeconds(), command.targetDistanceKm());
        return Mono.fromCallable(() -> buildAnalysis(command))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(a -> log.info("Race analysis complete fitnessScore={}", a.fitnessScore()));
    }

    public Mono<CalorieEstimate> estimateCalories(CalorieCommand command) {
        if (command.activityType() == null || command.activityType().isBlank()) {
            return Mono.error(TrainingEngineException.missing("CalorieEstimator", "estimateCalories", "activityType"));
        }
        return Mono.fromCallable(() -> new CalorieEstimate(command.activityType(),
                CalorieEstimator.estimateCalories(command.activityType(), command.durationSeconds(),
                    command.params() == null ? CalorieParams.NONE : command.params())))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(e -> log.info("Calorie estimate activityType={} kcal={}", e.activityType(), e.kcal()));
    }

    static RaceAnalysis buildAnalysis(RaceCommand command) {
        double score = PerformanceModel.fitnessScore(command.distanceKm(), command.timeSeconds());
        PaceZones zones = PerformanceModel.paceZones(score);

        Map<String, String> formatted = new LinkedHashMap<>();
        formatted.put("easy", PerformanceFormatter.formatPace(zones.easy()));
        formatted.put("marathon", PerformanceFormatter.formatPace(zones.marathon()));
        formatted.put("threshold", PerformanceFormatter.formatPace(zones.threshold()));
        formatted.put("interval", PerformanceFormatter.formatPace(zones.interval()));
        formatted.put("repetition", PerformanceFormatter.formatPace(zones.repetition()));

        List<RacePrediction> predictions = Arrays.stream(StandardDistance.values())
            .map(d -> prediction(d.name(), d.km(), PerformanceModel.predictRaceTime(score, d.km())))
            .toList();

        RacePrediction riegel = null;
        if (command.targetDistanceKm() != null) {
            double target = command.targetDistanceKm();
            riegel = prediction(String.format(Locale.ROOT, "%.2f km", target), target,
                PerformanceModel.riegelPredict(command.timeSeconds(), command.distanceKm(), target));
        }
        return new RaceAnalysis(score, zones, formatted, predictions, riegel);
    }

    private static RacePrediction prediction(String label, double km, double seconds) {
        return new RacePrediction(label, km, seconds, PerformanceFormatter.formatSeconds(seconds));
    }
}

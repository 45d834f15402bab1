package com.trainingplatform.engine.service;

import com.trainingplatform.common.interference.InterferenceDetector;
import com.trainingplatform.common.load.LoadAdherenceAnalyzer;
import com.trainingplatform.common.load.WeeklyLoadReport;
import com.trainingplatform.common.model.ConflictWarning;
import com.trainingplatform.common.suggestion.SuggestionEngine;
import com.trainingplatform.common.suggestion.SuggestionReport;
import com.trainingplatform.common.suggestion.SuggestionRequest;
import com.trainingplatform.engine.dto.InterferenceCommand;
import com.trainingplatform.engine.dto.SuggestionCommand;
import com.trainingplatform.engine.dto.WeeklyReportCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Bridges HTTP requests to the engines in {@code common-lib}. Engine calls are
 * CPU-bound and synchronous, so they run on the bounded-elastic scheduler.
 */
@Service
public class TrainingIntelligenceService {

    private static final Logger log = LoggerFactory.getLogger(TrainingIntelligenceService.class);

    private final SuggestionEngine suggestionEngine;
    private final Clock clock;

    public TrainingIntelligenceService(SuggestionEngine suggestionEngine, Clock clock) {
        this.suggestionEngine = suggestionEngine;
        this.clock = clock;
    }

    public Mono<SuggestionReport> suggest(SuggestionCommand command) {
        LocalDate targetDate = command.targetDate() != null ? command.targetDate() : LocalDate.now(clock);
        log.info("Generating suggestions targetDate={} historySize={} goals={}",
            targetDate, sizeOf(command.history()), sizeOf(command.goals()));
        SuggestionRequest request = new SuggestionRequest(command.history(), command.planned(), targetDate,
            command.goals(), command.forecast(), command.preferences());
        return Mono.fromCallable(() -> suggestionEngine.generate(request))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(report -> log.info("Suggestions ready targetDate={} count={} diagnostics={}",
                targetDate, report.suggestions().size(), report.diagnostics().size()))
            .doOnError(e -> log.error("Suggestion generation failed targetDate={}", targetDate, e));
    }

    public Mono<List<ConflictWarning>> interference(InterferenceCommand command) {
        log.info("Analyzing interference activities={} planned={}",
            sizeOf(command.activities()), sizeOf(command.planned()));
        return Mono.fromCallable(() -> InterferenceDetector.analyze(command.activities(), command.planned()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(warnings -> log.info("Interference analysis complete warnings={}", warnings.size()))
            .doOnError(e -> log.error("Interference analysis failed", e));
    }

    public Mono<WeeklyLoadReport> weeklyReport(WeeklyReportCommand command) {
        LocalDate today = LocalDate.now(clock);
        LocalDate weekDate = command.weekDate() != null ? command.weekDate() : today;
        LocalDate asOf = command.asOf() != null ? command.asOf() : today;
        log.info("Building weekly report weekDate={} asOf={} activities={} planned={}",
            weekDate, asOf, sizeOf(command.activities()), sizeOf(command.planned()));
        return Mono.fromCallable(() -> LoadAdherenceAnalyzer.analyze(weekDate, command.activities(),
                command.planned(), command.forecast(), command.preferences(), asOf))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(report -> log.info("Weekly report ready week={} adherence={} trend={}",
                report.week().start(), report.adherence().adherencePercent(), report.volumeTrend().status()))
            .doOnError(e -> log.error("Weekly report failed weekDate={}", weekDate, e));
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}

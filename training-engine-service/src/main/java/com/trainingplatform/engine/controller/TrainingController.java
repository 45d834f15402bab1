package com.trainingplatform.engine.controller;

import com.trainingplatform.common.load.WeeklyLoadReport;
import com.trainingplatform.common.model.ConflictWarning;
import com.trainingplatform.common.suggestion.SuggestionReport;
import com.trainingplatform.engine.dto.InterferenceCommand;
import com.trainingplatform.engine.dto.SuggestionCommand;
import com.trainingplatform.engine.dto.WeeklyReportCommand;
import com.trainingplatform.engine.service.TrainingIntelligenceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/training")
public class TrainingController {

    private final TrainingIntelligenceService trainingService;

    public TrainingController(TrainingIntelligenceService trainingService) {
        this.trainingService = trainingService;
    }

    @PostMapping("/suggestions")
    public Mono<ResponseEntity<SuggestionReport>> suggestions(@RequestBody SuggestionCommand command) {
        return trainingService.suggest(command).map(ResponseEntity::ok);
    }

    @PostMapping("/interference")
    public Mono<ResponseEntity<List<ConflictWarning>>> interference(@RequestBody InterferenceCommand command) {
        return trainingService.interference(command).map(ResponseEntity::ok);
    }

    @PostMapping("/weekly-report")
    public Mono<ResponseEntity<WeeklyLoadReport>> weeklyReport(@RequestBody WeeklyReportCommand command) {
        return trainingService.weeklyReport(command).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}

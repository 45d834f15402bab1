package com.trainingplatform.engine.controller;

import com.trainingplatform.engine.dto.CalorieCommand;
import com.trainingplatform.engine.dto.CalorieEstimate;
import com.trainingplatform.engine.dto.RaceAnalysis;
import com.trainingplatform.engine.dto.RaceCommand;
import com.trainingplatform.engine.service.PerformanceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/performance")
public class PerformanceController {

    private final PerformanceService performanceService;

    public PerformanceController(PerformanceService performanceService) {
        this.performanceService = performanceService;
    }

    @PostMapping("/race")
    public Mono<ResponseEntity<RaceAnalysis>> race(@RequestBody RaceCommand command) {
        return performanceService.analyzeRace(command).map(ResponseEntity::ok);
    }

    @PostMapping("/calories")
    public Mono<ResponseEntity<CalorieEstimate>> calories(@RequestBody CalorieCommand command) {
        return performanceService.estimateCalories(command).map(ResponseEntity::ok);
    }
}

package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

public record ConflictWarning(
    @JsonProperty("id")                  String id,
    @JsonProperty("date")                LocalDate date,
    @JsonProperty("type")                ConflictType type,
    @JsonProperty("riskLevel")           RiskLevel riskLevel,
    @JsonProperty("message")             String message,
    @JsonProperty("explanation")         String explanation,
    @JsonProperty("involvedActivityIds") List<String> involvedActivityIds,
    @JsonProperty("suggestion")          String suggestion
) {}

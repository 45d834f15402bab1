package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.PlannedActivity;

import java.util.List;

public record InterferenceCommand(
    @JsonProperty("activities") List<ActivityRecord> activities,
    @JsonProperty("planned")    List<PlannedActivity> planned
) {}

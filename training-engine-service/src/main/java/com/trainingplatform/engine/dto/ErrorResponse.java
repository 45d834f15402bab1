package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error")     String error,
    @JsonProperty("component") String component,
    @JsonProperty("operation") String operation,
    @JsonProperty("field")     String field,
    @JsonProperty("message")   String message
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, null, null, null, message);
    }
}

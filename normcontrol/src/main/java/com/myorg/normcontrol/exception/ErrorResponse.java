package com.myorg.normcontrol.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.time.ZonedDateTime;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final ZonedDateTime timestamp;
    private final int status;
    private final String error;
    @JsonProperty("error_kind")
    private final String errorKind;
    private final String message;
    // set for collaborator failures
    private final String collaborator;
    private final String path;
}

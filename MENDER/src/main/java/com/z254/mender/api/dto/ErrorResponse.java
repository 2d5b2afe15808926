package com.z254.mender.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Uniform error body for API failures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /** Stable code for programmatic handling */
    private String errorCode;

    private String message;

    private int status;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String path;

    /** Validation failures (400 only) */
    private List<String> violations;
}

package com.z254.mender.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Provider-neutral incident record produced by the webhook adapters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedIncident {

    /** Provider-assigned id; generated when absent */
    private String id;

    @NotBlank
    private String serviceName;

    @NotBlank
    private String errorMessage;

    private String stackTrace;

    private String severity;

    @NotBlank
    private String provider;

    @Builder.Default
    private Map<String, Object> providerData = new HashMap<>();
}

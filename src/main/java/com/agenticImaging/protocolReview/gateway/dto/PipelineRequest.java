package com.agenticImaging.protocolReview.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for a pipeline run: the raw patient record, keys in any supported spelling.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRequest {
    
    @NotNull(message = "sample_patient is required")
    @JsonProperty("sample_patient")
    private Map<String, Object> samplePatient;
}

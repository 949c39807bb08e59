package com.agenticImaging.protocolReview.fhir.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * FHIR R4 Bundle of type collection, as produced by the export step.
 * Only the envelope is validated; entry resources stay free-form.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class FhirBundle {
    
    @NotNull
    @Pattern(regexp = "Bundle", message = "resourceType must be Bundle")
    @Builder.Default
    @JsonProperty("resourceType")
    private String resourceType = "Bundle";
    
    @NotNull
    @Builder.Default
    @JsonProperty("type")
    private String type = "collection";
    
    @NotEmpty(message = "bundle must contain at least one entry")
    @JsonProperty("entry")
    private List<@Valid BundleEntry> entry;
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BundleEntry {
        
        @NotNull(message = "entry resource is required")
        @JsonProperty("resource")
        private Map<String, Object> resource;
    }
}

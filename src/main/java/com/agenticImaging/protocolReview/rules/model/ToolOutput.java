package com.agenticImaging.protocolReview.rules.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Output of a rule-evaluation tool: the checks it ran plus a summary risk level.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ToolOutput {
    
    @JsonProperty("tool")
    String tool;
    
    /**
     * low, moderate, high or unknown.
     */
    @JsonProperty("risk_level")
    String riskLevel;
    
    @Singular
    @JsonProperty("checks")
    List<RuleCheck> checks;
    
    @JsonProperty("summary")
    String summary;
    
    /**
     * Rebuilds this output without the checks that are both optional and missing.
     * Those carry no signal for a reviewer and are never shown downstream.
     * 
     * @return Filtered copy
     */
    public ToolOutput withoutOptionalMissing() {
        List<RuleCheck> kept = checks.stream()
                .filter(check -> !check.isOptionalAndMissing())
                .collect(Collectors.toList());
        return toBuilder().clearChecks().checks(kept).build();
    }
}

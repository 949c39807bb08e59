package com.agenticImaging.protocolReview.rules.service;

import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;

/**
 * Deterministic rule evaluation over a normalized patient record.
 */
public interface RuleEvaluator {
    
    /**
     * @return Key under which this tool's output is reported (e.g. "renal")
     */
    String toolName();
    
    ToolOutput evaluate(PatientRecord record);
}

package com.agenticImaging.protocolReview.rules.service;

import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import com.agenticImaging.protocolReview.rules.model.CheckPriority;
import com.agenticImaging.protocolReview.rules.model.CheckStatus;
import com.agenticImaging.protocolReview.rules.model.RuleCheck;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.BUN;
import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.CREATININE;
import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.EGFR;
import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.POTASSIUM;

/**
 * Contrast-safety checks on renal markers.
 * 
 * eGFR and creatinine are required; potassium and BUN are optional. A check is "missing" when the
 * field is absent or not numeric, "flagged" when outside the safe range, otherwise "ok".
 */
@Slf4j
@Service
public class RenalRuleEvaluator implements RuleEvaluator {
    
    public static final String TOOL_NAME = "renal";
    
    static final double EGFR_SEVERE = 30.0;
    static final double EGFR_MODERATE = 45.0;
    static final double CREATININE_MAX = 1.5;
    static final double POTASSIUM_MIN = 3.5;
    static final double POTASSIUM_MAX = 5.5;
    static final double BUN_MAX = 20.0;
    
    @Override
    public String toolName() {
        return TOOL_NAME;
    }
    
    @Override
    public ToolOutput evaluate(PatientRecord record) {
        Double egfr = record.numeric(EGFR);
        Double creatinine = record.numeric(CREATININE);
        
        List<RuleCheck> checks = new ArrayList<>();
        checks.add(check("egfr", EGFR, egfr, CheckPriority.REQUIRED,
                egfr != null && egfr < EGFR_SEVERE,
                "eGFR below " + EGFR_SEVERE + " mL/min/1.73m2: iodinated contrast contraindicated without nephrology review"));
        checks.add(check("creatinine", CREATININE, creatinine, CheckPriority.REQUIRED,
                creatinine != null && creatinine > CREATININE_MAX,
                "Serum creatinine above " + CREATININE_MAX + " mg/dL"));
        
        Double potassium = record.numeric(POTASSIUM);
        checks.add(check("potassium", POTASSIUM, potassium, CheckPriority.OPTIONAL,
                potassium != null && (potassium < POTASSIUM_MIN || potassium > POTASSIUM_MAX),
                "Potassium outside " + POTASSIUM_MIN + "-" + POTASSIUM_MAX + " mmol/L"));
        
        Double bun = record.numeric(BUN);
        checks.add(check("bun", BUN, bun, CheckPriority.OPTIONAL,
                bun != null && bun > BUN_MAX,
                "BUN above " + BUN_MAX + " mg/dL"));
        
        String riskLevel = riskLevel(egfr, creatinine);
        long flagged = checks.stream().filter(c -> c.getStatus() == CheckStatus.FLAGGED).count();
        
        log.debug("Renal evaluation completed - riskLevel: {}, flagged: {}", riskLevel, flagged);
        
        return ToolOutput.builder()
                .tool(TOOL_NAME)
                .riskLevel(riskLevel)
                .checks(checks)
                .summary(String.format("Renal contrast risk %s, %d of %d checks flagged", riskLevel, flagged, checks.size()))
                .build();
    }
    
    private RuleCheck check(String name, String field, Double value, CheckPriority priority,
                            boolean outOfRange, String flaggedMessage) {
        CheckStatus status;
        String message;
        if (value == null) {
            status = CheckStatus.MISSING;
            message = field + " not available";
        } else if (outOfRange) {
            status = CheckStatus.FLAGGED;
            message = flaggedMessage;
        } else {
            status = CheckStatus.OK;
            message = field + " within range";
        }
        return RuleCheck.builder()
                .name(name)
                .field(field)
                .status(status)
                .priority(priority)
                .value(value)
                .message(message)
                .build();
    }
    
    private String riskLevel(Double egfr, Double creatinine) {
        if (egfr == null) {
            return creatinine != null && creatinine > CREATININE_MAX ? "moderate" : "unknown";
        }
        if (egfr < EGFR_SEVERE) {
            return "high";
        }
        if (egfr < EGFR_MODERATE || (creatinine != null && creatinine > CREATININE_MAX)) {
            return "moderate";
        }
        return "low";
    }
}

package com.agenticImaging.protocolReview.rules.service;

import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import com.agenticImaging.protocolReview.rules.model.CheckPriority;
import com.agenticImaging.protocolReview.rules.model.CheckStatus;
import com.agenticImaging.protocolReview.rules.model.RuleCheck;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RenalRuleEvaluatorTest {
    
    private final RenalRuleEvaluator evaluator = new RenalRuleEvaluator();
    
    private static RuleCheck check(ToolOutput output, String name) {
        return output.getChecks().stream()
                .filter(c -> c.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }
    
    @Test
    void severeRenalImpairmentIsHighRisk() {
        ToolOutput output = evaluator.evaluate(PatientRecord.of(Map.of(
                "egfr_ckd_epi", 24, "creatinine_mg_dl", 2.4, "potassium_mmol_l", 5.9, "bun_mg_dl", 31)));
        
        assertThat(output.getTool()).isEqualTo("renal");
        assertThat(output.getRiskLevel()).isEqualTo("high");
        assertThat(output.getChecks()).extracting(RuleCheck::getStatus).containsOnly(CheckStatus.FLAGGED);
        assertThat(output.getSummary()).contains("4 of 4");
    }
    
    @Test
    void normalValuesAreLowRisk() {
        ToolOutput output = evaluator.evaluate(PatientRecord.of(Map.of(
                "egfr_ckd_epi", 92, "creatinine_mg_dl", 0.9, "potassium_mmol_l", 4.2, "bun_mg_dl", 14)));
        
        assertThat(output.getRiskLevel()).isEqualTo("low");
        assertThat(output.getChecks()).extracting(RuleCheck::getStatus).containsOnly(CheckStatus.OK);
    }
    
    @Test
    void elevatedCreatinineAloneIsModerate() {
        ToolOutput output = evaluator.evaluate(PatientRecord.of(Map.of("egfr_ckd_epi", 60, "creatinine_mg_dl", "1.8")));
        
        assertThat(output.getRiskLevel()).isEqualTo("moderate");
        assertThat(check(output, "creatinine").getValue()).isEqualTo(1.8);
    }
    
    @Test
    void boundaryValuesAreNotFlagged() {
        ToolOutput output = evaluator.evaluate(PatientRecord.of(Map.of(
                "egfr_ckd_epi", 30, "creatinine_mg_dl", 1.5, "potassium_mmol_l", 3.5, "bun_mg_dl", 20)));
        
        assertThat(output.getChecks()).extracting(RuleCheck::getStatus).containsOnly(CheckStatus.OK);
        assertThat(output.getRiskLevel()).isEqualTo("moderate");
    }
    
    @Test
    @DisplayName("absent or non-numeric fields are reported missing and risk is unknown")
    void missingFields() {
        ToolOutput output = evaluator.evaluate(PatientRecord.of(Map.of("egfr_ckd_epi", "pending")));
        
        assertThat(output.getRiskLevel()).isEqualTo("unknown");
        assertThat(output.getChecks()).extracting(RuleCheck::getStatus).containsOnly(CheckStatus.MISSING);
        assertThat(check(output, "egfr").getPriority()).isEqualTo(CheckPriority.REQUIRED);
        assertThat(check(output, "bun").getPriority()).isEqualTo(CheckPriority.OPTIONAL);
    }
    
    @Test
    void filteringDropsOnlyOptionalMissingChecks() {
        ToolOutput filtered = evaluator.evaluate(PatientRecord.of(Map.of("potassium_mmol_l", 4.0)))
                .withoutOptionalMissing();
        
        assertThat(filtered.getChecks()).extracting(RuleCheck::getName)
                .containsExactly("egfr", "creatinine", "potassium");
        assertThat(filtered.getChecks()).noneMatch(RuleCheck::isOptionalAndMissing);
        assertThat(filtered.getRiskLevel()).isEqualTo("unknown");
    }
}

package com.agenticImaging.protocolReview.plausibility.service;

import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import com.agenticImaging.protocolReview.plausibility.model.HallucinationAnalysis;
import com.agenticImaging.protocolReview.plausibility.model.StatementAssessment;
import com.agenticImaging.protocolReview.plausibility.model.Verdict;
import com.agenticImaging.protocolReview.review.model.ReviewFeedback;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.BMI;
import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.BUN;
import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.CREATININE;
import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.EGFR;
import static com.agenticImaging.protocolReview.normalization.service.FieldNormalizer.POTASSIUM;

/**
 * Deterministic claim checker for review statements.
 * 
 * Looks for two kinds of claims about the canonical lab fields:
 * a number stated next to a field name ("eGFR 28"), and a statement that a field is missing.
 * A number that disagrees with the record, or a "missing" claim for a field the record has,
 * is contradicted and costs {@value #CONTRADICTED_PENALTY}. A number for a field the record does
 * not carry is unsupported and costs {@value #UNSUPPORTED_PENALTY}.
 */
@Slf4j
@Service
public class StatementPlausibilityAnalyzer implements PlausibilityAnalyzer {
    
    static final double CONTRADICTED_PENALTY = 0.1;
    static final double UNSUPPORTED_PENALTY = 0.05;
    
    private static final double ABSOLUTE_TOLERANCE = 0.1;
    private static final double RELATIVE_TOLERANCE = 0.05;
    
    private static final Map<String, Pattern> FIELD_MENTIONS = new LinkedHashMap<>();
    private static final Pattern MISSING_CLAIM = Pattern.compile(
            "\\b(missing|not available|unavailable|not provided|not reported)\\b", Pattern.CASE_INSENSITIVE);
    
    static {
        FIELD_MENTIONS.put(EGFR, mention("e?gfr|estimated glomerular filtration rate"));
        FIELD_MENTIONS.put(CREATININE, mention("creatinine|cr"));
        FIELD_MENTIONS.put(POTASSIUM, mention("potassium|k\\+?"));
        FIELD_MENTIONS.put(BUN, mention("bun|blood urea nitrogen"));
        FIELD_MENTIONS.put(BMI, mention("bmi|body mass index"));
    }
    
    /**
     * Field name followed, within a few non-digit characters, by an optional number.
     */
    private static Pattern mention(String names) {
        return Pattern.compile("\\b(?:" + names + ")(?![a-z])(?:[^0-9\\n.]{0,20}?(\\d+(?:\\.\\d+)?))?",
                Pattern.CASE_INSENSITIVE);
    }
    
    @Override
    public HallucinationAnalysis analyze(ReviewFeedback draft, PatientRecord record, Map<String, ToolOutput> toolOutputs) {
        List<String> statements = new ArrayList<>(draft.getIssues());
        statements.addAll(draft.getRecommendations());
        
        List<StatementAssessment> assessments = new ArrayList<>();
        for (String statement : statements) {
            if (statement == null || statement.isBlank()) {
                continue;
            }
            assessments.addAll(assessStatement(statement, record));
        }
        
        if (assessments.isEmpty()) {
            return HallucinationAnalysis.clean();
        }
        
        int contradicted = 0;
        int unsupported = 0;
        double reduction = 0.0;
        for (StatementAssessment assessment : assessments) {
            if (assessment.getVerdict() == Verdict.CONTRADICTED) {
                contradicted++;
            } else if (assessment.getVerdict() == Verdict.UNSUPPORTED) {
                unsupported++;
            }
            reduction += assessment.getPenalty();
        }
        reduction = Math.round(reduction * 100.0) / 100.0;
        
        log.debug("Plausibility analysis - claims: {}, contradicted: {}, unsupported: {}, reduction: {}, tools: {}",
                assessments.size(), contradicted, unsupported, reduction, toolOutputs.keySet());
        
        return HallucinationAnalysis.builder()
                .recommendation(HallucinationAnalysis.Recommendation.builder()
                        .confidenceReduction(reduction)
                        .contradicted(contradicted)
                        .unsupported(unsupported)
                        .summary(String.format("%d claims checked, %d contradicted, %d unsupported",
                                assessments.size(), contradicted, unsupported))
                        .build())
                .statements(assessments)
                .build();
    }
    
    private List<StatementAssessment> assessStatement(String statement, PatientRecord record) {
        List<StatementAssessment> assessments = new ArrayList<>();
        boolean claimsMissing = MISSING_CLAIM.matcher(statement).find();
        
        for (Map.Entry<String, Pattern> entry : FIELD_MENTIONS.entrySet()) {
            String field = entry.getKey();
            Matcher matcher = entry.getValue().matcher(statement);
            if (!matcher.find()) {
                continue;
            }
            Double recordValue = record.numeric(field);
            String number = matcher.group(1);
            
            if (number != null) {
                assessments.add(assessNumber(statement, field, Double.parseDouble(number), recordValue));
            } else if (claimsMissing && record.has(field)) {
                assessments.add(StatementAssessment.builder()
                        .statement(statement)
                        .field(field)
                        .recordValue(recordValue)
                        .verdict(Verdict.CONTRADICTED)
                        .penalty(CONTRADICTED_PENALTY)
                        .reason("Statement says " + field + " is missing but the record has it")
                        .build());
            }
        }
        return assessments;
    }
    
    private StatementAssessment assessNumber(String statement, String field, double claimed, Double recordValue) {
        StatementAssessment.StatementAssessmentBuilder builder = StatementAssessment.builder()
                .statement(statement)
                .field(field)
                .claimedValue(claimed)
                .recordValue(recordValue);
        
        if (recordValue == null) {
            return builder.verdict(Verdict.UNSUPPORTED)
                    .penalty(UNSUPPORTED_PENALTY)
                    .reason("Record has no value for " + field)
                    .build();
        }
        double tolerance = Math.max(ABSOLUTE_TOLERANCE, Math.abs(recordValue) * RELATIVE_TOLERANCE);
        if (Math.abs(claimed - recordValue) > tolerance) {
            return builder.verdict(Verdict.CONTRADICTED)
                    .penalty(CONTRADICTED_PENALTY)
                    .reason("Stated " + claimed + " but record has " + recordValue)
                    .build();
        }
        return builder.verdict(Verdict.SUPPORTED)
                .penalty(0.0)
                .reason("Matches record")
                .build();
    }
}

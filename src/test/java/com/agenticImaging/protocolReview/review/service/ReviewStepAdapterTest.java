package com.agenticImaging.protocolReview.review.service;

import com.agenticImaging.protocolReview.completion.exception.CompletionException;
import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.extraction.service.StructuredOutputExtractor;
import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.normalization.service.FieldNormalizer;
import com.agenticImaging.protocolReview.plausibility.service.StatementPlausibilityAnalyzer;
import com.agenticImaging.protocolReview.review.model.ReviewReport;
import com.agenticImaging.protocolReview.rules.model.RuleCheck;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;
import com.agenticImaging.protocolReview.rules.service.RenalRuleEvaluator;
import com.agenticImaging.protocolReview.util.JsonFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewStepAdapterTest {
    
    private static final String SCORING_MARKER = "evaluating the quality";
    
    @Mock
    private CompletionClient completionClient;
    
    private ReviewStepAdapter adapter;
    
    private final Map<String, Object> rawRecord = Map.of("eGFR", 28, "Serum_Creatinine", 1.7, "indication", "abdominal pain");
    private final CandidateOutput candidate = CandidateOutput.of(Map.of(
            "protocol_selection", "CT abdomen/pelvis with IV contrast",
            "recommendations", "Proceed"));
    
    @BeforeEach
    void setUp() {
        StructuredOutputExtractor extractor = new StructuredOutputExtractor();
        ConfidenceEvaluator confidenceEvaluator = new ConfidenceEvaluator(completionClient, extractor, new ObjectMapper());
        adapter = new ReviewStepAdapter(
                new FieldNormalizer(),
                new RenalRuleEvaluator(),
                confidenceEvaluator,
                completionClient,
                extractor,
                new StatementPlausibilityAnalyzer(),
                Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));
    }
    
    private void replies(String scoreReply, String reviewReply) {
        when(completionClient.complete(anyString(), any())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            return prompt.contains(SCORING_MARKER) ? scoreReply : reviewReply;
        });
    }
    
    @Test
    @DisplayName("well-formed review keeps reviewer confidence when claims match the record")
    void wellFormedReview() {
        replies("{\"candidate_confidence\": 0.35}", """
                {"issues": ["eGFR 28 contraindicates IV contrast"],
                 "recommendations": ["Switch to non-contrast CT"],
                 "confidence": 0.9}
                """);
        
        ReviewReport report = adapter.review(rawRecord, candidate);
        
        assertThat(report.getIssues()).containsExactly("eGFR 28 contraindicates IV contrast");
        assertThat(report.getRecommendations()).containsExactly("Switch to non-contrast CT");
        assertThat(report.getConfidence()).isEqualTo(0.9);
        assertThat(report.getCandidateConfidence()).isEqualTo(0.35);
        assertThat(report.getTimestamp()).isEqualTo("2026-03-01T10:15:30Z");
        assertThat(report.getHallucinationAnalysis().getConfidenceReduction()).isZero();
    }
    
    @Test
    void optionalMissingChecksNeverReachTheReviewer() {
        replies("{\"candidate_confidence\": 0.5}", "{\"issues\": [], \"recommendations\": [], \"confidence\": 0.8}");
        
        ReviewReport report = adapter.review(rawRecord, candidate);
        
        ToolOutput renal = report.getToolOutputs().get(RenalRuleEvaluator.TOOL_NAME);
        assertThat(renal.getChecks()).extracting(RuleCheck::getName).containsExactly("egfr", "creatinine");
        
        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(completionClient, times(2)).complete(prompts.capture(), any());
        assertThat(prompts.getAllValues()).allSatisfy(prompt -> assertThat(prompt)
                .contains(FieldNormalizer.EGFR)
                .doesNotContain(FieldNormalizer.BUN)
                .doesNotContain(FieldNormalizer.POTASSIUM));
    }
    
    @Test
    void contradictedClaimLowersConfidence() {
        replies("{\"candidate_confidence\": 0.6}",
                "{\"issues\": [\"Creatinine 3.2 is dangerously high\"], \"recommendations\": [], \"confidence\": 0.8}");
        
        ReviewReport report = adapter.review(rawRecord, candidate);
        
        assertThat(report.getConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(report.getHallucinationAnalysis().getRecommendation().getContradicted()).isEqualTo(1);
    }
    
    @Test
    @DisplayName("unparseable reviewer text degrades to default feedback")
    void malformedReviewerText() {
        replies("{\"candidate_confidence\": 0.6}", "The protocol looks mostly fine to me.");
        
        ReviewReport report = adapter.review(rawRecord, candidate);
        
        assertThat(report.getIssues()).isEmpty();
        assertThat(report.getRecommendations()).isEmpty();
        assertThat(report.getConfidence()).isEqualTo(0.5);
        assertThat(report.getRawResponse()).isEqualTo("The protocol looks mostly fine to me.");
    }
    
    @Test
    void scorerFailureLeavesCandidateConfidenceAbsent() {
        when(completionClient.complete(anyString(), any())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.contains(SCORING_MARKER)) {
                throw new CompletionException("rate limited");
            }
            return "{\"issues\": [], \"recommendations\": [\"Hydrate\"], \"confidence\": 0.77}";
        });
        
        ReviewReport report = adapter.review(rawRecord, candidate);
        
        assertThat(report.getCandidateConfidence()).isNull();
        assertThat(report.getConfidence()).isEqualTo(0.77);
    }
    
    @Test
    void reviewCallFailurePropagates() {
        when(completionClient.complete(anyString(), any())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.contains(SCORING_MARKER)) {
                return "{\"candidate_confidence\": 0.6}";
            }
            throw new CompletionException("connection reset");
        });
        
        assertThatThrownBy(() -> adapter.review(rawRecord, candidate))
                .isInstanceOf(CompletionException.class)
                .hasMessageContaining("connection reset");
    }
    
    @Test
    void reportSerializesWithFlatFeedbackFields() {
        replies("{\"candidate_confidence\": 0.6}", "{\"issues\": [\"x\"], \"recommendations\": [], \"confidence\": 0.8}");
        
        String json = JsonFiles.toPrettyJson(adapter.review(rawRecord, candidate));
        
        assertThat(json)
                .contains("\"issues\" : [ \"x\" ]")
                .contains("\"confidence\" : 0.8")
                .contains("\"candidate_confidence\" : 0.6")
                .contains("\"tool_outputs\"")
                .contains("\"hallucination_analysis\"");
    }
}

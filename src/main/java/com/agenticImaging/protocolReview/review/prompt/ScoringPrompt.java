package com.agenticImaging.protocolReview.review.prompt;

/**
 * Prompt asking a model to rate a candidate recommendation with a single number.
 */
public class ScoringPrompt {
    
    public static final String SCORE_KEY = "candidate_confidence";
    
    private ScoringPrompt() {}
    
    public static String build(String patientJson, String toolOutputJson, String candidateJson) {
        return """
            You are evaluating the quality of imaging protocol recommendations from another agent.
            Given patient data and renal tool results, assess the correctness and appropriateness of the candidate output.
            Return ONLY JSON with a single key '%s' between 0 and 1.
            
            Patient data:
            %s
            
            Renal tool output:
            %s
            
            Candidate output:
            %s
            
            Example:
            {"%s": 0.87}
            """.formatted(SCORE_KEY, patientJson, toolOutputJson, candidateJson, SCORE_KEY);
    }
}

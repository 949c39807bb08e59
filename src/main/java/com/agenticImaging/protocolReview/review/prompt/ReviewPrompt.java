package com.agenticImaging.protocolReview.review.prompt;

/**
 * Prompt for the clinical reviewer step.
 */
public class ReviewPrompt {
    
    private ReviewPrompt() {}
    
    /**
     * @param rawPatientJson Patient record exactly as received
     * @param patientJson Normalized patient record
     * @param toolOutputJson Filtered renal tool output
     * @param candidateJson Candidate under review
     * @return Complete user prompt
     */
    public static String build(String rawPatientJson, String patientJson, String toolOutputJson, String candidateJson) {
        return """
            You are a clinical imaging protocol reviewer.
            Given patient data, renal tool output, and protocol suggestions from another agent,
            verify appropriateness, suggest changes, and output JSON with: issues, recommendations, confidence.
            
            - issues: list of strings, each one concrete problem with the suggestions
            - recommendations: list of strings, each one concrete change to make
            - confidence: number between 0 and 1, how confident you are the suggestions are appropriate
            
            Patient data:
            %s
            
            Normalized patient data:
            %s
            
            Renal tool output:
            %s
            
            Candidate output:
            %s
            """.formatted(rawPatientJson, patientJson, toolOutputJson, candidateJson);
    }
}

package com.agenticImaging.protocolReview.generation.prompt;

/**
 * Prompt for the protocol recommendation step.
 */
public class CandidateGenerationPrompt {
    
    private CandidateGenerationPrompt() {}
    
    /**
     * @param patientJson Patient record
     * @param context Shared clinical context for the run
     * @param feedbackJson Reviewer feedback from the previous iteration, or null on the first one
     * @return Complete user prompt
     */
    public static String build(String patientJson, String context, String feedbackJson) {
        String feedbackSection = feedbackJson == null
                ? "No reviewer feedback yet. This is the first proposal."
                : """
                  Reviewer feedback on your previous proposal. Address every issue and apply the recommendations
                  where they are clinically sound:
                  %s
                  """.formatted(feedbackJson);
        
        return """
            You are an imaging protocol specialist. Propose the imaging protocol for this patient.
            
            Return ONLY JSON with these keys:
            - protocol_selection: list of objects with "protocol", "contrast" and "rationale"
            - recommendations: list of strings (preparation, hydration, premedication, follow-up)
            - rationale: string explaining the overall decision
            - warnings: list of strings for contraindications or missing data
            
            Clinical context:
            %s
            
            Patient data:
            %s
            
            %s
            """.formatted(context, patientJson, feedbackSection);
    }
}

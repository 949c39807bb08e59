package com.agenticImaging.protocolReview.generation.prompt;

/**
 * Prompt producing the shared clinical context used by every generation step of a run.
 */
public class EnhancedContextPrompt {
    
    public static final String CONTEXT_KEY = "enhanced_context";
    
    private EnhancedContextPrompt() {}
    
    public static String build(String patientJson) {
        return """
            You are a radiology protocol assistant preparing background for an imaging protocol decision.
            From the patient data below, write a concise clinical context covering:
            - the likely imaging indication and the anatomy to cover
            - renal function and contrast-safety considerations
            - allergies, prior reactions, and other contraindications
            - any data that is missing but would change the protocol
            
            Return ONLY JSON of the form {"%s": "<context as plain text>"}.
            
            Patient data:
            %s
            """.formatted(CONTEXT_KEY, patientJson);
    }
}

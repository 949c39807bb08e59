package com.agenticImaging.protocolReview.fhir.prompt;

/**
 * Prompt converting a final protocol recommendation into a FHIR R4 Bundle.
 */
public class FhirConversionPrompt {
    
    private FhirConversionPrompt() {}
    
    public static String build(String finalJson) {
        return """
            Convert the following JSON into an OpenFHIR-compatible Bundle (R4) in JSON format.
            - Use CarePlan for "recommendations" and "rationale".
            - Use PlanDefinition for each "protocol_selection".
            - Wrap everything in a Bundle (type=collection).
            - Ensure resourceType, id, and required FHIR fields are included.
            - Return only the JSON for the Bundle (no commentary).
            
            Input JSON:
            %s
            """.formatted(finalJson);
    }
}

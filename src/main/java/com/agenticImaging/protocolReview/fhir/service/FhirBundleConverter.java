package com.agenticImaging.protocolReview.fhir.service;

import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import com.agenticImaging.protocolReview.extraction.service.StructuredOutputExtractor;
import com.agenticImaging.protocolReview.fhir.exception.FhirConversionException;
import com.agenticImaging.protocolReview.fhir.model.FhirBundle;
import com.agenticImaging.protocolReview.fhir.prompt.FhirConversionPrompt;
import com.agenticImaging.protocolReview.util.JsonFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts a run's final.json into a validated FHIR R4 Bundle with one model call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FhirBundleConverter {
    
    public static final String BUNDLE_FILE = "fhir_bundle.json";
    
    private final CompletionClient completionClient;
    private final StructuredOutputExtractor extractor;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    
    @Value("${groq.api.fhir.model:}")
    private String fhirModel;
    
    /**
     * @param finalJson Path of the run's final.json
     * @param output Path to write the bundle to
     * @return Validated bundle
     * @throws FhirConversionException if the input cannot be read, the model output cannot be parsed
     *         or validated, or the bundle cannot be written
     */
    public FhirBundle convert(Path finalJson, Path output) {
        Map<String, Object> finalData;
        try {
            finalData = JsonFiles.readObject(finalJson);
        } catch (IOException e) {
            throw new FhirConversionException("Cannot read " + finalJson, e);
        }
        
        String raw = completionClient.complete(FhirConversionPrompt.build(JsonFiles.toPrettyJson(finalData)), fhirModel);
        
        ParseOutcome outcome = extractor.extractOutcome(raw);
        if (!outcome.isParsed()) {
            String snippet = raw.length() > 1000 ? raw.substring(0, 1000) : raw;
            throw new FhirConversionException("Could not parse JSON from model output: "
                    + outcome.getFailureReason() + "\nRaw output snippet:\n" + snippet);
        }
        
        FhirBundle bundle;
        try {
            bundle = objectMapper.convertValue(outcome.getValue(), FhirBundle.class);
        } catch (IllegalArgumentException e) {
            throw new FhirConversionException("FHIR bundle has wrong shape: " + e.getMessage(), e);
        }
        
        Set<ConstraintViolation<FhirBundle>> violations = validator.validate(bundle);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new FhirConversionException("FHIR validation failed: " + details);
        }
        
        try {
            JsonFiles.writePretty(output, bundle);
        } catch (IOException e) {
            throw new FhirConversionException("Cannot write " + output, e);
        }
        
        log.info("FHIR bundle saved - path: {}, entries: {}", output, bundle.getEntry().size());
        return bundle;
    }
}

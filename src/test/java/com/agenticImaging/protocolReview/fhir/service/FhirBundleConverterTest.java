package com.agenticImaging.protocolReview.fhir.service;

import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.extraction.service.StructuredOutputExtractor;
import com.agenticImaging.protocolReview.fhir.exception.FhirConversionException;
import com.agenticImaging.protocolReview.fhir.model.FhirBundle;
import com.agenticImaging.protocolReview.util.JsonFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FhirBundleConverterTest {
    
    @Mock
    private CompletionClient completionClient;
    
    @TempDir
    Path dir;
    
    private FhirBundleConverter converter;
    private Path finalJson;
    private Path output;
    
    @BeforeEach
    void setUp() throws Exception {
        converter = new FhirBundleConverter(completionClient, new StructuredOutputExtractor(), new ObjectMapper(),
                Validation.buildDefaultValidatorFactory().getValidator());
        finalJson = dir.resolve("final.json");
        output = dir.resolve("fhir_bundle.json");
        JsonFiles.writePretty(finalJson, Map.of("protocol_selection", "CT chest without contrast"));
    }
    
    @Test
    void validBundleIsWritten() throws Exception {
        when(completionClient.complete(contains("CT chest without contrast"), any())).thenReturn("""
                ```json
                {"resourceType": "Bundle", "type": "collection",
                 "entry": [{"resource": {"resourceType": "ServiceRequest", "status": "active"}}]}
                ```
                """);
        
        FhirBundle bundle = converter.convert(finalJson, output);
        
        assertThat(bundle.getEntry()).hasSize(1);
        assertThat(bundle.getEntry().get(0).getResource()).containsEntry("resourceType", "ServiceRequest");
        assertThat(JsonFiles.readObject(output)).containsEntry("resourceType", "Bundle");
    }
    
    @Test
    void wrongResourceTypeFailsValidation() {
        when(completionClient.complete(any(), any()))
                .thenReturn("{\"resourceType\": \"Patient\", \"entry\": [{\"resource\": {}}]}");
        
        assertThatThrownBy(() -> converter.convert(finalJson, output))
                .isInstanceOf(FhirConversionException.class)
                .hasMessageContaining("resourceType must be Bundle");
        assertThat(output).doesNotExist();
    }
    
    @Test
    void emptyBundleFailsValidation() {
        when(completionClient.complete(any(), any())).thenReturn("{\"resourceType\": \"Bundle\", \"entry\": []}");
        
        assertThatThrownBy(() -> converter.convert(finalJson, output))
                .isInstanceOf(FhirConversionException.class)
                .hasMessageContaining("at least one entry");
    }
    
    @Test
    void unparseableOutputFails() {
        when(completionClient.complete(any(), any())).thenReturn("Here is the bundle you asked for.");
        
        assertThatThrownBy(() -> converter.convert(finalJson, output))
                .isInstanceOf(FhirConversionException.class)
                .hasMessageContaining("Could not parse JSON");
    }
    
    @Test
    void missingFinalJsonFails() {
        assertThatThrownBy(() -> converter.convert(dir.resolve("absent.json"), output))
                .isInstanceOf(FhirConversionException.class)
                .hasMessageContaining("Cannot read");
    }
}

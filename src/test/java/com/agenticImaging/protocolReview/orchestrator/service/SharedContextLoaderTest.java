package com.agenticImaging.protocolReview.orchestrator.service;

import com.agenticImaging.protocolReview.completion.exception.CompletionException;
import com.agenticImaging.protocolReview.generation.service.ContextProvider;
import com.agenticImaging.protocolReview.orchestrator.exception.ArtifactPersistenceException;
import com.agenticImaging.protocolReview.orchestrator.exception.ContextInitializationException;
import com.agenticImaging.protocolReview.util.JsonFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SharedContextLoaderTest {
    
    @Mock
    private ContextProvider contextProvider;
    
    @TempDir
    Path outputDir;
    
    private final Map<String, Object> record = Map.of("egfr", 28);
    
    private SharedContextLoader loader;
    
    @BeforeEach
    void setUp() {
        loader = new SharedContextLoader(contextProvider, new ArtifactStore(outputDir.toString()));
    }
    
    @Test
    void freshContextIsReturnedAndRecordedForTheRun() throws Exception {
        when(contextProvider.provideContext(record)).thenReturn("Hold metformin 48h after contrast");
        
        assertThat(loader.load("run-1", record)).isEqualTo("Hold metformin 48h after contrast");
        assertThat(JsonFiles.readObject(outputDir.resolve("run-1").resolve(ArtifactStore.CONTEXT_FILE)))
                .containsEntry("enhanced_context", "Hold metformin 48h after contrast");
    }
    
    @Test
    @DisplayName("a later run never picks up an earlier run's context")
    void blankContextFailsEvenAfterAnotherRunSucceeded() {
        Map<String, Object> patientA = Map.of("patient_id", "A", "egfr", 90);
        Map<String, Object> patientB = Map.of("patient_id", "B", "egfr", 25);
        when(contextProvider.provideContext(patientA)).thenReturn("Context for patient A: eGFR 90, contrast OK");
        when(contextProvider.provideContext(patientB)).thenReturn(null);
        
        loader.load("run-a", patientA);
        
        assertThatThrownBy(() -> loader.load("run-b", patientB))
                .isInstanceOf(ContextInitializationException.class)
                .hasMessageContaining("enhanced_context");
        assertThat(Files.exists(outputDir.resolve("run-b").resolve(ArtifactStore.CONTEXT_FILE))).isFalse();
    }
    
    @Test
    void blankContextIsFatal() {
        when(contextProvider.provideContext(record)).thenReturn("  ");
        
        assertThatThrownBy(() -> loader.load("run-1", record))
                .isInstanceOf(ContextInitializationException.class);
    }
    
    @Test
    void providerFailureIsFatalAndKeepsTheCause() {
        CompletionException failure = new CompletionException("503");
        when(contextProvider.provideContext(record)).thenThrow(failure);
        
        assertThatThrownBy(() -> loader.load("run-1", record))
                .isInstanceOf(ContextInitializationException.class)
                .hasCause(failure);
    }
    
    @Test
    void unwritableRunDirectoryIsFatal() throws Exception {
        Path blocker = Files.writeString(outputDir.resolve("blocked"), "not a directory");
        loader = new SharedContextLoader(contextProvider, new ArtifactStore(blocker.toString()));
        when(contextProvider.provideContext(record)).thenReturn("guidance");
        
        assertThatThrownBy(() -> loader.load("run-1", record))
                .isInstanceOf(ArtifactPersistenceException.class);
    }
}

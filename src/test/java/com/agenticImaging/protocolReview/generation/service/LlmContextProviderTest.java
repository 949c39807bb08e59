package com.agenticImaging.protocolReview.generation.service;

import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.extraction.service.StructuredOutputExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmContextProviderTest {
    
    @Mock
    private CompletionClient completionClient;
    
    private LlmContextProvider provider;
    
    @BeforeEach
    void setUp() {
        provider = new LlmContextProvider(completionClient, new StructuredOutputExtractor());
    }
    
    @Test
    void contextIsReadFromTheEnhancedContextKey() {
        when(completionClient.complete(anyString(), any()))
                .thenReturn("{\"enhanced_context\": \"eGFR below 30 contraindicates iodinated contrast\"}");
        
        assertThat(provider.provideContext(Map.of("egfr", 28)))
                .isEqualTo("eGFR below 30 contraindicates iodinated contrast");
    }
    
    @Test
    void replyWithoutTheKeyYieldsNoContext() {
        when(completionClient.complete(anyString(), any())).thenReturn("{\"context\": \"wrong key\"}");
        
        assertThat(provider.provideContext(Map.of("egfr", 28))).isNull();
    }
    
    @Test
    void plainTextReplyIsUsedAsIs() {
        when(completionClient.complete(anyString(), any())).thenReturn("Consider hydration before contrast.");
        
        assertThat(provider.provideContext(Map.of("egfr", 28))).isEqualTo("Consider hydration before contrast.");
    }
}

package com.agenticImaging.protocolReview.completion.service;

import com.agenticImaging.protocolReview.completion.dto.ChatCompletionRequest;
import com.agenticImaging.protocolReview.completion.dto.ChatCompletionResponse;
import com.agenticImaging.protocolReview.completion.dto.ChatMessage;
import com.agenticImaging.protocolReview.completion.exception.CompletionException;
import com.agenticImaging.protocolReview.completion.exception.MissingApiKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client for interacting with Groq API.
 * Handles HTTP communication with Groq's OpenAI-compatible chat completions endpoint.
 */
@Slf4j
@Service
public class GroqApiClient implements CompletionClient {
    
    static final String SYSTEM_PROMPT = "Return only valid JSON.";
    
    private final RestClient restClient;
    private final String apiKey;
    private final String defaultModel;
    private final Double temperature;
    private final Integer maxCompletionTokens;
    
    public GroqApiClient(
            RestClient.Builder restClientBuilder,
            @Value("${groq.api.url:https://api.groq.com/openai/v1/chat/completions}") String apiUrl,
            @Value("${groq.api.key:}") String apiKey,
            @Value("${groq.api.model:openai/gpt-oss-120b}") String defaultModel,
            @Value("${groq.api.temperature:0.3}") Double temperature,
            @Value("${groq.api.max-completion-tokens:4096}") Integer maxCompletionTokens) {
        this.restClient = restClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.apiKey = apiKey;
        this.defaultModel = defaultModel;
        this.temperature = temperature;
        this.maxCompletionTokens = maxCompletionTokens;
    }
    
    @Override
    public void ensureConfigured() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new MissingApiKeyException("Groq API key is not configured. Set GROQ_API_KEY in the environment");
        }
    }
    
    /**
     * Calls Groq API with the fixed JSON-only system prompt and the given user prompt.
     * 
     * @param userPrompt Prompt to process
     * @param model Model to use for the API call, or blank for the default
     * @return Content of the first choice
     * @throws CompletionException if the API call fails or returns no content
     */
    @Override
    public String complete(String userPrompt, String model) {
        ensureConfigured();
        
        if (model == null || model.isBlank()) {
            model = defaultModel;
        }
        
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .message(ChatMessage.system(SYSTEM_PROMPT))
                .message(ChatMessage.user(userPrompt))
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .build();
        
        ChatCompletionResponse response;
        try {
            log.debug("Calling Groq API - model: {}, prompt length: {}", model, userPrompt.length());
            
            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientException e) {
            log.error("Error calling Groq API - model: {}", model, e);
            throw new CompletionException("Failed to call Groq API: " + e.getMessage(), e);
        }
        
        String content = response != null ? response.firstContent() : null;
        if (content == null) {
            throw new CompletionException("Groq API returned no content for model " + model);
        }
        if ("length".equals(response.firstChoice().getFinishReason())) {
            log.warn("Groq API output truncated at {} tokens - model: {}", maxCompletionTokens, model);
        }
        
        log.debug("Groq API response received - model: {}, tokens used: {}",
                response.getModel(),
                response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");
        
        return content;
    }
}

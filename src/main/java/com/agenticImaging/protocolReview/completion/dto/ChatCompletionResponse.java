package com.agenticImaging.protocolReview.completion.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Subset of the chat completions response the pipeline reads: the choices and token usage.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionResponse {
    
    @JsonProperty("model")
    String model;
    
    @JsonProperty("choices")
    List<Choice> choices;
    
    @JsonProperty("usage")
    Usage usage;
    
    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        
        @JsonProperty("message")
        ChatMessage message;
        
        /**
         * "stop" for a complete answer, "length" when the token limit cut it off.
         */
        @JsonProperty("finish_reason")
        String finishReason;
    }
    
    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Usage {
        
        @JsonProperty("total_tokens")
        Integer totalTokens;
    }
    
    /**
     * @return First choice, or null if the response has none
     */
    public Choice firstChoice() {
        return choices != null && !choices.isEmpty() ? choices.get(0) : null;
    }
    
    /**
     * @return Content of the first choice, or null if not available
     */
    public String firstContent() {
        Choice choice = firstChoice();
        return choice != null && choice.getMessage() != null ? choice.getMessage().getContent() : null;
    }
}

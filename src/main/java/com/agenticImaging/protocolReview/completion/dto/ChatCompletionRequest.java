package com.agenticImaging.protocolReview.completion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Request body for the OpenAI-compatible chat completions endpoint. Always non-streaming.
 */
@Value
@Builder
public class ChatCompletionRequest {
    
    @Singular
    @JsonProperty("messages")
    List<ChatMessage> messages;
    
    @JsonProperty("model")
    String model;
    
    @JsonProperty("temperature")
    Double temperature;
    
    @JsonProperty("max_completion_tokens")
    Integer maxCompletionTokens;
    
    @Builder.Default
    @JsonProperty("top_p")
    Double topP = 1.0;
    
    @JsonProperty("stream")
    public boolean isStream() {
        return false;
    }
}

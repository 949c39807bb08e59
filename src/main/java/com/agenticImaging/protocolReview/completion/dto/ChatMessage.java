package com.agenticImaging.protocolReview.completion.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One chat message, used both in requests and in returned choices.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessage {
    
    @JsonProperty("role")
    String role;
    
    @JsonProperty("content")
    String content;
    
    public static ChatMessage system(String content) {
        return ChatMessage.builder().role("system").content(content).build();
    }
    
    public static ChatMessage user(String content) {
        return ChatMessage.builder().role("user").content(content).build();
    }
}

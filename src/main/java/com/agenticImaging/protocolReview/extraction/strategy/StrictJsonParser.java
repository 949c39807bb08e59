package com.agenticImaging.protocolReview.extraction.strategy;

import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses text that must be exactly one JSON object.
 * 
 * Trailing content after the object fails the parse, as do arrays and scalars.
 */
public class StrictJsonParser {
    
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    
    public ParseOutcome parse(String text) {
        if (text == null || text.isBlank()) {
            return ParseOutcome.failed("empty text");
        }
        try {
            Map<String, Object> value = objectMapper.readValue(text, OBJECT_TYPE);
            if (value == null) {
                return ParseOutcome.failed("null literal");
            }
            return ParseOutcome.parsed(value);
        } catch (JsonProcessingException e) {
            return ParseOutcome.failed(e.getOriginalMessage());
        }
    }
}

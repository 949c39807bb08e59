package com.agenticImaging.protocolReview.normalization.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Patient record keyed by canonical field name.
 * 
 * Serializes as a plain JSON object. Values are numbers or strings as supplied by the caller;
 * nothing is validated here.
 */
@EqualsAndHashCode
@ToString
public final class PatientRecord {
    
    private final Map<String, Object> fields;
    
    private PatientRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
    
    @JsonCreator
    public static PatientRecord of(Map<String, Object> fields) {
        return new PatientRecord(fields != null ? fields : Map.of());
    }
    
    @JsonValue
    public Map<String, Object> asMap() {
        return fields;
    }
    
    public boolean has(String field) {
        return fields.get(field) != null;
    }
    
    public Object get(String field) {
        return fields.get(field);
    }
    
    /**
     * Reads a field as a number, accepting numeric strings such as "1.2".
     * 
     * @param field Canonical field name
     * @return Numeric value, or null if the field is absent or not numeric
     */
    public Double numeric(String field) {
        Object value = fields.get(field);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
    
    public int size() {
        return fields.size();
    }
}

package com.agenticImaging.protocolReview.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for reading and writing JSON documents on disk.
 * Output is pretty-printed UTF-8 with non-ASCII characters kept as-is.
 */
public class JsonFiles {
    
    private static final Logger log = LoggerFactory.getLogger(JsonFiles.class);
    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};
    
    private JsonFiles() {}
    
    /**
     * Serializes a value for inclusion in a prompt.
     * 
     * @param value Value to serialize
     * @return Pretty-printed JSON, or an error marker if the value cannot be serialized
     */
    public static String toPrettyJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Error formatting value as JSON - type: {}", value != null ? value.getClass().getSimpleName() : "null", e);
            return "Error formatting data: " + e.getOriginalMessage();
        }
    }
    
    /**
     * Writes a value as pretty-printed UTF-8 JSON, creating parent directories as needed.
     * 
     * @param path Target file
     * @param value Value to write
     * @throws IOException if the file cannot be written
     */
    public static void writePretty(Path path, Object value) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        Files.writeString(path, json, StandardCharsets.UTF_8);
    }
    
    /**
     * Reads a file that must contain one JSON object.
     * 
     * @param path File to read
     * @return Object as an ordered map
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    public static Map<String, Object> readObject(Path path) throws IOException {
        JsonNode node = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        if (node == null || !node.isObject()) {
            throw new IOException("Expected a JSON object in " + path);
        }
        return objectMapper.convertValue(node, OBJECT_TYPE);
    }
    
    /**
     * Loads a raw patient record that may be JSON, a two-line CSV (header line then value line),
     * or free text. Free text is returned as {"raw_text": text}.
     * 
     * @param path File to read
     * @return Raw record, keys not yet normalized
     * @throws IOException if the file cannot be read, or holds JSON that is not an object
     */
    public static Map<String, Object> readPatientRecord(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8).strip();
        
        JsonNode node = null;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Patient input is not JSON, trying CSV - path: {}", path);
        }
        if (node != null && !node.isMissingNode()) {
            if (!node.isObject()) {
                throw new IOException("Patient input JSON must be an object: " + path);
            }
            return objectMapper.convertValue(node, OBJECT_TYPE);
        }
        
        Map<String, Object> record = new LinkedHashMap<>();
        String[] lines = text.split("\\R");
        if (lines.length >= 2 && lines[0].contains(",") && !isNumeric(lines[0].split(",")[0].strip())) {
            String[] header = lines[0].split(",");
            String[] values = lines[1].split(",");
            for (int i = 0; i < Math.min(header.length, values.length); i++) {
                record.put(header[i].strip(), values[i].strip());
            }
            return record;
        }
        record.put("raw_text", text);
        return record;
    }
    
    private static boolean isNumeric(String token) {
        try {
            Double.parseDouble(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}

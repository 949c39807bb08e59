package com.agenticImaging.protocolReview.extraction.strategy;

import java.util.regex.Pattern;

/**
 * Text-level fixes shared by the repair strategies.
 */
public final class JsonTextRepairs {
    
    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*|\\s*```$", Pattern.MULTILINE);
    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");
    
    private JsonTextRepairs() {}
    
    /**
     * Removes opening ```/```json and closing ``` markers at line boundaries.
     */
    public static String stripFences(String text) {
        if (text == null) {
            return "";
        }
        return CODE_FENCE.matcher(text.strip()).replaceAll("");
    }
    
    /**
     * Drops commas directly followed (modulo whitespace) by a closing brace or bracket.
     */
    public static String removeTrailingCommas(String text) {
        return TRAILING_COMMA.matcher(text).replaceAll("$1");
    }
    
    /**
     * Replaces line feeds with spaces and drops carriage returns.
     */
    public static String flattenLineBreaks(String text) {
        return text.replace("\n", " ").replace("\r", "");
    }
    
    /**
     * Returns the span from the first '{' to the last '}', or null if there is none.
     */
    public static String greedyObjectSpan(String text) {
        if (text == null) {
            return null;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? text.substring(start, end + 1) : null;
    }
    
    /**
     * Returns the span from the first '{' to the brace that brings the nesting depth back to
     * zero, or null if the braces never balance.
     */
    public static String firstBalancedSpan(String text) {
        if (text == null) {
            return null;
        }
        int start = text.indexOf('{');
        if (start == -1) {
            return null;
        }
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }
}

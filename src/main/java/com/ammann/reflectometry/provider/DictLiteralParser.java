/* (C)2026 */
package com.ammann.reflectometry.provider;

import com.ammann.reflectometry.exception.MetadataReadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads the dictionary literals the control software writes into metadata values,
 * such as {@code {1: {'name': 'S1', 'length': 20.0}}}.
 */
final class DictLiteralParser {

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private DictLiteralParser() {}

    /**
     * Parses a literal into a JSON tree.
     *
     * @param literal dictionary or list literal
     * @return parsed tree
     * @throws MetadataReadException if the literal is malformed
     */
    static JsonNode parse(String literal) {
        String trimmed = literal.strip();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            trimmed = "[" + trimmed.substring(1, trimmed.length() - 1) + "]";
        }
        String json = trimmed
                .replaceAll("([{,]\\s*)(-?\\d+)\\s*:", "$1\"$2\":")
                .replaceAll("\\bNone\\b", "null")
                .replaceAll("\\bTrue\\b", "true")
                .replaceAll("\\bFalse\\b", "false");
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MetadataReadException("Cannot parse metadata literal: " + literal, e);
        }
    }

    /** Text of a field, {@code null} if absent or null. */
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /** Number of a field, {@code fallback} if absent or not numeric. */
    static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}

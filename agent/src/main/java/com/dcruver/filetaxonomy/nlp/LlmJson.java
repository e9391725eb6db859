package com.dcruver.filetaxonomy.nlp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;

/**
 * Helpers for dealing with model output that should contain JSON.
 */
public final class LlmJson {

    private LlmJson() {
    }

    /**
     * Parsed JSON or the reason it could not be parsed.
     */
    @Value
    public static class ParseResult {
        JsonNode value;
        String error;

        public boolean isSuccess() {
            return value != null;
        }
    }

    /**
     * Strip a surrounding markdown code fence (with or without a language tag).
     */
    public static String stripFences(String response) {
        String text = response.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }

    /**
     * Extract JSON from an LLM response (it might have text before/after).
     */
    public static String extractJson(String response) {
        String text = stripFences(response);
        int jsonStart = text.indexOf('{');
        int jsonEnd = text.lastIndexOf('}');
        if (jsonStart >= 0 && jsonEnd > jsonStart) {
            return text.substring(jsonStart, jsonEnd + 1);
        }
        return text;
    }

    public static ParseResult parse(String response, ObjectMapper objectMapper) {
        if (response == null || response.isBlank()) {
            return new ParseResult(null, "Empty response");
        }
        try {
            JsonNode node = objectMapper.readTree(extractJson(response));
            if (node == null || !node.isObject()) {
                return new ParseResult(null, "Response is not a JSON object");
            }
            return new ParseResult(node, null);
        } catch (Exception e) {
            return new ParseResult(null, e.getMessage());
        }
    }

    /**
     * Reject text that was decoded from invalid UTF-8: replacement characters or unpaired surrogates.
     *
     * @throws MalformedLlmResponseException if the text is not well-formed
     */
    public static String requireWellFormed(String text) {
        if (text == null) {
            return null;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\uFFFD') {
                throw new MalformedLlmResponseException("LLM response contains malformed UTF-8 at offset " + i);
            }
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    throw new MalformedLlmResponseException("LLM response contains an unpaired surrogate at offset " + i);
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                throw new MalformedLlmResponseException("LLM response contains an unpaired surrogate at offset " + i);
            }
        }
        return text;
    }
}

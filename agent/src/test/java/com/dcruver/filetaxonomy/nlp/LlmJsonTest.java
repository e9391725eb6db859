package com.dcruver.filetaxonomy.nlp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LlmJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testExtractsJsonFromProse() {
        LlmJson.ParseResult result = LlmJson.parse(
            "Sure, here you go:\n{\"category\": [\"Magic\"], \"confidence\": 0.8}\nHope that helps.", objectMapper);

        assertTrue(result.isSuccess());
        assertEquals(0.8, result.getValue().get("confidence").asDouble());
    }

    @Test
    void testStripsMarkdownFence() {
        LlmJson.ParseResult result = LlmJson.parse("```json\n{\"a\": 1}\n```", objectMapper);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getValue().get("a").asInt());
    }

    @Test
    void testReportsUnparseableResponse() {
        assertFalse(LlmJson.parse("no json here", objectMapper).isSuccess());
        assertEquals("Empty response", LlmJson.parse("  ", objectMapper).getError());
        assertFalse(LlmJson.parse("[1, 2]", objectMapper).isSuccess());
    }

    @Test
    void testMalformedTextIsFatal() {
        assertEquals("fine 🎩", LlmJson.requireWellFormed("fine 🎩"));
        assertThrows(MalformedLlmResponseException.class, () -> LlmJson.requireWellFormed("bad \uFFFD"));
        assertThrows(MalformedLlmResponseException.class, () -> LlmJson.requireWellFormed("lonely \uD83C"));
    }
}

package com.williamcallahan.dictionary_engine.types;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response of a one-shot JSON generation.
 *
 * @param data generated JSON document
 * @param tokensUsed tokens reported by the backend, 0 when unknown
 */
public record GenerationResult(JsonNode data, int tokensUsed) {
}

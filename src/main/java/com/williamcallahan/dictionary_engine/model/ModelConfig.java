package com.williamcallahan.dictionary_engine.model;

/**
 * Generation settings sent with every request body as {@code config}.
 *
 * @param provider backend provider name, e.g. "gemini"
 * @param model model identifier understood by the provider
 * @param maxTokens upper bound on generated tokens
 * @param temperature sampling temperature
 */
public record ModelConfig(String provider, String model, int maxTokens, double temperature) {
}

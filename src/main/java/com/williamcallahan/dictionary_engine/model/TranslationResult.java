package com.williamcallahan.dictionary_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Translated paragraph together with the language pair it was produced for.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranslationResult(String originalText, String translatedText, String sourceLang, String targetLang) {
}

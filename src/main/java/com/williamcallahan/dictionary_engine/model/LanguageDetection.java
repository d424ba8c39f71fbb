package com.williamcallahan.dictionary_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Detected language of a single word.
 *
 * @param language language code, one of the candidates the caller offered
 * @param confidence between 0 and 1; script-based detections report 1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LanguageDetection(String language, double confidence) {
}

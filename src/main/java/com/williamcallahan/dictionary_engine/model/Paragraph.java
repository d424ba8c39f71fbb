package com.williamcallahan.dictionary_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One aligned paragraph of a translation.
 *
 * @param originalText paragraph of the source text
 * @param translatedText matching paragraph of the translation
 * @param index position within the translation, starting at 0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Paragraph(String originalText, String translatedText, int index) {
}

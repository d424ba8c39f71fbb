package com.williamcallahan.dictionary_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One candidate word returned for a native-language search.
 *
 * @param lemma target-language headword
 * @param pos parts of speech
 * @param shortSense short glosses in the native language
 * @param confidence generator confidence between 0 and 1
 * @param nuance optional nuance note
 * @param usageHint usage hint attached by background enrichment
 * @param gender grammatical gender for languages that have one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SuggestionItem(
    String lemma,
    List<String> pos,
    List<String> shortSense,
    Double confidence,
    String nuance,
    String usageHint,
    String gender
) {
    public SuggestionItem {
        pos = pos == null ? List.of() : List.copyOf(pos);
        shortSense = shortSense == null ? List.of() : List.copyOf(shortSense);
    }

    public SuggestionItem withUsageHint(String hint) {
        return new SuggestionItem(lemma, pos, shortSense, confidence, nuance, hint, gender);
    }

    public boolean sameLemma(SuggestionItem other) {
        return other != null && lemma != null && lemma.equalsIgnoreCase(other.lemma());
    }
}

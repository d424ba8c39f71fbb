package com.williamcallahan.dictionary_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Dictionary entry for one headword.
 *
 * Built progressively: the basic stage fills headword and senses, the detailed stage
 * adds hint, metrics, examples and collocations. Lists are never null.
 *
 * @param headword lemma, language and parts of speech
 * @param senses short glosses in the learner's native language
 * @param examples example sentences with translations
 * @param collocations common phrases using the headword
 * @param hint usage hint shown under the senses
 * @param metrics frequency, difficulty and nuance scores
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WordDetail(
    Headword headword,
    List<Sense> senses,
    List<Example> examples,
    List<Collocation> collocations,
    Hint hint,
    Metrics metrics
) {
    public WordDetail {
        senses = senses == null ? List.of() : List.copyOf(senses);
        examples = examples == null ? List.of() : List.copyOf(examples);
        collocations = collocations == null ? List.of() : List.copyOf(collocations);
    }

    public boolean hasLemma() {
        return headword != null && headword.lemma() != null && !headword.lemma().isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Headword(String lemma, String lang, List<String> pos) {
        public Headword {
            pos = pos == null ? List.of() : List.copyOf(pos);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Sense(String id, String glossShort) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Example(String textSrc, String textDst) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Collocation(String phrase) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hint(String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metrics(Integer frequency, Integer difficulty, Integer nuance) {
    }
}

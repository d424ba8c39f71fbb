package com.williamcallahan.dictionary_engine.service.generation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds generation prompts for each content type.
 * Every prompt pins the JSON shape the parsers and mergers expect.
 */
@Component
public class PromptFactory {

    private static final Map<String, String> LANGUAGE_NAMES = Map.of(
        "ja", "Japanese",
        "en", "English",
        "pt", "Portuguese",
        "fr", "French",
        "zh", "Chinese",
        "ko", "Korean",
        "vi", "Vietnamese",
        "id", "Indonesian",
        "es", "Spanish"
    );

    private static final Set<String> GENDERED_LANGUAGES = Set.of("es", "pt", "fr");

    public String basicInfo(String word, String targetLanguage, String nativeLanguage) {
        return String.format(
            "Generate minimal dictionary data for the %s word \"%s\" as JSON:%n"
                + "{\"headword\": {\"lemma\": \"%s\", \"lang\": \"%s\", \"pos\": [\"verb\"]},"
                + " \"senses\": [{\"id\": \"1\", \"glossShort\": \"short %s gloss\"}]}%n"
                + "Give 2-3 main senses, each gloss at most 10 characters.",
            languageName(targetLanguage), word, word, targetLanguage, languageName(nativeLanguage));
    }

    public String detailedInfo(String word, String targetLanguage, String nativeLanguage) {
        return String.format(
            "Generate the full dictionary entry for the %s word \"%s\" for a %s-speaking learner as JSON with, in this order:%n"
                + "headword {lemma, lang, pos[]}, senses [{id, glossShort}], hint {text}, "
                + "metrics {frequency, difficulty, nuance} (0-100), examples [{textSrc, textDst}] (3 items), "
                + "collocations [{phrase}].",
            languageName(targetLanguage), word, languageName(nativeLanguage));
    }

    public String additionalDetails(String word, String targetLanguage, String nativeLanguage) {
        return String.format(
            "For the %s word \"%s\" generate only the additional details as JSON, in this order:%n"
                + "hint {text} in %s, metrics {frequency, difficulty, nuance} (0-100), "
                + "examples [{textSrc, textDst}] (3 items). Do not repeat headword or senses.",
            languageName(targetLanguage), word, languageName(nativeLanguage));
    }

    public String suggestions(String query, String targetLanguage, String nativeLanguage) {
        String genderField = GENDERED_LANGUAGES.contains(normalize(targetLanguage))
            ? ", \"gender\": \"m|f|n\""
            : "";
        return String.format(
            "List up to 10 %s words matching the %s query \"%s\". Return a JSON array of"
                + " {\"lemma\": \"...\", \"pos\": [\"...\"], \"shortSense\": [\"%s gloss\"], \"confidence\": 0.0-1.0%s},"
                + " most likely first.",
            languageName(targetLanguage), languageName(nativeLanguage), query, languageName(nativeLanguage), genderField);
    }

    public String usageHint(String lemma, String query, String nativeLanguage) {
        return String.format(
            "In one %s sentence, explain when to use \"%s\" for someone who searched \"%s\"."
                + " Return JSON {\"hint\": \"...\"}.",
            languageName(nativeLanguage), lemma, query);
    }

    public String translation(String text, String sourceLanguage, String targetLanguage) {
        return String.format(
            "Translate the following %s text into natural %s. Return only the translation.%n%n%s",
            languageName(sourceLanguage), languageName(targetLanguage), text);
    }

    public String languageDetection(String word, List<String> candidates) {
        return String.format(
            "Which of these languages is the word \"%s\" from: %s?"
                + " Return JSON {\"language\": \"<one of the codes>\", \"confidence\": 0.0-1.0}.",
            word, String.join(", ", candidates));
    }

    static String languageName(String code) {
        if (code == null || code.isBlank()) {
            return "English";
        }
        return LANGUAGE_NAMES.getOrDefault(normalize(code), code.toUpperCase(Locale.ROOT));
    }

    private static String normalize(String code) {
        return code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
    }
}

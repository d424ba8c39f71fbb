/**
 * Aligns a finished translation into matching paragraph pairs
 *
 * @author William Callahan
 *
 * Features:
 * - Blank-line split of both texts first, used when it yields several paragraphs of similar count
 * - Short texts that do not split cleanly stay one paragraph without a remote call
 * - Longer texts go to the remote paragraph aligner
 * - Any aligner failure degrades to a single paragraph holding both full texts
 */

package com.williamcallahan.dictionary_engine.service;

import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.Paragraph;
import com.williamcallahan.dictionary_engine.model.TranslationResult;
import com.williamcallahan.dictionary_engine.service.generation.GenerationApiClient;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

@Service
@Slf4j
public class ParagraphSplitter {

    private static final Pattern BLANK_LINES = Pattern.compile("(\\r?\\n){2,}");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";
    private static final int MAX_PARAGRAPH_COUNT_GAP = 2;

    private final GenerationApiClient apiClient;
    private final int remoteSplitMinLength;

    public ParagraphSplitter(GenerationApiClient apiClient, AppConfigurationProperties properties) {
        this.apiClient = apiClient;
        this.remoteSplitMinLength = properties.getGeneration().getParagraphSplitMinLength();
    }

    /**
     * Splits {@code translation} into aligned paragraphs; never fails
     *
     * @param translation finished translation
     * @return at least one paragraph, indexed from 0
     */
    public Mono<List<Paragraph>> split(TranslationResult translation) {
        return Mono.defer(() -> {
            Optional<List<Paragraph>> simple = trySimpleSplit(translation.originalText(), translation.translatedText());
            if (simple.isPresent() && simple.get().size() > 1) {
                log.debug("Blank-line split produced {} paragraphs", simple.get().size());
                return Mono.just(simple.get());
            }
            if (translation.originalText().length() <= remoteSplitMinLength) {
                return Mono.just(singleParagraph(translation));
            }
            ExternalApiLogger.logApiCallAttempt(log, "split-paragraphs",
                translation.sourceLang() + ">" + translation.targetLang());
            return apiClient.splitParagraphs(translation)
                .filter(paragraphs -> !paragraphs.isEmpty())
                .switchIfEmpty(Mono.error(() -> new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                    "split-paragraphs returned no paragraphs")))
                .onErrorResume(e -> {
                    ExternalApiLogger.logApiCallFailure(log, "split-paragraphs",
                        translation.sourceLang() + ">" + translation.targetLang(), e.getMessage());
                    return Mono.just(singleParagraph(translation));
                });
        });
    }

    /**
     * Pairs blank-line separated paragraphs of both texts. Surplus paragraphs on either side are
     * appended to the last pair.
     *
     * @return empty when both texts are a single paragraph or their paragraph counts differ by more than two
     */
    static Optional<List<Paragraph>> trySimpleSplit(String originalText, String translatedText) {
        List<String> original = paragraphsOf(originalText);
        List<String> translated = paragraphsOf(translatedText);
        if (original.size() <= 1 && translated.size() <= 1) {
            return Optional.empty();
        }
        if (Math.abs(original.size() - translated.size()) > MAX_PARAGRAPH_COUNT_GAP) {
            return Optional.empty();
        }
        int pairs = Math.min(original.size(), translated.size());
        if (pairs == 0) {
            return Optional.empty();
        }
        List<Paragraph> paragraphs = new ArrayList<>();
        for (int i = 0; i < pairs - 1; i++) {
            paragraphs.add(new Paragraph(original.get(i), translated.get(i), i));
        }
        paragraphs.add(new Paragraph(
            String.join(PARAGRAPH_SEPARATOR, original.subList(pairs - 1, original.size())),
            String.join(PARAGRAPH_SEPARATOR, translated.subList(pairs - 1, translated.size())),
            pairs - 1));
        return Optional.of(paragraphs);
    }

    static List<Paragraph> singleParagraph(TranslationResult translation) {
        return List.of(new Paragraph(translation.originalText().trim(), translation.translatedText().trim(), 0));
    }

    private static List<String> paragraphsOf(String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(BLANK_LINES.split(text))
            .map(String::trim)
            .filter(paragraph -> !paragraph.isEmpty())
            .toList();
    }
}

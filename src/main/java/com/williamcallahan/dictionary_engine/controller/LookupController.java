/**
 * REST controller streaming dictionary lookups as Server-Sent Events
 *
 * @author William Callahan
 *
 * Features:
 * - Word detail and suggestion lookups stream every progressive update, then a final done event
 * - Failures inside a stream arrive as a last "error" event carrying the classification code
 * - Translation, paragraph alignment, language detection and typo suggestions answer with plain JSON
 */

package com.williamcallahan.dictionary_engine.controller;

import com.williamcallahan.dictionary_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.LanguageDetection;
import com.williamcallahan.dictionary_engine.model.Paragraph;
import com.williamcallahan.dictionary_engine.model.TranslationResult;
import com.williamcallahan.dictionary_engine.service.LanguageDetectionService;
import com.williamcallahan.dictionary_engine.service.SuggestionService;
import com.williamcallahan.dictionary_engine.service.TranslationService;
import com.williamcallahan.dictionary_engine.service.WordDetailService;
import com.williamcallahan.dictionary_engine.types.LookupUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/lookup")
@Slf4j
public class LookupController {

    static final String EVENT_PROGRESS = "progress";
    static final String EVENT_DONE = "done";
    static final String EVENT_ERROR = "error";

    private final WordDetailService wordDetailService;
    private final SuggestionService suggestionService;
    private final TranslationService translationService;
    private final LanguageDetectionService languageDetectionService;

    public LookupController(WordDetailService wordDetailService,
                            SuggestionService suggestionService,
                            TranslationService translationService,
                            LanguageDetectionService languageDetectionService) {
        this.wordDetailService = wordDetailService;
        this.suggestionService = suggestionService;
        this.translationService = translationService;
        this.languageDetectionService = languageDetectionService;
    }

    /**
     * Streams the dictionary entry for a headword
     *
     * @param word headword in the target language
     * @param lang target language code
     */
    @GetMapping(path = "/word/{word}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> streamWordDetail(@PathVariable String word,
                                                          @RequestParam(defaultValue = "en") String lang) {
        return toEvents(wordDetailService.lookup(word, lang), "word " + word);
    }

    @GetMapping(path = "/word/{word}/typos", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<String> typoSuggestions(@PathVariable String word,
                                        @RequestParam(defaultValue = "en") String lang) {
        return wordDetailService.typoSuggestions(word, lang);
    }

    /**
     * Streams candidate words for a native-language query
     *
     * @param q search text
     * @param lang target language code
     */
    @GetMapping(path = "/suggestions", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> streamSuggestions(@RequestParam String q,
                                                           @RequestParam(defaultValue = "en") String lang) {
        return toEvents(suggestionService.search(q, lang), "suggestions " + q);
    }

    @PostMapping(path = "/translate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TranslationResult> translate(@RequestBody TranslateRequest request) {
        return translationService.translate(request.text(), request.sourceLang(), request.targetLang());
    }

    @PostMapping(path = "/translate/paragraphs", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<Paragraph>> translateParagraphs(@RequestBody TranslateRequest request) {
        return translationService.translateParagraphs(request.text(), request.sourceLang(), request.targetLang());
    }

    /**
     * Detects the language of a word; 404 when it cannot be determined
     *
     * @param word word to classify
     * @param candidates allowed language codes, the configured list when absent
     */
    @GetMapping(path = "/language", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<LanguageDetection>> detectLanguage(@RequestParam String word,
                                                                  @RequestParam(required = false) List<String> candidates) {
        Mono<LanguageDetection> detection = candidates == null || candidates.isEmpty()
            ? languageDetectionService.detect(word)
            : languageDetectionService.detect(word, candidates);
        return detection
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @ExceptionHandler({IllegalArgumentException.class, GenerationException.class})
    public ResponseEntity<Map<String, Object>> handleLookupFailure(RuntimeException ex) {
        log.debug("Lookup request failed: {}", ex.getMessage());
        return ResponseEntity.status(ErrorResponseUtils.statusFor(ex)).body(ErrorResponseUtils.errorBody(ex));
    }

    private <V> Flux<ServerSentEvent<Object>> toEvents(Flux<LookupUpdate<V>> updates, String description) {
        return updates
            .map(update -> ServerSentEvent.<Object>builder()
                .event(update.done() ? EVENT_DONE : EVENT_PROGRESS)
                .data(update)
                .build())
            .onErrorResume(error -> {
                log.debug("Streaming lookup for {} ended with error: {}", description, error.getMessage());
                return Mono.just(ServerSentEvent.<Object>builder()
                    .event(EVENT_ERROR)
                    .data(ErrorResponseUtils.errorBody(error))
                    .build());
            });
    }

    /**
     * Body of POST /api/lookup/translate
     */
    public record TranslateRequest(String text, String sourceLang, String targetLang) {
    }
}

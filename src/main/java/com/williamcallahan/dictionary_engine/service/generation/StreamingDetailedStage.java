/**
 * Detailed stage backed by the additional-details SSE endpoint
 *
 * @author William Callahan
 *
 * Features:
 * - Each section event (hint, metrics, examples) is folded into the running document
 * - Section arrival maps to fixed internal progress so the caller sees 50/70/90 after rescaling
 * - An error event fails the stage; a stream that ends without a terminal event completes
 *   with whatever sections arrived
 */

package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import com.williamcallahan.dictionary_engine.types.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
public class StreamingDetailedStage implements DetailedStage {

    static final Map<String, Integer> SECTION_PROGRESS = Map.of(
        "hint", 29,
        "metrics", 57,
        "examples", 86
    );

    private final GenerationApiClient apiClient;
    private final PromptFactory prompts;
    private final PartialMerger merger;

    public StreamingDetailedStage(GenerationApiClient apiClient, PromptFactory prompts, PartialMerger merger) {
        this.apiClient = apiClient;
        this.prompts = prompts;
        this.merger = merger;
    }

    @Override
    public Flux<GenerationUpdate> run(String word, String targetLanguage, String nativeLanguage) {
        return Flux.defer(() -> {
            StreamState state = new StreamState();
            String prompt = prompts.additionalDetails(word, targetLanguage, nativeLanguage);
            return apiClient.streamAdditional(prompt, apiClient.defaultModelConfig())
                .concatMap(event -> onEvent(state, event))
                .concatWith(Mono.defer(() -> state.done
                    ? Mono.empty()
                    : Mono.just(GenerationUpdate.completed(state.accumulated, 0))));
        });
    }

    private Mono<GenerationUpdate> onEvent(StreamState state, StreamEvent event) {
        if (event instanceof StreamEvent.Section section) {
            ObjectNode incoming = JsonNodeFactory.instance.objectNode();
            incoming.set(section.section(), section.data());
            state.accumulated = merger.merge(state.accumulated, incoming);
            state.progress = Math.max(state.progress, SECTION_PROGRESS.getOrDefault(section.section(), state.progress));
            log.debug("Additional section '{}' received", section.section());
            return Mono.just(GenerationUpdate.progress(state.progress, state.accumulated));
        }
        if (event instanceof StreamEvent.Complete complete) {
            JsonNode data = complete.data();
            if (data instanceof ObjectNode object) {
                state.accumulated = merger.merge(state.accumulated, object);
            }
            state.done = true;
            return Mono.just(GenerationUpdate.completed(state.accumulated, complete.tokensUsed()));
        }
        if (event instanceof StreamEvent.Error error) {
            return Mono.error(new GenerationException(ErrorClassification.GENERATION_FAILED, error.message()));
        }
        // free-text chunks carry nothing for a structured entry
        return Mono.empty();
    }

    private static final class StreamState {
        private ObjectNode accumulated = JsonNodeFactory.instance.objectNode();
        private int progress;
        private boolean done;
    }
}

/**
 * Runs the fast basic lookup and the slow detailed lookup side by side
 *
 * @author William Callahan
 *
 * Features:
 * - Both requests start at subscription; the basic result is surfaced at 30% as soon as it lands
 * - Detailed progress (0-100) is rescaled onto 30-100
 * - Every update carries the merged document so far, filled monotonically by PartialMerger
 * - A detailed failure degrades to basic plus whatever detail arrived; a basic failure fails the lookup
 * - Progress values are non-decreasing and the last update has done set
 */

package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import com.williamcallahan.dictionary_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class TwoStageOrchestrator {

    static final int BASIC_PROGRESS = 30;

    private final GenerationApiClient apiClient;
    private final PromptFactory prompts;
    private final PartialMerger merger;
    private final DetailedStage detailedStage;

    public TwoStageOrchestrator(GenerationApiClient apiClient,
                                PromptFactory prompts,
                                PartialMerger merger,
                                DetailedStage detailedStage) {
        this.apiClient = apiClient;
        this.prompts = prompts;
        this.merger = merger;
        this.detailedStage = detailedStage;
    }

    /**
     * Rescales detailed-stage progress onto the part of the timeline after the basic stage
     */
    static int rescaleDetailed(int detailedProgress) {
        int clamped = Math.max(0, Math.min(100, detailedProgress));
        return BASIC_PROGRESS + Math.round(clamped * (100 - BASIC_PROGRESS) / 100f);
    }

    /**
     * @param query headword to look up
     * @param targetLanguage language of the headword
     * @param nativeLanguage language of glosses and hints
     * @return merged progress updates; the last one has done set
     */
    public Flux<GenerationUpdate> fetch(String query, String targetLanguage, String nativeLanguage) {
        return Flux.defer(() -> {
            TwoStageState state = new TwoStageState();
            ExternalApiLogger.logApiCallAttempt(log, "two-stage word detail", query);

            Mono<StageSignal> basic = apiClient
                .generateJson(prompts.basicInfo(query, targetLanguage, nativeLanguage), apiClient.defaultModelConfig())
                .flatMap(result -> asObject(result.data(), "basic")
                    .map(data -> StageSignal.ofBasic(data, result.tokensUsed())));

            Flux<StageSignal> detailed = detailedStage.run(query, targetLanguage, nativeLanguage)
                .map(StageSignal::ofDetailed)
                .onErrorResume(e -> {
                    state.detailedFailure = e;
                    ExternalApiLogger.logApiCallFailure(log, "detailed stage", query, e.getMessage());
                    return Flux.empty();
                });

            return Flux.merge(basic.flux(), detailed)
                .concatMap(signal -> Mono.justOrEmpty(apply(state, signal)))
                .concatWith(Mono.defer(() -> finish(state, query)));
        });
    }

    private GenerationUpdate apply(TwoStageState state, StageSignal signal) {
        if (signal.basic()) {
            state.basicData = signal.data();
            state.tokensUsed += signal.tokensUsed();
            state.current = merger.merge(state.current, signal.data());
            return emit(state, BASIC_PROGRESS);
        }

        GenerationUpdate update = signal.update();
        state.detailedData = merger.merge(state.detailedData, update.data());
        state.current = merger.merge(state.current, update.data());
        if (update.done()) {
            state.tokensUsed += update.tokensUsed();
            return null;
        }
        return emit(state, rescaleDetailed(update.progress()));
    }

    private GenerationUpdate emit(TwoStageState state, int progress) {
        state.reportedProgress = Math.max(state.reportedProgress, progress);
        return GenerationUpdate.progress(state.reportedProgress, state.current);
    }

    private Mono<GenerationUpdate> finish(TwoStageState state, String query) {
        if (state.basicData == null) {
            return Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                "Basic stage finished without data for '" + query + "'"));
        }
        ObjectNode merged = merger.merge(state.basicData, state.detailedData);
        if (state.detailedFailure != null) {
            log.info("Returning basic result with partial detail for '{}' after detailed stage failed", query);
        }
        ExternalApiLogger.logApiCallSuccess(log, "two-stage word detail", query, state.tokensUsed);
        return Mono.just(GenerationUpdate.completed(merged, state.tokensUsed));
    }

    private static Mono<ObjectNode> asObject(JsonNode node, String stage) {
        if (node instanceof ObjectNode object) {
            return Mono.just(object);
        }
        return Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
            stage + " stage returned " + (node == null ? "nothing" : node.getNodeType()) + " instead of an object"));
    }

    private record StageSignal(boolean basic, ObjectNode data, int tokensUsed, GenerationUpdate update) {
        static StageSignal ofBasic(ObjectNode data, int tokensUsed) {
            return new StageSignal(true, data, tokensUsed, null);
        }

        static StageSignal ofDetailed(GenerationUpdate update) {
            return new StageSignal(false, update.data(), 0, update);
        }
    }

    // Flux.merge serializes signals, so no further synchronization
    private static final class TwoStageState {
        private ObjectNode current = JsonNodeFactory.instance.objectNode();
        private ObjectNode basicData;
        private ObjectNode detailedData = JsonNodeFactory.instance.objectNode();
        private int reportedProgress;
        private int tokensUsed;
        private Throwable detailedFailure;
    }
}

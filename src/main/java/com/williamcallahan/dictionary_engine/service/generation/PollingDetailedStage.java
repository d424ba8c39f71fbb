package com.williamcallahan.dictionary_engine.service.generation;

import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import reactor.core.publisher.Flux;

/**
 * Detailed stage backed by a progressive task followed with {@link TaskPoller}.
 */
public class PollingDetailedStage implements DetailedStage {

    private final TaskPoller taskPoller;
    private final GenerationApiClient apiClient;
    private final PromptFactory prompts;

    public PollingDetailedStage(TaskPoller taskPoller, GenerationApiClient apiClient, PromptFactory prompts) {
        this.taskPoller = taskPoller;
        this.apiClient = apiClient;
        this.prompts = prompts;
    }

    @Override
    public Flux<GenerationUpdate> run(String word, String targetLanguage, String nativeLanguage) {
        return taskPoller.run(prompts.detailedInfo(word, targetLanguage, nativeLanguage), apiClient.defaultModelConfig());
    }
}

package com.williamcallahan.dictionary_engine.config;

import com.williamcallahan.dictionary_engine.service.generation.DetailedStage;
import com.williamcallahan.dictionary_engine.service.generation.GenerationApiClient;
import com.williamcallahan.dictionary_engine.service.generation.PartialMerger;
import com.williamcallahan.dictionary_engine.service.generation.PollingDetailedStage;
import com.williamcallahan.dictionary_engine.service.generation.PromptFactory;
import com.williamcallahan.dictionary_engine.service.generation.StreamingDetailedStage;
import com.williamcallahan.dictionary_engine.service.generation.TaskPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects how the detailed half of a dictionary lookup reaches the backend.
 * {@code app.generation.detailed-mode=polling} follows a progressive task,
 * {@code streaming} reads the additional-details SSE stream.
 */
@Configuration
public class GenerationConfig {

    private static final Logger logger = LoggerFactory.getLogger(GenerationConfig.class);

    @Bean
    public DetailedStage detailedStage(AppConfigurationProperties properties,
                                       TaskPoller taskPoller,
                                       GenerationApiClient apiClient,
                                       PromptFactory prompts,
                                       PartialMerger merger) {
        AppConfigurationProperties.Generation.DetailedMode mode = properties.getGeneration().getDetailedMode();
        logger.info("Detailed word lookups use {} mode", mode);
        if (mode == AppConfigurationProperties.Generation.DetailedMode.STREAMING) {
            return new StreamingDetailedStage(apiClient, prompts, merger);
        }
        return new PollingDetailedStage(taskPoller, apiClient, prompts);
    }
}

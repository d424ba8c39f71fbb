/**
 * Drives a progressive generation task from start to a terminal state
 *
 * @author William Callahan
 *
 * Features:
 * - Starts the task, then polls its status at a fixed interval
 * - Emits a GenerationUpdate only when progress strictly increases, so subscribers see
 *   a non-decreasing sequence ending with a done update
 * - HTTP 429 waits out a cooldown and polls again without counting as a failure
 * - HTTP 404 after the high-water mark with a known partial is tolerated for a bounded number
 *   of consecutive polls; the last one synthesizes completion from that partial
 * - Overall wall-clock ceiling independent of the poll interval
 */

package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.GenerationTask;
import com.williamcallahan.dictionary_engine.model.ModelConfig;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import com.williamcallahan.dictionary_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
@Slf4j
public class TaskPoller {

    private final GenerationApiClient apiClient;
    private final AppConfigurationProperties.Poller settings;

    public TaskPoller(GenerationApiClient apiClient, AppConfigurationProperties properties) {
        this.apiClient = apiClient;
        this.settings = properties.getPoller();
    }

    /**
     * Starts a progressive task and follows it to completion
     *
     * @param prompt generation prompt
     * @param config model settings
     * @return progress updates, the last one with done set
     */
    public Flux<GenerationUpdate> run(String prompt, ModelConfig config) {
        return apiClient.startProgressiveTask(prompt, config)
            .flatMapMany(this::follow);
    }

    /**
     * Polls an already started task
     */
    public Flux<GenerationUpdate> follow(String taskId) {
        return Flux.defer(() -> {
            PollState state = new PollState(taskId);

            Flux<GenerationUpdate> updates = Mono.defer(() -> pollOnce(state))
                .delaySubscription(settings.getInterval())
                .repeat()
                .takeUntil(PollStep::terminal)
                .concatMapIterable(PollStep::updates);

            return updates
                .takeUntilOther(Mono.delay(settings.getOverallTimeout()))
                .concatWith(Mono.defer(() -> state.finished
                    ? Mono.empty()
                    : Mono.error(new GenerationException(ErrorClassification.TIMEOUT,
                        "Task " + taskId + " did not finish within " + settings.getOverallTimeout()))));
        });
    }

    private Mono<PollStep> pollOnce(PollState state) {
        return apiClient.getTask(state.taskId)
            .flatMap(task -> handleTask(state, task))
            .onErrorResume(TaskPoller::isSoftFailure, e -> handleSoftFailure(state, (GenerationException) e));
    }

    private Mono<PollStep> handleTask(PollState state, GenerationTask task) {
        state.consecutiveNotFound = 0;
        int progress = Math.max(0, Math.min(100, task.getProgress()));
        ExternalApiLogger.logPollProgress(log, state.taskId, String.valueOf(task.getStatus()), progress);

        if (task.getStatus() == GenerationTask.Status.ERROR) {
            String message = task.getError() != null && !task.getError().isBlank() ? task.getError() : "Generation failed";
            return Mono.error(new GenerationException(ErrorClassification.GENERATION_FAILED, message));
        }

        if (task.getStatus() == GenerationTask.Status.COMPLETED) {
            ObjectNode finalData = task.hasPartialData() ? task.getPartialData() : state.lastPartial;
            state.finished = true;
            return Mono.just(new PollStep(List.of(GenerationUpdate.completed(finalData, task.getTokensUsed())), true));
        }

        if (progress > state.lastProgress) {
            state.lastProgress = progress;
            if (task.hasPartialData()) {
                state.lastPartial = task.getPartialData();
            }
            return Mono.just(new PollStep(List.of(GenerationUpdate.progress(progress, state.lastPartial)), false));
        }
        return Mono.just(PollStep.PENDING);
    }

    private Mono<PollStep> handleSoftFailure(PollState state, GenerationException failure) {
        if (failure.is(ErrorClassification.RATE_LIMITED)) {
            log.warn("Task {} status rate limited, cooling down for {}", state.taskId, settings.getRateLimitCooldown());
            return Mono.delay(settings.getRateLimitCooldown()).thenReturn(PollStep.PENDING);
        }

        boolean tolerated = state.lastProgress >= settings.getNotFoundHighWaterMark() && state.lastPartial != null;
        if (!tolerated) {
            return Mono.error(new GenerationException(ErrorClassification.TASK_NOT_FOUND,
                "Task " + state.taskId + " not found at progress " + state.lastProgress, 404, failure));
        }

        state.consecutiveNotFound++;
        if (state.consecutiveNotFound >= settings.getNotFoundRetryBudget()) {
            log.info("Task {} evicted after reaching {}%, using last partial result as final", state.taskId, state.lastProgress);
            state.finished = true;
            return Mono.just(new PollStep(List.of(GenerationUpdate.synthesizedCompletion(state.lastPartial)), true));
        }
        log.debug("Task {} not found ({}/{}), polling again", state.taskId,
            state.consecutiveNotFound, settings.getNotFoundRetryBudget());
        return Mono.just(PollStep.PENDING);
    }

    private static boolean isSoftFailure(Throwable throwable) {
        return throwable instanceof GenerationException ge
            && (ge.is(ErrorClassification.RATE_LIMITED) || ge.is(ErrorClassification.TASK_NOT_FOUND));
    }

    private record PollStep(List<GenerationUpdate> updates, boolean terminal) {
        static final PollStep PENDING = new PollStep(List.of(), false);
    }

    // Confined to one subscription; repeat() serializes every access
    private static final class PollState {
        private final String taskId;
        private int lastProgress = -1;
        private ObjectNode lastPartial;
        private int consecutiveNotFound;
        private volatile boolean finished;

        private PollState(String taskId) {
            this.taskId = taskId;
        }
    }
}

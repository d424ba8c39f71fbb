/**
 * Test suite for TaskPoller, driven on virtual time
 *
 * @author William Callahan
 */
package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.GenerationTask;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskPollerTest {

    private static final String TASK_ID = "task-1";

    @Mock
    private GenerationApiClient apiClient;

    private AppConfigurationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AppConfigurationProperties();
    }

    private static ObjectNode partial(String field, String value) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(field, value);
        return node;
    }

    private static GenerationTask running(int progress, ObjectNode data) {
        return new GenerationTask(TASK_ID, GenerationTask.Status.RUNNING, progress, data);
    }

    private static GenerationTask completed(ObjectNode data, int tokens) {
        GenerationTask task = new GenerationTask(TASK_ID, GenerationTask.Status.COMPLETED, 100, data);
        task.setTokensUsed(tokens);
        return task;
    }

    private static Mono<GenerationTask> notFound() {
        return Mono.error(new GenerationException(ErrorClassification.TASK_NOT_FOUND, "task gone", 404, null));
    }

    @Test
    void follow_emitsStrictlyIncreasingProgress_thenCompletion() {
        ObjectNode first = partial("headword", "run");
        ObjectNode last = partial("examples", "x");
        when(apiClient.getTask(TASK_ID)).thenReturn(
            Mono.just(running(10, first)),
            Mono.just(running(10, first)),
            Mono.just(running(5, first)),
            Mono.just(running(40, null)),
            Mono.just(completed(last, 12)));

        List<GenerationUpdate> updates = new ArrayList<>();
        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .thenAwait(Duration.ofSeconds(5))
            .recordWith(() -> updates)
            .thenConsumeWhile(update -> true)
            .verifyComplete();

        assertEquals(List.of(10, 40, 100), updates.stream().map(GenerationUpdate::progress).toList());
        assertEquals(first, updates.get(1).data(), "progress without new data keeps the last partial");
        GenerationUpdate done = updates.get(2);
        assertTrue(done.done());
        assertFalse(done.synthesized());
        assertEquals(last, done.data());
        assertEquals(12, done.tokensUsed());
    }

    @Test
    void follow_waitsForPollInterval_beforeEachStatusRequest() {
        when(apiClient.getTask(TASK_ID)).thenReturn(Mono.just(completed(partial("a", "b"), 1)));

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .expectSubscription()
            .expectNoEvent(Duration.ofMillis(499))
            .thenAwait(Duration.ofMillis(1))
            .expectNextMatches(GenerationUpdate::done)
            .verifyComplete();
    }

    @Test
    void follow_coolsDownAfterRateLimit_andKeepsPolling() {
        when(apiClient.getTask(TASK_ID)).thenReturn(
            Mono.just(running(20, partial("a", "1"))),
            Mono.error(new GenerationException(ErrorClassification.RATE_LIMITED, "slow down", 429, null)),
            Mono.just(running(50, partial("a", "2"))),
            Mono.just(completed(partial("a", "3"), 3)));

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .thenAwait(Duration.ofMillis(500))
            .expectNextMatches(update -> update.progress() == 20)
            // 429 at 1.0s, cooldown 1s, next poll 0.5s later
            .expectNoEvent(Duration.ofMillis(1900))
            .thenAwait(Duration.ofMillis(600))
            .expectNextMatches(update -> update.progress() == 50)
            .thenAwait(Duration.ofMillis(500))
            .expectNextMatches(update -> update.done() && "3".equals(update.data().path("a").asText()))
            .verifyComplete();
    }

    @Test
    void follow_synthesizesCompletion_whenTaskEvictedAfterHighWaterMark() {
        ObjectNode lastPartial = partial("hint", "almost there");
        when(apiClient.getTask(TASK_ID)).thenReturn(
            Mono.just(running(80, lastPartial)),
            notFound(),
            notFound(),
            notFound());

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .thenAwait(Duration.ofSeconds(3))
            .expectNextMatches(update -> update.progress() == 80)
            .expectNextMatches(update -> update.done()
                && update.synthesized()
                && update.progress() == 100
                && update.data().equals(lastPartial))
            .verifyComplete();

        verify(apiClient, times(4)).getTask(TASK_ID);
    }

    @Test
    void follow_resetsNotFoundCount_whenTaskReappears() {
        ObjectNode lastPartial = partial("hint", "h");
        when(apiClient.getTask(TASK_ID)).thenReturn(
            Mono.just(running(80, lastPartial)),
            notFound(),
            notFound(),
            Mono.just(running(90, lastPartial)),
            notFound(),
            Mono.just(completed(partial("hint", "final"), 7)));

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .thenAwait(Duration.ofSeconds(5))
            .expectNextMatches(update -> update.progress() == 80)
            .expectNextMatches(update -> update.progress() == 90)
            .expectNextMatches(update -> update.done() && !update.synthesized())
            .verifyComplete();
    }

    @Test
    void follow_failsWithTaskNotFound_whenEvictedBeforeHighWaterMark() {
        when(apiClient.getTask(TASK_ID)).thenReturn(
            Mono.just(running(50, partial("a", "b"))),
            notFound());

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .thenAwait(Duration.ofSeconds(2))
            .expectNextMatches(update -> update.progress() == 50)
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.TASK_NOT_FOUND))
            .verify();
    }

    @Test
    void follow_failsWithTaskNotFound_whenNoPartialWasEverSeen() {
        when(apiClient.getTask(TASK_ID)).thenReturn(
            Mono.just(running(90, null)),
            notFound());

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .thenAwait(Duration.ofSeconds(2))
            .expectNextMatches(update -> update.progress() == 90)
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.TASK_NOT_FOUND))
            .verify();
    }

    @Test
    void follow_failsWithGenerationFailed_whenTaskReportsError() {
        GenerationTask failed = new GenerationTask(TASK_ID, GenerationTask.Status.ERROR, 30, null);
        failed.setError("model refused");
        when(apiClient.getTask(TASK_ID)).thenReturn(Mono.just(failed));

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .thenAwait(Duration.ofSeconds(1))
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.GENERATION_FAILED)
                && "model refused".equals(ge.getMessage()))
            .verify();
    }

    @Test
    void follow_failsWithTimeout_whenTaskNeverFinishes() {
        when(apiClient.getTask(TASK_ID)).thenReturn(Mono.just(running(10, partial("a", "b"))));

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).follow(TASK_ID))
            .thenAwait(Duration.ofSeconds(1))
            .expectNextMatches(update -> update.progress() == 10)
            .thenAwait(Duration.ofSeconds(60))
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.TIMEOUT))
            .verify();
    }

    @Test
    void run_startsTaskThenFollowsIt() {
        when(apiClient.startProgressiveTask("prompt", null)).thenReturn(Mono.just(TASK_ID));
        when(apiClient.getTask(TASK_ID)).thenReturn(Mono.just(completed(partial("a", "b"), 2)));

        StepVerifier.withVirtualTime(() -> new TaskPoller(apiClient, properties).run("prompt", null))
            .thenAwait(Duration.ofSeconds(1))
            .expectNextMatches(GenerationUpdate::done)
            .verifyComplete();
    }
}

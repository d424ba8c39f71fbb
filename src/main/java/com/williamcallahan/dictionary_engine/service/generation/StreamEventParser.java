/**
 * Incremental decoder for Server-Sent Events generation streams
 *
 * @author William Callahan
 *
 * Features:
 * - Buffers raw bytes until a full line terminator arrives, so chunk boundaries may fall anywhere
 *   (mid-line or inside a multi-byte UTF-8 character)
 * - Only "data:" lines carry payloads; the [DONE] sentinel is swallowed
 * - Malformed JSON frames are logged and skipped without ending the stream
 * - At most one terminal event (complete or error) is emitted; anything after it is ignored
 * - One instance per stream; use {@link #decode} to get a fresh parser per subscription
 */

package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.dictionary_engine.types.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class StreamEventParser {

    static final String DATA_PREFIX = "data:";
    static final String DONE_SENTINEL = "[DONE]";

    private final ObjectMapper objectMapper;
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();
    private boolean terminated;

    public StreamEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes a response body into typed events, completing after the first terminal event
     *
     * @param body raw SSE body as delivered by WebClient
     * @param objectMapper mapper used for frame payloads
     * @return lazily decoded events; each subscription gets its own parser
     */
    public static Flux<StreamEvent> decode(Flux<DataBuffer> body, ObjectMapper objectMapper) {
        return Flux.defer(() -> {
            StreamEventParser parser = new StreamEventParser(objectMapper);
            return body
                .concatMapIterable(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return parser.feed(bytes);
                })
                .concatWith(Flux.defer(() -> Flux.fromIterable(parser.finish())))
                .takeUntil(StreamEvent::isTerminal);
        });
    }

    public List<StreamEvent> feed(String text) {
        return feed(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Appends a network chunk and returns the events completed by it
     */
    public List<StreamEvent> feed(byte[] chunk) {
        List<StreamEvent> events = new ArrayList<>();
        for (byte b : chunk) {
            if (b == '\n') {
                handleLine(drainLine(), events);
            } else {
                lineBuffer.write(b);
            }
        }
        return events;
    }

    /**
     * Flushes a trailing line that was never newline-terminated
     */
    public List<StreamEvent> finish() {
        List<StreamEvent> events = new ArrayList<>();
        if (lineBuffer.size() > 0) {
            handleLine(drainLine(), events);
        }
        return events;
    }

    public boolean isTerminated() {
        return terminated;
    }

    private String drainLine() {
        String line = lineBuffer.toString(StandardCharsets.UTF_8);
        lineBuffer.reset();
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }

    private void handleLine(String line, List<StreamEvent> events) {
        if (terminated || !line.startsWith(DATA_PREFIX)) {
            return;
        }
        String payload = line.substring(DATA_PREFIX.length());
        if (payload.startsWith(" ")) {
            payload = payload.substring(1);
        }
        if (payload.isEmpty() || DONE_SENTINEL.equals(payload.trim())) {
            return;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed SSE frame ({} chars): {}", payload.length(), e.getOriginalMessage());
            return;
        }

        StreamEvent event = toEvent(node);
        if (event == null) {
            return;
        }
        events.add(event);
        if (event.isTerminal()) {
            terminated = true;
        }
    }

    private StreamEvent toEvent(JsonNode node) {
        String type = node.path("type").asText("");
        switch (type) {
            case "section":
                return new StreamEvent.Section(node.path("section").asText(""), node.get("data"));
            case "chunk":
                return new StreamEvent.Chunk(node.hasNonNull("text") ? node.get("text").asText() : node.path("content").asText(""));
            case "complete":
                return new StreamEvent.Complete(node.get("data"), node.path("tokensUsed").asInt(0));
            case "error":
                String message = node.hasNonNull("message") ? node.get("message").asText() : node.path("error").asText("Generation failed");
                return new StreamEvent.Error(message);
            default:
                // progress frames and anything newer carry nothing we merge
                log.trace("Ignoring SSE frame of type '{}'", type);
                return null;
        }
    }
}

/**
 * Typed events decoded from a Server-Sent Events generation stream
 *
 * @author William Callahan
 *
 * Features:
 * - Section events carry one named block of a structured result
 * - Chunk events carry free text
 * - Complete and Error are the only terminal variants
 */

package com.williamcallahan.dictionary_engine.types;

import com.fasterxml.jackson.databind.JsonNode;

public sealed interface StreamEvent
        permits StreamEvent.Section, StreamEvent.Chunk, StreamEvent.Complete, StreamEvent.Error {

    boolean isTerminal();

    record Section(String section, JsonNode data) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    record Chunk(String text) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    record Complete(JsonNode data, int tokensUsed) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Error(String message) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}

/**
 * One step of a progressive generation: progress plus the partial result known so far
 *
 * @author William Callahan
 *
 * Features:
 * - Emitted in non-decreasing progress order by the poller and the two-stage orchestrator
 * - The last update of a successful operation has done set
 * - Synthesized marks a completion rebuilt from the last partial after the task was evicted
 */

package com.williamcallahan.dictionary_engine.types;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record GenerationUpdate(int progress, ObjectNode data, int tokensUsed, boolean done, boolean synthesized) {

    public GenerationUpdate {
        data = data == null ? JsonNodeFactory.instance.objectNode() : data.deepCopy();
    }

    public static GenerationUpdate progress(int progress, ObjectNode data) {
        return new GenerationUpdate(progress, data, 0, false, false);
    }

    public static GenerationUpdate completed(ObjectNode data, int tokensUsed) {
        return new GenerationUpdate(100, data, tokensUsed, true, false);
    }

    public static GenerationUpdate synthesizedCompletion(ObjectNode lastPartial) {
        return new GenerationUpdate(100, lastPartial, 0, true, true);
    }
}

/**
 * Snapshot of a server-side generation task as returned by the status endpoint
 *
 * @author William Callahan
 *
 * Features:
 * - Mutated only by deserializing the latest poll response
 * - Partial data is kept as a JSON object so it can be merged field by field
 * - Unknown fields from newer backends are ignored
 */

package com.williamcallahan.dictionary_engine.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerationTask {

    private String id;
    private Status status;
    private int progress;
    private ObjectNode partialData;
    private int tokensUsed;
    private String error;

    public GenerationTask(String id, Status status, int progress, ObjectNode partialData) {
        this.id = id;
        this.status = status;
        this.progress = progress;
        this.partialData = partialData;
    }

    public boolean hasPartialData() {
        return partialData != null && !partialData.isEmpty();
    }

    public enum Status {
        // Older backends report pending/generating
        @JsonProperty("queued") @JsonAlias("pending") QUEUED,
        @JsonProperty("running") @JsonAlias("generating") RUNNING,
        @JsonProperty("completed") COMPLETED,
        @JsonProperty("error") ERROR
    }
}

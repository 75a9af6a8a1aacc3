package com.agentic.customergraph.api;

import com.agentic.customergraph.storage.GraphDatabase.GraphRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphRecordResponse(
    @JsonProperty("id") String id,
    @JsonProperty("kind") String kind,
    @JsonProperty("type") String type,
    @JsonProperty("from_id") String fromId,
    @JsonProperty("to_id") String toId,
    @JsonProperty("properties") Map<String, Object> properties
) {

    public static GraphRecordResponse of(final GraphRecord record) {
        return new GraphRecordResponse(
            record.id(),
            record.kind().name(),
            record.type(),
            record.fromId(),
            record.toId(),
            record.properties());
    }
}

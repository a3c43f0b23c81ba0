package com.example.snapshotcompare.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffSummary(
        @JsonProperty("total_added") int totalAdded,
        @JsonProperty("total_removed") int totalRemoved,
        @JsonProperty("total_changed") int totalChanged,
        @JsonProperty("baseline_file") String baselineFile,
        @JsonProperty("current_file") String currentFile,
        @JsonProperty("error") String error) {

    public boolean failed() {
        return error != null;
    }
}

package com.vecgate.plugin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** File processing counts of a vector store. */
public final class FileCounts {

    public static final FileCounts ZERO = new FileCounts(0, 0, 0, 0, 0);

    private final long inProgress;
    private final long completed;
    private final long failed;
    private final long cancelled;
    private final long total;

    @JsonCreator
    public FileCounts(
            @JsonProperty("in_progress") long inProgress,
            @JsonProperty("completed") long completed,
            @JsonProperty("failed") long failed,
            @JsonProperty("cancelled") long cancelled,
            @JsonProperty("total") long total) {
        this.inProgress = inProgress;
        this.completed = completed;
        this.failed = failed;
        this.cancelled = cancelled;
        this.total = total;
    }

    @JsonProperty("in_progress")
    public long getInProgress() {
        return inProgress;
    }

    @JsonProperty("completed")
    public long getCompleted() {
        return completed;
    }

    @JsonProperty("failed")
    public long getFailed() {
        return failed;
    }

    @JsonProperty("cancelled")
    public long getCancelled() {
        return cancelled;
    }

    @JsonProperty("total")
    public long getTotal() {
        return total;
    }
}

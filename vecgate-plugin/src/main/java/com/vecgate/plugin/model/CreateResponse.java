package com.vecgate.plugin.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Acknowledgment of a vector store creation. Providers that return no store metadata synthesize it;
 * {@code id} and {@code name} are then filled by the caller via {@link #withIdAndName(String, String)}.
 */
public final class CreateResponse {

    public static final String OBJECT = "vector_store";
    public static final String STATUS_COMPLETED = "completed";

    private final String id;
    private final long createdAt;
    private final String name;
    private final long bytes;
    private final FileCounts fileCounts;
    private final String status;
    private final Map<String, Object> expiresAfter;
    private final Long expiresAt;
    private final Long lastActiveAt;
    private final Map<String, Object> metadata;

    private CreateResponse(Builder b) {
        this.id = b.id != null ? b.id : "";
        this.createdAt = b.createdAt;
        this.name = b.name != null ? b.name : "";
        this.bytes = b.bytes;
        this.fileCounts = b.fileCounts != null ? b.fileCounts : FileCounts.ZERO;
        this.status = b.status != null ? b.status : STATUS_COMPLETED;
        this.expiresAfter = b.expiresAfter;
        this.expiresAt = b.expiresAt;
        this.lastActiveAt = b.lastActiveAt;
        this.metadata = b.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy of this response with the given id and name. */
    public CreateResponse withIdAndName(String id, String name) {
        return toBuilder().id(id).name(name).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .createdAt(createdAt)
                .name(name)
                .bytes(bytes)
                .fileCounts(fileCounts)
                .status(status)
                .expiresAfter(expiresAfter)
                .expiresAt(expiresAt)
                .lastActiveAt(lastActiveAt)
                .metadata(metadata);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("object")
    public String getObject() {
        return OBJECT;
    }

    /** Creation time in epoch seconds (UTC). */
    @JsonProperty("created_at")
    public long getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("bytes")
    public long getBytes() {
        return bytes;
    }

    @JsonProperty("file_counts")
    public FileCounts getFileCounts() {
        return fileCounts;
    }

    @JsonProperty("status")
    public String getStatus() {
        return status;
    }

    @JsonProperty("expires_after")
    public Map<String, Object> getExpiresAfter() {
        return expiresAfter;
    }

    @JsonProperty("expires_at")
    public Long getExpiresAt() {
        return expiresAt;
    }

    @JsonProperty("last_active_at")
    public Long getLastActiveAt() {
        return lastActiveAt;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public static final class Builder {
        private String id;
        private long createdAt;
        private String name;
        private long bytes;
        private FileCounts fileCounts;
        private String status;
        private Map<String, Object> expiresAfter;
        private Long expiresAt;
        private Long lastActiveAt;
        private Map<String, Object> metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder createdAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder bytes(long bytes) {
            this.bytes = bytes;
            return this;
        }

        public Builder fileCounts(FileCounts fileCounts) {
            this.fileCounts = fileCounts;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder expiresAfter(Map<String, Object> expiresAfter) {
            this.expiresAfter = expiresAfter;
            return this;
        }

        public Builder expiresAt(Long expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder lastActiveAt(Long lastActiveAt) {
            this.lastActiveAt = lastActiveAt;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public CreateResponse build() {
            return new CreateResponse(this);
        }
    }
}

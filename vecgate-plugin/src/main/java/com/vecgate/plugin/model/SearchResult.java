package com.vecgate.plugin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One hit of a vector store search: score, content blocks, source id, optional filename and
 * provider metadata (attributes).
 */
public final class SearchResult {

    private final double score;
    private final List<ResultContent> content;
    private final String fileId;
    private final String filename;
    private final Map<String, Object> attributes;

    @JsonCreator
    public SearchResult(
            @JsonProperty("score") double score,
            @JsonProperty("content") List<ResultContent> content,
            @JsonProperty("file_id") String fileId,
            @JsonProperty("filename") String filename,
            @JsonProperty("attributes") Map<String, Object> attributes) {
        this.score = score;
        this.content = content != null ? List.copyOf(content) : List.of();
        this.fileId = fileId;
        this.filename = filename;
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
    }

    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    @JsonProperty("content")
    public List<ResultContent> getContent() {
        return content;
    }

    @JsonProperty("file_id")
    public String getFileId() {
        return fileId;
    }

    /** Null when the provider has no file concept. */
    @JsonProperty("filename")
    public String getFilename() {
        return filename;
    }

    /** Provider metadata; values may be null. */
    @JsonProperty("attributes")
    public Map<String, Object> getAttributes() {
        return attributes;
    }
}

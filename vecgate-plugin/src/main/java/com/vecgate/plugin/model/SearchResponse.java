package com.vecgate.plugin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Uniform search response envelope: a page of results for one query.
 */
public final class SearchResponse {

    public static final String OBJECT = "vector_store.search_results.page";

    private final String object;
    private final String searchQuery;
    private final List<SearchResult> data;

    @JsonCreator
    public SearchResponse(
            @JsonProperty("object") String object,
            @JsonProperty("search_query") String searchQuery,
            @JsonProperty("data") List<SearchResult> data) {
        this.object = object != null ? object : OBJECT;
        this.searchQuery = searchQuery != null ? searchQuery : "";
        this.data = data != null ? List.copyOf(data) : List.of();
    }

    public static SearchResponse page(String searchQuery, List<SearchResult> data) {
        return new SearchResponse(OBJECT, searchQuery, data);
    }

    @JsonProperty("object")
    public String getObject() {
        return object;
    }

    @JsonProperty("search_query")
    public String getSearchQuery() {
        return searchQuery;
    }

    @JsonProperty("data")
    public List<SearchResult> getData() {
        return data;
    }
}

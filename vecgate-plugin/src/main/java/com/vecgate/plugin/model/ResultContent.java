package com.vecgate.plugin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One content block of a search result. */
public final class ResultContent {

    public static final String TYPE_TEXT = "text";

    private final String text;
    private final String type;

    @JsonCreator
    public ResultContent(@JsonProperty("text") String text, @JsonProperty("type") String type) {
        this.text = text != null ? text : "";
        this.type = type != null ? type : TYPE_TEXT;
    }

    public static ResultContent text(String text) {
        return new ResultContent(text, TYPE_TEXT);
    }

    public String getText() {
        return text;
    }

    public String getType() {
        return type;
    }
}

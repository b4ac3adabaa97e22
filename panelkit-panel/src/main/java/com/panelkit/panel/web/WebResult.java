package com.panelkit.panel.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a web-mirror call: a neutral document on success, a message otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebResult(boolean success, JsonNode data, String error) {

    public static WebResult ok(JsonNode data) {
        return new WebResult(true, data, null);
    }

    public static WebResult fail(String error) {
        return new WebResult(false, null, error);
    }
}

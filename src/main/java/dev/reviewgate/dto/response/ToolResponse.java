package dev.reviewgate.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a tool invocation. Failures carry a human-readable message instead of an
 * HTTP error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResponse(String operation, boolean success, String message, Object data) {

    public static ToolResponse ok(String operation, String message, Object data) {
        return new ToolResponse(operation, true, message, data);
    }

    public static ToolResponse error(String operation, String message) {
        return new ToolResponse(operation, false, message, null);
    }
}

package ai.jira.adapter.tools;

import java.util.Objects;

/**
 * Plain-text outcome of a named operation. Failures are reported here rather than thrown.
 */
public record ToolResponse(String text, boolean error) {

    public ToolResponse {
        text = Objects.requireNonNull(text, "text");
    }

    public static ToolResponse success(String text) {
        return new ToolResponse(text, false);
    }

    public static ToolResponse failure(String text) {
        return new ToolResponse(text, true);
    }
}

package ai.jira.adapter.jira;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * New issue to create. {@code description} is markdown; it is converted to ADF before sending.
 *
 * @param additionalFields raw issue fields merged into the request last, overriding the typed ones
 */
public record IssueDraft(
        String projectKey,
        String summary,
        String description,
        String issueType,
        Optional<String> assignee,
        Map<String, Object> additionalFields
) {

    public static final String DEFAULT_ISSUE_TYPE = "Task";

    public IssueDraft {
        projectKey = requireNonBlank(projectKey, "projectKey");
        summary = requireNonBlank(summary, "summary");
        description = description == null ? "" : description;
        issueType = issueType == null || issueType.isBlank() ? DEFAULT_ISSUE_TYPE : issueType;
        assignee = assignee == null ? Optional.empty() : assignee.filter(value -> !value.isBlank());
        additionalFields = additionalFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields));
    }

    private static String requireNonBlank(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}

package ai.jira.adapter.jira;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Partial update of an existing issue; only present values are sent.
 */
public record IssueUpdate(
        Optional<String> summary,
        Optional<String> description,
        Optional<String> issueType,
        Optional<String> assignee,
        Map<String, Object> additionalFields
) {

    public IssueUpdate {
        summary = summary == null ? Optional.empty() : summary;
        description = description == null ? Optional.empty() : description;
        issueType = issueType == null ? Optional.empty() : issueType.filter(value -> !value.isBlank());
        assignee = assignee == null ? Optional.empty() : assignee.filter(value -> !value.isBlank());
        additionalFields = additionalFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields));
    }

    public boolean isEmpty() {
        return summary.isEmpty()
                && description.isEmpty()
                && issueType.isEmpty()
                && assignee.isEmpty()
                && additionalFields.isEmpty();
    }
}

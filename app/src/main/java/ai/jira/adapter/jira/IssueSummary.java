package ai.jira.adapter.jira;

import java.util.Optional;

/**
 * One search hit, reduced to the fields shown to users. {@code description} is plain text.
 */
public record IssueSummary(
        String key,
        String summary,
        String project,
        String issueType,
        String status,
        String priority,
        Optional<String> assignee,
        String created,
        String updated,
        Optional<String> description,
        String url
) {

    public IssueSummary {
        assignee = assignee == null ? Optional.empty() : assignee;
        description = description == null ? Optional.empty() : description;
    }
}

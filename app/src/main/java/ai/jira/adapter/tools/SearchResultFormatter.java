package ai.jira.adapter.tools;

import ai.jira.adapter.jira.IssueSummary;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders search hits as the markdown-ish text block returned to callers.
 */
public class SearchResultFormatter {

    private static final String MISSING = "N/A";

    public String format(String query, List<IssueSummary> issues) {
        Objects.requireNonNull(query, "query");
        if (issues == null || issues.isEmpty()) {
            return "No issues found for query: " + query;
        }
        return "Found " + issues.size() + " issues:\n\n"
                + issues.stream().map(this::formatIssue).collect(Collectors.joining("\n\n"));
    }

    String formatIssue(IssueSummary issue) {
        StringBuilder builder = new StringBuilder();
        builder.append("**").append(issue.key()).append("**: ").append(issue.summary()).append('\n');
        builder.append("  - **Project**: ").append(orMissing(issue.project())).append('\n');
        builder.append("  - **Type**: ").append(orMissing(issue.issueType())).append('\n');
        builder.append("  - **Status**: ").append(orMissing(issue.status())).append('\n');
        builder.append("  - **Priority**: ").append(orMissing(issue.priority())).append('\n');
        builder.append("  - **Assignee**: ").append(issue.assignee().orElse("Unassigned")).append('\n');
        builder.append("  - **Created**: ").append(orMissing(issue.created())).append('\n');
        builder.append("  - **Updated**: ").append(orMissing(issue.updated())).append('\n');
        builder.append("  - **URL**: ").append(issue.url());
        issue.description().ifPresent(description ->
                builder.append('\n').append("  - **Description**: ").append(description));
        return builder.toString();
    }

    private static String orMissing(String value) {
        return value == null || value.isBlank() ? MISSING : value;
    }
}

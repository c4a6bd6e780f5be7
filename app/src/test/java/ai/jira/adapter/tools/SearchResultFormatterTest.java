package ai.jira.adapter.tools;

import static org.assertj.core.api.Assertions.assertThat;

import ai.jira.adapter.jira.IssueSummary;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SearchResultFormatterTest {

    private final SearchResultFormatter formatter = new SearchResultFormatter();

    @Test
    void reportsEmptyResult() {
        assertThat(formatter.format("project = KAN", List.of())).isEqualTo("No issues found for query: project = KAN");
    }

    @Test
    void formatsEveryFieldAndDescription() {
        IssueSummary issue = new IssueSummary("KAN-1", "Login fails", "KAN", "Bug", "To Do", "High",
                Optional.of("Dana"), "2024-05-01", "2024-05-02", Optional.of("Steps here"),
                "https://x.atlassian.net/browse/KAN-1");

        assertThat(formatter.format("q", List.of(issue))).isEqualTo(String.join("\n",
                "Found 1 issues:",
                "",
                "**KAN-1**: Login fails",
                "  - **Project**: KAN",
                "  - **Type**: Bug",
                "  - **Status**: To Do",
                "  - **Priority**: High",
                "  - **Assignee**: Dana",
                "  - **Created**: 2024-05-01",
                "  - **Updated**: 2024-05-02",
                "  - **URL**: https://x.atlassian.net/browse/KAN-1",
                "  - **Description**: Steps here"));
    }

    @Test
    void fillsMissingValuesAndSeparatesIssues() {
        IssueSummary bare = new IssueSummary("KAN-2", "Bare", "", "", "", "", Optional.empty(), "", "",
                Optional.empty(), "https://x.atlassian.net/browse/KAN-2");

        String text = formatter.format("q", List.of(bare, bare));

        assertThat(text).startsWith("Found 2 issues:\n\n");
        assertThat(text).contains("  - **Project**: N/A\n", "  - **Assignee**: Unassigned\n");
        assertThat(text).doesNotContain("Description");
        assertThat(text.split("\n\n")).hasSize(3);
    }
}

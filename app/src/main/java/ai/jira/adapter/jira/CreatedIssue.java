package ai.jira.adapter.jira;

public record CreatedIssue(String id, String key, String url) {
}

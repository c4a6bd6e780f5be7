package ai.jira.adapter.jira;

public record CreatedComment(String id, String issueKey, String url) {
}

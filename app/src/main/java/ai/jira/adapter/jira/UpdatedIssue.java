package ai.jira.adapter.jira;

import java.util.List;

public record UpdatedIssue(String key, List<String> updatedFields, String url) {

    public UpdatedIssue {
        updatedFields = updatedFields == null ? List.of() : List.copyOf(updatedFields);
    }
}

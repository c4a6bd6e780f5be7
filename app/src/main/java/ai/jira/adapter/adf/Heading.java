package ai.jira.adapter.adf;

import java.util.List;

public record Heading(int level, List<TextRun> content) implements BlockNode {

    public Heading {
        content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public String type() {
        return "heading";
    }
}

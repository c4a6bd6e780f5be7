package ai.jira.adapter.adf;

import java.util.List;

public record Blockquote(List<BlockNode> content) implements BlockNode {

    public Blockquote {
        content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public String type() {
        return "blockquote";
    }
}

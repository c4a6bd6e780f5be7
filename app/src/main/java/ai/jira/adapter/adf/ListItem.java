package ai.jira.adapter.adf;

import java.util.List;

/**
 * Entry of a bullet or ordered list; usually a paragraph optionally followed by a nested list.
 */
public record ListItem(List<BlockNode> content) implements AdfNode {

    public ListItem {
        content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public String type() {
        return "listItem";
    }
}

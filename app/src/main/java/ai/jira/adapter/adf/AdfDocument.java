package ai.jira.adapter.adf;

import java.util.List;

/**
 * Root of an ADF tree, embedded verbatim as the value of a rich-text field.
 */
public record AdfDocument(int version, List<BlockNode> content) implements AdfNode {

    public static final int VERSION = 1;

    public AdfDocument {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static AdfDocument of(List<BlockNode> content) {
        return new AdfDocument(VERSION, content);
    }

    @Override
    public String type() {
        return "doc";
    }
}

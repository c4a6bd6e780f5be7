package ai.jira.adapter.adf;

import java.util.List;

/**
 * Table cell; header cells serialize as {@code tableHeader}.
 */
public record TableCell(boolean header, List<BlockNode> content) implements AdfNode {

    public TableCell {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static TableCell empty(boolean header) {
        return new TableCell(header, List.of(Paragraph.empty()));
    }

    @Override
    public String type() {
        return header ? "tableHeader" : "tableCell";
    }
}

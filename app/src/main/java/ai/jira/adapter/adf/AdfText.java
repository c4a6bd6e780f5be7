package ai.jira.adapter.adf;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Set;

/**
 * Flattens ADF content to plain text for display and diagnostics.
 */
public final class AdfText {

    private static final Set<String> TEXT_BLOCK_TYPES = Set.of("paragraph", "heading", "codeBlock");

    private AdfText() {
    }

    public static String plainText(AdfNode node) {
        StringBuilder builder = new StringBuilder();
        append(node, builder);
        return builder.toString().strip();
    }

    /**
     * Extracts text from an ADF value as returned by the REST API; plain strings pass through.
     */
    public static String plainText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        StringBuilder builder = new StringBuilder();
        appendJson(node, builder);
        return builder.toString().strip();
    }

    private static void append(AdfNode node, StringBuilder builder) {
        if (node instanceof TextRun run) {
            builder.append(run.text());
        } else if (node instanceof CodeBlock codeBlock) {
            builder.append(codeBlock.text());
            newline(builder);
        } else if (node instanceof Paragraph paragraph) {
            appendAll(paragraph.content(), builder);
            newline(builder);
        } else if (node instanceof Heading heading) {
            appendAll(heading.content(), builder);
            newline(builder);
        } else if (node instanceof AdfDocument document) {
            appendAll(document.content(), builder);
        } else if (node instanceof BulletList list) {
            appendAll(list.items(), builder);
        } else if (node instanceof OrderedList list) {
            appendAll(list.items(), builder);
        } else if (node instanceof ListItem item) {
            appendAll(item.content(), builder);
        } else if (node instanceof Blockquote blockquote) {
            appendAll(blockquote.content(), builder);
        } else if (node instanceof Table table) {
            appendAll(table.rows(), builder);
        } else if (node instanceof TableRow row) {
            appendAll(row.cells(), builder);
        } else if (node instanceof TableCell cell) {
            appendAll(cell.content(), builder);
        }
    }

    private static void appendAll(List<? extends AdfNode> nodes, StringBuilder builder) {
        for (AdfNode node : nodes) {
            append(node, builder);
        }
    }

    private static void appendJson(JsonNode node, StringBuilder builder) {
        String type = node.path("type").asText("");
        if ("text".equals(type)) {
            builder.append(node.path("text").asText(""));
            return;
        }
        if ("hardBreak".equals(type)) {
            builder.append('\n');
            return;
        }
        JsonNode content = node.path("content");
        if (content.isArray()) {
            for (JsonNode child : content) {
                appendJson(child, builder);
            }
        }
        if (TEXT_BLOCK_TYPES.contains(type)) {
            newline(builder);
        }
    }

    private static void newline(StringBuilder builder) {
        if (builder.length() > 0 && builder.charAt(builder.length() - 1) != '\n') {
            builder.append('\n');
        }
    }
}

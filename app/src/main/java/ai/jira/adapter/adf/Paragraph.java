package ai.jira.adapter.adf;

import java.util.List;

public record Paragraph(List<TextRun> content) implements BlockNode {

    public Paragraph {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static Paragraph empty() {
        return new Paragraph(List.of());
    }

    /**
     * Paragraph holding {@code text} verbatim as a single unmarked run.
     */
    public static Paragraph literal(String text) {
        if (text == null || text.isEmpty()) {
            return empty();
        }
        return new Paragraph(List.of(TextRun.plain(text)));
    }

    @Override
    public String type() {
        return "paragraph";
    }
}

package ai.jira.adapter.markdown;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-level helpers shared by the segmenter and the mapper.
 */
final class MarkdownLines {

    static final int TAB_WIDTH = 4;

    private MarkdownLines() {
    }

    static List<String> split(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        return List.of(normalized.split("\n", -1));
    }

    /**
     * Width of the leading whitespace in columns, tabs advancing to the next tab stop.
     */
    static int indentOf(String line) {
        int column = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                column++;
            } else if (ch == '\t') {
                column += TAB_WIDTH - (column % TAB_WIDTH);
            } else {
                break;
            }
        }
        return column;
    }

    /**
     * Removes up to {@code columns} columns of leading whitespace; a tab straddling the limit leaves its remainder as spaces.
     */
    static String stripIndent(String line, int columns) {
        int column = 0;
        int index = 0;
        while (index < line.length() && column < columns) {
            char ch = line.charAt(index);
            if (ch == ' ') {
                column++;
            } else if (ch == '\t') {
                int next = column + TAB_WIDTH - (column % TAB_WIDTH);
                if (next > columns) {
                    return " ".repeat(next - columns) + line.substring(index + 1);
                }
                column = next;
            } else {
                break;
            }
            index++;
        }
        return line.substring(index);
    }

    static boolean isQuote(String line) {
        return line.stripLeading().startsWith(">");
    }

    static String stripQuoteMarker(String line) {
        String rest = line.stripLeading().substring(1);
        if (!rest.isEmpty() && (rest.charAt(0) == ' ' || rest.charAt(0) == '\t')) {
            return rest.substring(1);
        }
        return rest;
    }

    static int countQuoteMarkers(String line) {
        int markers = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '>') {
                markers++;
            } else if (ch != ' ' && ch != '\t') {
                break;
            }
        }
        return markers;
    }

    /**
     * Strips every leading quote marker of every line, folding nested quotes into one level.
     */
    static String collapseQuoteMarkers(String content) {
        List<String> collapsed = new ArrayList<>();
        for (String line : split(content)) {
            String current = line;
            while (isQuote(current)) {
                current = stripQuoteMarker(current);
            }
            collapsed.add(current);
        }
        return String.join("\n", collapsed);
    }
}

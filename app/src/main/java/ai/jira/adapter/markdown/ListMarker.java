package ai.jira.adapter.markdown;

import java.util.Optional;

/**
 * Parsed list item marker ({@code -}, {@code *}, {@code +}, {@code 1.} or {@code 1)}) at the start of a line.
 *
 * @param indent        column of the marker
 * @param contentOffset column where the item's content starts; continuation lines are dedented by it
 * @param firstLine     text following the marker
 */
record ListMarker(boolean ordered, int number, int indent, int contentOffset, String firstLine) {

    private static final int MAX_ORDINAL_DIGITS = 9;
    private static final int MAX_MARKER_PADDING = 4;

    static Optional<ListMarker> parse(String line) {
        int indent = MarkdownLines.indentOf(line);
        String rest = MarkdownLines.stripIndent(line, indent);
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        char first = rest.charAt(0);
        boolean ordered;
        int number = 1;
        int markerLength;
        if (first == '-' || first == '*' || first == '+') {
            ordered = false;
            markerLength = 1;
        } else if (isAsciiDigit(first)) {
            int digits = 0;
            while (digits < rest.length() && isAsciiDigit(rest.charAt(digits))) {
                digits++;
            }
            if (digits > MAX_ORDINAL_DIGITS || digits == rest.length()) {
                return Optional.empty();
            }
            char delimiter = rest.charAt(digits);
            if (delimiter != '.' && delimiter != ')') {
                return Optional.empty();
            }
            ordered = true;
            number = Integer.parseInt(rest.substring(0, digits));
            markerLength = digits + 1;
        } else {
            return Optional.empty();
        }
        if (markerLength < rest.length() && !isSpaceOrTab(rest.charAt(markerLength))) {
            return Optional.empty();
        }

        String afterMarker = rest.substring(markerLength);
        int padding = MarkdownLines.indentOf(afterMarker);
        if (afterMarker.isBlank()) {
            return Optional.of(new ListMarker(ordered, number, indent, indent + markerLength + 1, ""));
        }
        if (padding > MAX_MARKER_PADDING) {
            return Optional.of(new ListMarker(ordered, number, indent, indent + markerLength + 1,
                    MarkdownLines.stripIndent(afterMarker, 1)));
        }
        return Optional.of(new ListMarker(ordered, number, indent, indent + markerLength + padding,
                MarkdownLines.stripIndent(afterMarker, padding)));
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isSpaceOrTab(char ch) {
        return ch == ' ' || ch == '\t';
    }
}

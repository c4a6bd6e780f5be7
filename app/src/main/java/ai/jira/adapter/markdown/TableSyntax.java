package ai.jira.adapter.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pipe-table recognition and cell splitting.
 */
final class TableSyntax {

    private static final Pattern SEPARATOR_CELL = Pattern.compile("\\s*:?-+:?\\s*");

    private TableSyntax() {
    }

    static boolean hasPipe(String line) {
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '\\') {
                i++;
            } else if (ch == '|') {
                return true;
            }
        }
        return false;
    }

    /**
     * A delimiter row: every pipe-separated cell is dashes with optional alignment colons. Outer pipes are optional.
     */
    static boolean isSeparator(String line) {
        String row = line.strip();
        if (row.startsWith("|")) {
            row = row.substring(1);
        }
        if (row.endsWith("|")) {
            row = row.substring(0, row.length() - 1);
        }
        if (row.isEmpty()) {
            return false;
        }
        int start = 0;
        while (start <= row.length()) {
            int end = row.indexOf('|', start);
            if (end < 0) {
                end = row.length();
            }
            if (!SEPARATOR_CELL.matcher(row.substring(start, end)).matches()) {
                return false;
            }
            start = end + 1;
        }
        return true;
    }

    /**
     * Splits a row on unescaped pipes, dropping the optional outer pipes; {@code \|} becomes a literal pipe.
     */
    static List<String> cells(String line) {
        String row = line.strip();
        if (row.startsWith("|")) {
            row = row.substring(1);
        }
        if (row.endsWith("|") && !row.endsWith("\\|")) {
            row = row.substring(0, row.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        for (int i = 0; i < row.length(); i++) {
            char ch = row.charAt(i);
            if (ch == '\\' && i + 1 < row.length() && row.charAt(i + 1) == '|') {
                cell.append('|');
                i++;
            } else if (ch == '|') {
                cells.add(cell.toString().strip());
                cell.setLength(0);
            } else {
                cell.append(ch);
            }
        }
        cells.add(cell.toString().strip());
        return cells;
    }
}

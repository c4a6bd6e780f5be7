package ai.jira.adapter.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits markdown text into an ordered list of block spans in a single forward pass over its lines.
 *
 * <p>Only the outermost blocks are identified; list items and blockquotes carry their dedented child region as
 * content, which the {@link BlockMapper} segments again one level deeper. Inside an open code fence no other
 * syntax is recognised until the fence closes or the input ends.
 */
public class BlockSegmenter {

    private static final Pattern HEADING = Pattern.compile("^(#+)[ \\t]+(.*)$");
    private static final Pattern CLOSING_HASHES = Pattern.compile("(?:^|[ \\t]+)#+[ \\t]*$");
    private static final int MAX_HEADING_LEVEL = 6;

    private final int maxNestingDepth;

    public BlockSegmenter(ConverterOptions options) {
        this.maxNestingDepth = Objects.requireNonNull(options, "options").maxNestingDepth();
    }

    public List<BlockSpan> segment(String markdown) {
        return segment(markdown, 0);
    }

    /**
     * Segments {@code markdown}, tagging every span with {@code depth}.
     */
    public List<BlockSpan> segment(String markdown, int depth) {
        List<String> lines = MarkdownLines.split(markdown == null ? "" : markdown);
        List<BlockSpan> spans = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            if (lines.get(index).isBlank()) {
                index++;
                continue;
            }
            index = readBlock(lines, index, depth, spans);
        }
        return spans;
    }

    private int readBlock(List<String> lines, int index, int depth, List<BlockSpan> spans) {
        String line = lines.get(index);
        Optional<Fence> fence = Fence.open(line);
        if (fence.isPresent()) {
            return readFence(lines, index, fence.get(), depth, spans);
        }
        Matcher heading = HEADING.matcher(line.stripLeading());
        if (heading.matches()) {
            int level = Math.min(heading.group(1).length(), MAX_HEADING_LEVEL);
            String text = CLOSING_HASHES.matcher(heading.group(2).strip()).replaceFirst("");
            spans.add(new BlockSpan(BlockKind.HEADING, text.strip(), depth, level, "", line));
            return index + 1;
        }
        if (isRule(line)) {
            spans.add(new BlockSpan(BlockKind.RULE, "", depth, 0, "", line));
            return index + 1;
        }
        if (MarkdownLines.isQuote(line)) {
            return readQuote(lines, index, depth, spans);
        }
        Optional<ListMarker> marker = ListMarker.parse(line);
        if (marker.isPresent()) {
            return readListItem(lines, index, marker.get(), depth, spans);
        }
        if (isTableStart(lines, index)) {
            return readTable(lines, index, depth, spans);
        }
        return readParagraph(lines, index, depth, spans);
    }

    private int readFence(List<String> lines, int index, Fence fence, int depth, List<BlockSpan> spans) {
        List<String> body = new ArrayList<>();
        int next = index + 1;
        while (next < lines.size() && !fence.closedBy(lines.get(next))) {
            body.add(MarkdownLines.stripIndent(lines.get(next), fence.indent()));
            next++;
        }
        int end = next < lines.size() ? next + 1 : next;
        spans.add(new BlockSpan(BlockKind.CODE_BLOCK, String.join("\n", body), depth, 0, fence.language(),
                source(lines, index, end)));
        return end;
    }

    private int readQuote(List<String> lines, int index, int depth, List<BlockSpan> spans) {
        List<String> body = new ArrayList<>();
        int next = index;
        while (next < lines.size() && MarkdownLines.isQuote(lines.get(next))) {
            body.add(MarkdownLines.stripQuoteMarker(lines.get(next)));
            next++;
        }
        int markers = Math.min(MarkdownLines.countQuoteMarkers(lines.get(index)), maxNestingDepth);
        spans.add(new BlockSpan(BlockKind.BLOCKQUOTE, String.join("\n", body), depth, markers, "",
                source(lines, index, next)));
        return next;
    }

    private int readListItem(List<String> lines, int index, ListMarker marker, int depth, List<BlockSpan> spans) {
        List<String> body = new ArrayList<>();
        body.add(marker.firstLine());
        Optional<Fence> openFence = Fence.open(marker.firstLine());
        int next = index + 1;
        while (next < lines.size()) {
            String line = lines.get(next);
            if (openFence.isPresent()) {
                String dedented = MarkdownLines.stripIndent(line, marker.contentOffset());
                body.add(dedented);
                if (openFence.get().closedBy(dedented)) {
                    openFence = Optional.empty();
                }
                next++;
                continue;
            }
            if (line.isBlank()) {
                break;
            }
            if (MarkdownLines.indentOf(line) > marker.indent()) {
                String dedented = MarkdownLines.stripIndent(line, marker.contentOffset());
                body.add(dedented);
                openFence = Fence.open(dedented);
                next++;
                continue;
            }
            if (startsBlock(lines, next)) {
                break;
            }
            // lazy continuation of the item's paragraph
            body.add(line.strip());
            next++;
        }
        BlockKind kind = marker.ordered() ? BlockKind.ORDERED_ITEM : BlockKind.BULLET_ITEM;
        spans.add(new BlockSpan(kind, String.join("\n", body), depth, marker.number(), "",
                source(lines, index, next)));
        return next;
    }

    private int readTable(List<String> lines, int index, int depth, List<BlockSpan> spans) {
        int next = index + 2;
        while (next < lines.size()) {
            String line = lines.get(next);
            if (line.isBlank() || !TableSyntax.hasPipe(line) || startsNonTableBlock(line)) {
                break;
            }
            next++;
        }
        List<String> rows = new ArrayList<>();
        for (int i = index; i < next; i++) {
            rows.add(lines.get(i).strip());
        }
        spans.add(new BlockSpan(BlockKind.TABLE, String.join("\n", rows), depth, 0, "", source(lines, index, next)));
        return next;
    }

    private int readParagraph(List<String> lines, int index, int depth, List<BlockSpan> spans) {
        List<String> body = new ArrayList<>();
        body.add(lines.get(index).strip());
        int next = index + 1;
        while (next < lines.size() && !lines.get(next).isBlank() && !startsBlock(lines, next)) {
            body.add(lines.get(next).strip());
            next++;
        }
        spans.add(new BlockSpan(BlockKind.PARAGRAPH, String.join(" ", body), depth, 0, "",
                source(lines, index, next)));
        return next;
    }

    private boolean startsBlock(List<String> lines, int index) {
        return startsNonTableBlock(lines.get(index)) || isTableStart(lines, index);
    }

    private boolean startsNonTableBlock(String line) {
        return Fence.open(line).isPresent()
                || HEADING.matcher(line.stripLeading()).matches()
                || isRule(line)
                || MarkdownLines.isQuote(line)
                || ListMarker.parse(line).isPresent();
    }

    private static boolean isTableStart(List<String> lines, int index) {
        return index + 1 < lines.size()
                && TableSyntax.hasPipe(lines.get(index))
                && TableSyntax.isSeparator(lines.get(index + 1));
    }

    /**
     * Three or more of one marker ({@code -}, {@code *} or {@code _}), optionally separated by spaces or tabs.
     */
    static boolean isRule(String line) {
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return false;
        }
        char marker = stripped.charAt(0);
        if (marker != '-' && marker != '*' && marker != '_') {
            return false;
        }
        int count = 0;
        for (int i = 0; i < stripped.length(); i++) {
            char ch = stripped.charAt(i);
            if (ch == marker) {
                count++;
            } else if (ch != ' ' && ch != '\t') {
                return false;
            }
        }
        return count >= 3;
    }

    private static String source(List<String> lines, int from, int to) {
        return String.join("\n", lines.subList(from, to));
    }

    private record Fence(char marker, int length, int indent, String language) {

        private static final Pattern OPEN = Pattern.compile("^(`{3,}|~{3,})[ \\t]*([^\\s`]*)(.*)$");

        static Optional<Fence> open(String line) {
            Matcher matcher = OPEN.matcher(line.strip());
            if (!matcher.matches()) {
                return Optional.empty();
            }
            String marker = matcher.group(1);
            if (marker.charAt(0) == '`' && matcher.group(3).indexOf('`') >= 0) {
                return Optional.empty();
            }
            return Optional.of(new Fence(marker.charAt(0), marker.length(), MarkdownLines.indentOf(line),
                    matcher.group(2)));
        }

        boolean closedBy(String line) {
            String trimmed = line.strip();
            if (trimmed.length() < length) {
                return false;
            }
            for (int i = 0; i < trimmed.length(); i++) {
                if (trimmed.charAt(i) != marker) {
                    return false;
                }
            }
            return true;
        }
    }
}

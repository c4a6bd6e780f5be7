package ai.jira.adapter.markdown;

import ai.jira.adapter.adf.BlockNode;
import ai.jira.adapter.adf.Blockquote;
import ai.jira.adapter.adf.BulletList;
import ai.jira.adapter.adf.CodeBlock;
import ai.jira.adapter.adf.Heading;
import ai.jira.adapter.adf.ListItem;
import ai.jira.adapter.adf.OrderedList;
import ai.jira.adapter.adf.Paragraph;
import ai.jira.adapter.adf.Rule;
import ai.jira.adapter.adf.Table;
import ai.jira.adapter.adf.TableCell;
import ai.jira.adapter.adf.TableRow;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps block spans to ADF block nodes, resolving the inline content of every text block and recursing into list
 * items and blockquotes.
 *
 * <p>Nodes a container does not accept are adapted on the spot: headings become paragraphs, blockquotes are
 * spliced into their parent, rules and tables become literal paragraphs. Lists deeper than the nesting limit are
 * flattened into the list at the limit.
 */
public class BlockMapper {

    static final int MAX_TABLE_COLUMNS = 64;

    private final BlockSegmenter segmenter;
    private final InlineResolver inlineResolver;
    private final int maxNestingDepth;

    public BlockMapper(BlockSegmenter segmenter, InlineResolver inlineResolver, ConverterOptions options) {
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.inlineResolver = Objects.requireNonNull(inlineResolver, "inlineResolver");
        this.maxNestingDepth = Objects.requireNonNull(options, "options").maxNestingDepth();
    }

    public List<BlockNode> map(List<BlockSpan> spans, SourceMap sources) {
        return mapBlocks(spans, BlockContext.DOCUMENT, 0, sources);
    }

    private List<BlockNode> mapBlocks(List<BlockSpan> spans, BlockContext context, int depth, SourceMap sources) {
        List<BlockNode> nodes = new ArrayList<>();
        int index = 0;
        while (index < spans.size()) {
            BlockSpan span = spans.get(index);
            if (span.kind().isListItem()) {
                int end = index + 1;
                while (end < spans.size() && spans.get(end).kind() == span.kind()) {
                    end++;
                }
                nodes.add(mapList(spans.subList(index, end), depth, sources));
                index = end;
                continue;
            }
            nodes.addAll(mapBlock(span, context, depth, sources));
            index++;
        }
        return nodes;
    }

    private List<BlockNode> mapBlock(BlockSpan span, BlockContext context, int depth, SourceMap sources) {
        return switch (span.kind()) {
            case PARAGRAPH -> List.of(sources.record(new Paragraph(inlineResolver.resolve(span.content())),
                    span.source()));
            case HEADING -> List.of(mapHeading(span, context, sources));
            case CODE_BLOCK -> List.of(sources.record(codeBlock(span), span.source()));
            case RULE -> List.of(context.allows(BlockKind.RULE)
                    ? sources.record(new Rule(), span.source())
                    : sources.record(Paragraph.literal(span.source().strip()), span.source()));
            case TABLE -> context.allows(BlockKind.TABLE)
                    ? List.of(mapTable(span, sources))
                    : tableAsParagraphs(span, sources);
            case BLOCKQUOTE -> mapBlockquote(span, context, depth, sources);
            case BULLET_ITEM, ORDERED_ITEM -> List.of(mapList(List.of(span), depth, sources));
        };
    }

    private BlockNode mapHeading(BlockSpan span, BlockContext context, SourceMap sources) {
        BlockNode node = context.allows(BlockKind.HEADING)
                ? new Heading(span.number(), inlineResolver.resolve(span.content()))
                : new Paragraph(inlineResolver.resolve(span.content()));
        return sources.record(node, span.source());
    }

    private static CodeBlock codeBlock(BlockSpan span) {
        Optional<String> language = span.info().isBlank() ? Optional.empty() : Optional.of(span.info());
        return new CodeBlock(language, span.content());
    }

    private List<BlockNode> mapBlockquote(BlockSpan span, BlockContext context, int depth, SourceMap sources) {
        int childDepth = depth + 1;
        String content = childDepth >= maxNestingDepth
                ? MarkdownLines.collapseQuoteMarkers(span.content())
                : span.content();
        List<BlockNode> children = mapBlocks(segmenter.segment(content, childDepth), BlockContext.BLOCKQUOTE,
                childDepth, sources);
        if (!context.allows(BlockKind.BLOCKQUOTE)) {
            return children;
        }
        if (children.isEmpty()) {
            children = List.of(Paragraph.empty());
        }
        return List.of(sources.record(new Blockquote(children), span.source()));
    }

    private BlockNode mapList(List<BlockSpan> items, int depth, SourceMap sources) {
        int listDepth = Math.min(depth + 1, maxNestingDepth);
        boolean flatten = listDepth >= maxNestingDepth;
        Deque<BlockSpan> pending = new ArrayDeque<>(items);
        List<ListItem> listItems = new ArrayList<>();
        while (!pending.isEmpty()) {
            BlockSpan item = pending.pollFirst();
            List<BlockSpan> children = segmenter.segment(item.content(), listDepth);
            if (flatten) {
                List<BlockSpan> nested = new ArrayList<>();
                children = hoistNestedItems(children, listDepth, nested);
                for (int i = nested.size() - 1; i >= 0; i--) {
                    pending.addFirst(nested.get(i));
                }
            }
            List<BlockNode> content = mapBlocks(children, BlockContext.LIST_ITEM, listDepth, sources);
            listItems.add(sources.record(listItem(content), item.source()));
        }
        BlockSpan first = items.get(0);
        BlockNode list = first.kind() == BlockKind.ORDERED_ITEM
                ? new OrderedList(first.number(), listItems)
                : new BulletList(listItems);
        return sources.record(list, items.stream().map(BlockSpan::source).collect(Collectors.joining("\n")));
    }

    /**
     * Moves nested list items (including those inside quotes) out of an item so they become its following siblings.
     */
    private List<BlockSpan> hoistNestedItems(List<BlockSpan> spans, int depth, List<BlockSpan> nested) {
        List<BlockSpan> kept = new ArrayList<>();
        for (BlockSpan span : spans) {
            if (span.kind().isListItem()) {
                nested.add(span);
            } else if (span.kind() == BlockKind.BLOCKQUOTE) {
                String collapsed = MarkdownLines.collapseQuoteMarkers(span.content());
                for (BlockSpan inner : segmenter.segment(collapsed, depth)) {
                    if (inner.kind().isListItem()) {
                        nested.add(inner);
                    } else {
                        kept.add(inner);
                    }
                }
            } else {
                kept.add(span);
            }
        }
        return kept;
    }

    private static ListItem listItem(List<BlockNode> content) {
        if (!content.isEmpty() && (content.get(0) instanceof Paragraph || content.get(0) instanceof CodeBlock)) {
            return new ListItem(content);
        }
        List<BlockNode> padded = new ArrayList<>(content.size() + 1);
        padded.add(Paragraph.empty());
        padded.addAll(content);
        return new ListItem(padded);
    }

    private BlockNode mapTable(BlockSpan span, SourceMap sources) {
        List<String> lines = MarkdownLines.split(span.content());
        List<String> rowLines = new ArrayList<>();
        rowLines.add(lines.get(0));
        rowLines.addAll(lines.subList(Math.min(2, lines.size()), lines.size()));

        List<List<String>> rows = rowLines.stream().map(TableSyntax::cells).collect(Collectors.toList());
        int width = Math.min(rows.stream().mapToInt(List::size).max().orElse(1), MAX_TABLE_COLUMNS);

        List<TableRow> tableRows = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            boolean header = r == 0;
            List<String> cells = rows.get(r);
            List<TableCell> tableCells = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                tableCells.add(c < cells.size() ? cell(header, cells.get(c), sources) : TableCell.empty(header));
            }
            tableRows.add(sources.record(new TableRow(tableCells), rowLines.get(r)));
        }
        return sources.record(new Table(tableRows), span.source());
    }

    private TableCell cell(boolean header, String text, SourceMap sources) {
        Paragraph paragraph = sources.record(new Paragraph(inlineResolver.resolve(text)), text);
        return sources.record(new TableCell(header, List.of(paragraph)), text);
    }

    private List<BlockNode> tableAsParagraphs(BlockSpan span, SourceMap sources) {
        List<BlockNode> paragraphs = new ArrayList<>();
        for (String line : MarkdownLines.split(span.content())) {
            paragraphs.add(sources.record(Paragraph.literal(line), line));
        }
        return paragraphs;
    }
}

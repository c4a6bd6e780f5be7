package ai.jira.adapter.markdown;

import ai.jira.adapter.adf.AdfDocument;
import ai.jira.adapter.adf.AdfNode;
import ai.jira.adapter.adf.AdfText;
import ai.jira.adapter.adf.BlockNode;
import ai.jira.adapter.adf.Blockquote;
import ai.jira.adapter.adf.BulletList;
import ai.jira.adapter.adf.CodeBlock;
import ai.jira.adapter.adf.Heading;
import ai.jira.adapter.adf.ListItem;
import ai.jira.adapter.adf.MarkType;
import ai.jira.adapter.adf.OrderedList;
import ai.jira.adapter.adf.Paragraph;
import ai.jira.adapter.adf.Rule;
import ai.jira.adapter.adf.Table;
import ai.jira.adapter.adf.TableCell;
import ai.jira.adapter.adf.TableRow;
import ai.jira.adapter.adf.TextRun;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last check before a document leaves the converter. Every node is validated against the schema rules the
 * issue tracker enforces; a node that fails is replaced by a paragraph holding its original markdown verbatim.
 */
public class FallbackGuard {

    private static final Logger LOGGER = LoggerFactory.getLogger(FallbackGuard.class);

    public AdfDocument enforce(AdfDocument document, SourceMap sources) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(sources, "sources");
        List<BlockNode> content = repairAll(document.content(), BlockContext.DOCUMENT, sources);
        if (content.isEmpty()) {
            content.add(Paragraph.empty());
        }
        if (document.version() != AdfDocument.VERSION) {
            LOGGER.warn("Document version {} replaced by {}", document.version(), AdfDocument.VERSION);
        }
        return AdfDocument.of(content);
    }

    private List<BlockNode> repairAll(List<BlockNode> blocks, BlockContext context, SourceMap sources) {
        List<BlockNode> repaired = new ArrayList<>(blocks.size());
        for (BlockNode block : blocks) {
            if (block != null) {
                repaired.add(repair(block, context, sources));
            }
        }
        return repaired;
    }

    private BlockNode repair(BlockNode block, BlockContext context, SourceMap sources) {
        Optional<String> problem = problemWith(block, context);
        if (problem.isPresent()) {
            return degrade(block, problem.get(), sources);
        }
        if (block instanceof BulletList list) {
            return new BulletList(repairItems(list.items(), sources));
        }
        if (block instanceof OrderedList list) {
            return new OrderedList(list.order(), repairItems(list.items(), sources));
        }
        if (block instanceof Blockquote blockquote) {
            return new Blockquote(repairAll(blockquote.content(), BlockContext.BLOCKQUOTE, sources));
        }
        if (block instanceof Table table) {
            List<TableRow> rows = new ArrayList<>(table.rows().size());
            for (TableRow row : table.rows()) {
                List<TableCell> cells = new ArrayList<>(row.cells().size());
                for (TableCell cell : row.cells()) {
                    cells.add(new TableCell(cell.header(), repairAll(cell.content(), BlockContext.TABLE_CELL, sources)));
                }
                rows.add(new TableRow(cells));
            }
            return new Table(rows);
        }
        return block;
    }

    private List<ListItem> repairItems(List<ListItem> items, SourceMap sources) {
        List<ListItem> repaired = new ArrayList<>(items.size());
        for (ListItem item : items) {
            Optional<String> problem = listItemProblem(item);
            if (problem.isPresent()) {
                LOGGER.warn("Invalid listItem replaced by literal text: {}", problem.get());
                repaired.add(new ListItem(List.of(Paragraph.literal(literalOf(item, sources)))));
            } else {
                repaired.add(new ListItem(repairAll(item.content(), BlockContext.LIST_ITEM, sources)));
            }
        }
        return repaired;
    }

    private BlockNode degrade(BlockNode block, String problem, SourceMap sources) {
        LOGGER.warn("Invalid {} node replaced by literal text: {}", block.type(), problem);
        return Paragraph.literal(literalOf(block, sources));
    }

    private static String literalOf(AdfNode node, SourceMap sources) {
        return sources.sourceOf(node).orElseGet(() -> AdfText.plainText(node));
    }

    private static Optional<String> problemWith(BlockNode block, BlockContext context) {
        if (!isKnownBlock(block)) {
            return Optional.of("unknown block type '" + block.type() + "'");
        }
        if (!context.allowsType(block.type())) {
            return Optional.of(block.type() + " is not allowed inside " + context.label());
        }
        if (block instanceof Paragraph paragraph) {
            return runProblem(paragraph.content());
        }
        if (block instanceof Heading heading) {
            if (heading.level() < 1 || heading.level() > 6) {
                return Optional.of("heading level " + heading.level() + " outside 1..6");
            }
            return runProblem(heading.content());
        }
        if (block instanceof BulletList list && list.items().isEmpty()) {
            return Optional.of("bulletList without items");
        }
        if (block instanceof OrderedList list) {
            if (list.items().isEmpty()) {
                return Optional.of("orderedList without items");
            }
            if (list.order() < 0) {
                return Optional.of("negative list order " + list.order());
            }
        }
        if (block instanceof CodeBlock codeBlock && codeBlock.language().filter(String::isBlank).isPresent()) {
            return Optional.of("blank codeBlock language");
        }
        if (block instanceof Blockquote blockquote && blockquote.content().isEmpty()) {
            return Optional.of("blockquote without content");
        }
        if (block instanceof Table table) {
            return tableProblem(table);
        }
        return Optional.empty();
    }

    private static boolean isKnownBlock(BlockNode block) {
        return block instanceof Paragraph
                || block instanceof Heading
                || block instanceof BulletList
                || block instanceof OrderedList
                || block instanceof CodeBlock
                || block instanceof Blockquote
                || block instanceof Table
                || block instanceof Rule;
    }

    private static Optional<String> listItemProblem(ListItem item) {
        if (item.content().isEmpty()) {
            return Optional.of("listItem without content");
        }
        BlockNode first = item.content().get(0);
        if (!(first instanceof Paragraph) && !(first instanceof CodeBlock)) {
            return Optional.of("listItem starts with " + first.type());
        }
        return Optional.empty();
    }

    private static Optional<String> tableProblem(Table table) {
        if (table.rows().isEmpty()) {
            return Optional.of("table without rows");
        }
        int width = table.rows().get(0).cells().size();
        if (width == 0) {
            return Optional.of("table row without cells");
        }
        for (TableRow row : table.rows()) {
            if (row.cells().size() != width) {
                return Optional.of("table rows of unequal width");
            }
            for (TableCell cell : row.cells()) {
                if (cell.content().isEmpty()) {
                    return Optional.of("table cell without content");
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> runProblem(List<TextRun> runs) {
        for (TextRun run : runs) {
            if (run.text().isEmpty()) {
                return Optional.of("empty text run");
            }
            if (run.hasMark(MarkType.LINK) != run.href().isPresent()) {
                return Optional.of("link mark and href out of step");
            }
            if (run.href().filter(String::isBlank).isPresent()) {
                return Optional.of("blank link href");
            }
            if (run.hasMark(MarkType.CODE)
                    && run.marks().stream().anyMatch(mark -> mark != MarkType.CODE && mark != MarkType.LINK)) {
                return Optional.of("code mark combined with " + run.marks());
            }
        }
        return Optional.empty();
    }
}

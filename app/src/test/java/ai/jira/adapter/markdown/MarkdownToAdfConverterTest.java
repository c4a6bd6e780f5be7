package ai.jira.adapter.markdown;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.jira.adapter.adf.AdfDocument;
import ai.jira.adapter.adf.AdfJsonWriter;
import ai.jira.adapter.adf.AdfNode;
import ai.jira.adapter.adf.AdfText;
import ai.jira.adapter.adf.BulletList;
import ai.jira.adapter.adf.CodeBlock;
import ai.jira.adapter.adf.ListItem;
import ai.jira.adapter.adf.MarkType;
import ai.jira.adapter.adf.OrderedList;
import ai.jira.adapter.adf.Paragraph;
import ai.jira.adapter.adf.Rule;
import ai.jira.adapter.adf.Table;
import ai.jira.adapter.adf.TableCell;
import ai.jira.adapter.adf.TableRow;
import ai.jira.adapter.adf.TextRun;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class MarkdownToAdfConverterTest {

    private final MarkdownToAdfConverter converter = new MarkdownToAdfConverter();
    private final AdfJsonWriter writer = new AdfJsonWriter();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void convertsEmptyInputToSingleEmptyParagraph() throws Exception {
        JsonNode expected = objectMapper.readTree(
                "{\"version\":1,\"type\":\"doc\",\"content\":[{\"type\":\"paragraph\",\"content\":[]}]}");

        assertThat(writer.toJson(converter.convert(""))).isEqualTo(expected);
        assertThat(converter.convert(null)).isEqualTo(converter.convert(""));
        assertThat(converter.convert("  \n\n\t")).isEqualTo(converter.convert(""));
    }

    @Test
    void convertsPlainTextToOneRun() {
        AdfDocument document = converter.convert("hello world");

        assertThat(document.content()).containsExactly(new Paragraph(List.of(TextRun.plain("hello world"))));
    }

    @Test
    void composesNestedEmphasisIntoMarkSets() {
        AdfDocument document = converter.convert("**bold *and italic*** end");

        assertThat(document.content()).containsExactly(new Paragraph(List.of(
                TextRun.marked("bold ", Set.of(MarkType.STRONG)),
                TextRun.marked("and italic", Set.of(MarkType.STRONG, MarkType.EM)),
                TextRun.plain(" end"))));
    }

    @Test
    void writesFencedCodeWithLanguage() throws Exception {
        JsonNode expected = objectMapper.readTree("{\"type\":\"codeBlock\",\"attrs\":{\"language\":\"python\"},"
                + "\"content\":[{\"type\":\"text\",\"text\":\"print(1)\"}]}");

        JsonNode json = writer.toJson(converter.convert("```python\nprint(1)\n```"));

        assertThat(json.get("content")).hasSize(1);
        assertThat(json.get("content").get(0)).isEqualTo(expected);
    }

    @Test
    void keepsUnterminatedFenceAsCodeBlock() {
        AdfDocument document = converter.convert("```\nfoo");

        assertThat(document.content()).containsExactly(new CodeBlock(Optional.empty(), "foo"));
    }

    @Test
    void padsShortTableRows() {
        AdfDocument document = converter.convert("| a | b | c |\n|---|---|---|\n| 1 | 2 |");

        Table table = (Table) document.content().get(0);
        TableRow dataRow = table.rows().get(1);
        assertThat(dataRow.cells()).hasSize(3);
        assertThat(dataRow.cells().get(2)).isEqualTo(TableCell.empty(false));
    }

    @Test
    void capsListNestingAtConfiguredDepth() {
        StringBuilder markdown = new StringBuilder();
        for (int level = 0; level < 15; level++) {
            markdown.append("  ".repeat(level)).append("- level ").append(level).append('\n');
        }
        MarkdownToAdfConverter capped = new MarkdownToAdfConverter(new ConverterOptions(10));

        AdfDocument document = capped.convert(markdown.toString());

        assertThat(listDepth(document)).isEqualTo(10);
        String text = AdfText.plainText(document);
        for (int level = 0; level < 15; level++) {
            assertThat(text).contains("level " + level);
        }
    }

    @Test
    void keepsShallowListsIntact() {
        AdfDocument document = converter.convert("1. one\n   - a\n   - b\n2. two");

        assertThat(listDepth(document)).isEqualTo(2);
        assertThat(document.content().get(0)).isInstanceOf(OrderedList.class);
    }

    @Test
    void survivesPathologicalInput() {
        String markdown = "> ".repeat(200) + "deep\n" + "[".repeat(500) + "\n" + "*_".repeat(300)
                + "\n|\n|-|\n```";

        AdfDocument document = converter.convert(markdown);

        assertThat(document.version()).isEqualTo(1);
        assertThat(document.content()).isNotEmpty();
        assertThat(writer.write(document)).startsWith("{\"version\":1,\"type\":\"doc\"");
    }

    @Test
    void convertsVeryLongRuleAndSeparatorLines() {
        for (int length : List.of(10_000, 100_000)) {
            assertThat(converter.convert("-".repeat(length)).content()).singleElement().isInstanceOf(Rule.class);
            assertThat(converter.convert("- ".repeat(length / 2)).content())
                    .singleElement().isInstanceOf(Rule.class);
            assertThat(converter.convert("a|b\n" + "|-".repeat(length / 2) + "|").content())
                    .singleElement().isInstanceOf(Table.class);
        }
    }

    @Test
    void convertsLongParagraphsAsSingleBlock() {
        String text = "lorem ipsum ".repeat(2_700).strip();
        String brackets = "[".repeat(30_000);

        AdfDocument prose = converter.convert(text);
        AdfDocument unmatched = converter.convert(brackets);

        assertThat(prose.content()).singleElement().isInstanceOf(Paragraph.class);
        assertThat(AdfText.plainText(prose)).isEqualTo(text);
        assertThat(unmatched.content()).singleElement().isInstanceOf(Paragraph.class);
        assertThat(AdfText.plainText(unmatched)).isEqualTo(brackets);
    }

    @Test
    void producesIdenticalOutputForRepeatedCalls() {
        String markdown = "# Release\n\n- **fixed** `npe`\n- see [docs](https://example.com)\n\n> note";

        assertThat(writer.write(converter.convert(markdown))).isEqualTo(writer.write(converter.convert(markdown)));
    }

    @Test
    void markOrderDoesNotAffectEquality() {
        TextRun first = TextRun.marked("x", List.of(MarkType.EM, MarkType.STRONG));
        TextRun second = TextRun.marked("x", EnumSet.of(MarkType.STRONG, MarkType.EM));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void convertsConcurrentlyWithSharedInstance() throws Exception {
        String markdown = "## Steps\n\n1. open *the* app\n2. click `run`\n\n```sh\nmake\n```";
        AdfDocument expected = converter.convert(markdown);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<AdfDocument>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> converter.convert(markdown)));
            }
            for (Future<AdfDocument> future : futures) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void rejectsNonPositiveNestingDepth() {
        assertThatThrownBy(() -> new ConverterOptions(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static int listDepth(AdfNode node) {
        if (node instanceof AdfDocument document) {
            return maxDepth(document.content());
        }
        if (node instanceof BulletList list) {
            return 1 + maxDepth(list.items());
        }
        if (node instanceof OrderedList list) {
            return 1 + maxDepth(list.items());
        }
        if (node instanceof ListItem item) {
            return maxDepth(item.content());
        }
        return 0;
    }

    private static int maxDepth(List<? extends AdfNode> nodes) {
        return nodes.stream().mapToInt(MarkdownToAdfConverterTest::listDepth).max().orElse(0);
    }
}

package ai.jira.adapter.adf;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AdfTextTest {

    @Test
    void joinsBlocksWithNewlines() {
        AdfDocument document = AdfDocument.of(List.of(
                new Heading(1, List.of(TextRun.plain("Title"))),
                new Paragraph(List.of(TextRun.plain("some "), TextRun.marked("bold", Set.of(MarkType.STRONG)))),
                new BulletList(List.of(new ListItem(List.of(Paragraph.literal("item"))))),
                new CodeBlock(Optional.of("java"), "int x;")));

        assertThat(AdfText.plainText(document)).isEqualTo("Title\nsome bold\nitem\nint x;");
    }

    @Test
    void extractsTextFromApiJson() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        String json = "{\"type\":\"doc\",\"version\":1,\"content\":["
                + "{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"line one\"},"
                + "{\"type\":\"hardBreak\"},{\"type\":\"text\",\"text\":\"line two\"}]},"
                + "{\"type\":\"mediaSingle\",\"content\":[{\"type\":\"media\"}]},"
                + "{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"after\"}]}]}";

        assertThat(AdfText.plainText(objectMapper.readTree(json))).isEqualTo("line one\nline two\nafter");
    }

    @Test
    void passesThroughPlainStringsAndIgnoresNull() {
        assertThat(AdfText.plainText(TextNode.valueOf("legacy text"))).isEqualTo("legacy text");
        assertThat(AdfText.plainText(NullNode.getInstance())).isEmpty();
        assertThat(AdfText.plainText((JsonNode) null)).isEmpty();
    }
}

package ai.jira.adapter.adf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Renders an {@link AdfDocument} as the JSON structure the issue tracker expects for rich-text fields.
 */
public class AdfJsonWriter {

    private final ObjectMapper objectMapper;

    public AdfJsonWriter() {
        this(new ObjectMapper());
    }

    public AdfJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public ObjectNode toJson(AdfDocument document) {
        Objects.requireNonNull(document, "document");
        ObjectNode root = objectMapper.createObjectNode();
        root.put("version", document.version());
        root.put("type", document.type());
        root.set("content", blocks(document.content()));
        return root;
    }

    public String write(AdfDocument document) {
        return serialize(document, false);
    }

    public String writePretty(AdfDocument document) {
        return serialize(document, true);
    }

    private String serialize(AdfDocument document, boolean pretty) {
        ObjectNode json = toJson(document);
        try {
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json)
                    : objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize ADF document", ex);
        }
    }

    private ArrayNode blocks(List<? extends AdfNode> nodes) {
        ArrayNode array = objectMapper.createArrayNode();
        for (AdfNode node : nodes) {
            array.add(node(node));
        }
        return array;
    }

    private ObjectNode node(AdfNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("type", node.type());
        if (node instanceof Paragraph paragraph) {
            json.set("content", blocks(paragraph.content()));
        } else if (node instanceof Heading heading) {
            json.putObject("attrs").put("level", heading.level());
            json.set("content", blocks(heading.content()));
        } else if (node instanceof BulletList list) {
            json.set("content", blocks(list.items()));
        } else if (node instanceof OrderedList list) {
            json.putObject("attrs").put("order", list.order());
            json.set("content", blocks(list.items()));
        } else if (node instanceof ListItem item) {
            json.set("content", blocks(item.content()));
        } else if (node instanceof CodeBlock codeBlock) {
            codeBlock.language()
                    .filter(language -> !language.isBlank())
                    .ifPresent(language -> json.putObject("attrs").put("language", language));
            ArrayNode content = json.putArray("content");
            if (!codeBlock.text().isEmpty()) {
                content.addObject().put("type", "text").put("text", codeBlock.text());
            }
        } else if (node instanceof Blockquote blockquote) {
            json.set("content", blocks(blockquote.content()));
        } else if (node instanceof Table table) {
            ObjectNode attrs = json.putObject("attrs");
            attrs.put("isNumberColumnEnabled", false);
            attrs.put("layout", "default");
            json.set("content", blocks(table.rows()));
        } else if (node instanceof TableRow row) {
            json.set("content", blocks(row.cells()));
        } else if (node instanceof TableCell cell) {
            json.putObject("attrs");
            json.set("content", blocks(cell.content()));
        } else if (node instanceof TextRun run) {
            json.put("text", run.text());
            if (!run.marks().isEmpty()) {
                json.set("marks", marks(run));
            }
        } else if (!(node instanceof Rule)) {
            throw new IllegalArgumentException("Unsupported ADF node type: " + node.type());
        }
        return json;
    }

    private ArrayNode marks(TextRun run) {
        ArrayNode marks = objectMapper.createArrayNode();
        for (MarkType mark : MarkType.values()) {
            if (!run.hasMark(mark)) {
                continue;
            }
            ObjectNode json = marks.addObject();
            json.put("type", mark.adfName());
            if (mark == MarkType.LINK) {
                json.putObject("attrs").put("href", run.href().orElse(""));
            }
        }
        return marks;
    }
}

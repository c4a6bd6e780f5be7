package ai.jira.adapter.markdown;

import ai.jira.adapter.adf.AdfDocument;
import ai.jira.adapter.adf.BlockNode;
import ai.jira.adapter.adf.Paragraph;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts markdown text into an ADF document that the issue tracker accepts.
 *
 * <p>Conversion is total: it never throws, and any construct that cannot be represented ends up as literal text.
 * Instances hold no mutable state and may be shared between threads.
 */
public class MarkdownToAdfConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkdownToAdfConverter.class);

    private final BlockSegmenter segmenter;
    private final BlockMapper mapper;
    private final DocumentAssembler assembler;
    private final FallbackGuard guard;

    public MarkdownToAdfConverter() {
        this(ConverterOptions.defaults());
    }

    public MarkdownToAdfConverter(ConverterOptions options) {
        Objects.requireNonNull(options, "options");
        this.segmenter = new BlockSegmenter(options);
        this.mapper = new BlockMapper(segmenter, new InlineResolver(), options);
        this.assembler = new DocumentAssembler();
        this.guard = new FallbackGuard();
    }

    public AdfDocument convert(String markdown) {
        String text = markdown == null ? "" : markdown;
        try {
            SourceMap sources = new SourceMap();
            List<BlockSpan> spans = segmenter.segment(text);
            List<BlockNode> blocks = mapper.map(spans, sources);
            AdfDocument document = guard.enforce(assembler.assemble(blocks), sources);
            LOGGER.debug("Converted {} chars of markdown into {} blocks", text.length(), document.content().size());
            return document;
        } catch (RuntimeException ex) {
            LOGGER.error("Markdown conversion failed; falling back to literal text", ex);
            return AdfDocument.of(List.of(text.isBlank() ? Paragraph.empty() : Paragraph.literal(text)));
        }
    }
}

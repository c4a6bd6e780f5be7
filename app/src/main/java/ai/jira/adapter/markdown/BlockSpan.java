package ai.jira.adapter.markdown;

import java.util.Objects;

/**
 * One block-level span of markdown as produced by the {@link BlockSegmenter}.
 *
 * <p>{@code content} is what the mapper consumes: inline text joined across lines for paragraphs and headings,
 * verbatim text for code blocks, and the dedented child region for list items and blockquotes. {@code number}
 * holds the heading level, the ordered-list item number or the count of quote markers. {@code info} is the code
 * fence language tag. {@code source} keeps the original lines of the span.
 */
public record BlockSpan(BlockKind kind, String content, int depth, int number, String info, String source) {

    public BlockSpan {
        Objects.requireNonNull(kind, "kind");
        content = content == null ? "" : content;
        info = info == null ? "" : info;
        source = source == null ? "" : source;
    }
}

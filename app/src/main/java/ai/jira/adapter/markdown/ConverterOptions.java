package ai.jira.adapter.markdown;

/**
 * Tuning knobs for {@link MarkdownToAdfConverter}.
 *
 * @param maxNestingDepth deepest list/blockquote nesting kept as structure; deeper content is flattened
 */
public record ConverterOptions(int maxNestingDepth) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 10;

    public ConverterOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1");
        }
    }

    public static ConverterOptions defaults() {
        return new ConverterOptions(DEFAULT_MAX_NESTING_DEPTH);
    }
}

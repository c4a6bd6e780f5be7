package ai.jira.adapter.markdown;

/**
 * Block-level constructs recognised by the {@link BlockSegmenter}.
 */
public enum BlockKind {
    PARAGRAPH,
    HEADING,
    CODE_BLOCK,
    BULLET_ITEM,
    ORDERED_ITEM,
    BLOCKQUOTE,
    TABLE,
    RULE;

    public boolean isListItem() {
        return this == BULLET_ITEM || this == ORDERED_ITEM;
    }
}

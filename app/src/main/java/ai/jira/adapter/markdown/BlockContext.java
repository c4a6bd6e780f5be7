package ai.jira.adapter.markdown;

import java.util.EnumSet;
import java.util.Set;

/**
 * Container a block is placed in, with the block kinds and ADF types that container accepts.
 */
enum BlockContext {

    DOCUMENT("doc",
            EnumSet.allOf(BlockKind.class),
            Set.of("paragraph", "heading", "bulletList", "orderedList", "codeBlock", "blockquote", "table", "rule")),
    LIST_ITEM("listItem",
            EnumSet.of(BlockKind.PARAGRAPH, BlockKind.CODE_BLOCK, BlockKind.BULLET_ITEM, BlockKind.ORDERED_ITEM),
            Set.of("paragraph", "codeBlock", "bulletList", "orderedList")),
    BLOCKQUOTE("blockquote",
            EnumSet.of(BlockKind.PARAGRAPH, BlockKind.CODE_BLOCK, BlockKind.BULLET_ITEM, BlockKind.ORDERED_ITEM),
            Set.of("paragraph", "codeBlock", "bulletList", "orderedList")),
    TABLE_CELL("tableCell",
            EnumSet.complementOf(EnumSet.of(BlockKind.TABLE)),
            Set.of("paragraph", "heading", "bulletList", "orderedList", "codeBlock", "blockquote", "rule"));

    private final String label;
    private final Set<BlockKind> kinds;
    private final Set<String> types;

    BlockContext(String label, Set<BlockKind> kinds, Set<String> types) {
        this.label = label;
        this.kinds = kinds;
        this.types = types;
    }

    String label() {
        return label;
    }

    boolean allows(BlockKind kind) {
        return kinds.contains(kind);
    }

    boolean allowsType(String type) {
        return types.contains(type);
    }
}

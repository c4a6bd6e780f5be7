package ai.jira.adapter.markdown;

import ai.jira.adapter.adf.AdfDocument;
import ai.jira.adapter.adf.BlockNode;
import ai.jira.adapter.adf.Paragraph;
import java.util.ArrayList;
import java.util.List;

/**
 * Wraps mapped blocks in a version 1 document; a document never has empty content.
 */
public class DocumentAssembler {

    public AdfDocument assemble(List<BlockNode> blocks) {
        List<BlockNode> content = new ArrayList<>();
        if (blocks != null) {
            for (BlockNode block : blocks) {
                if (block != null) {
                    content.add(block);
                }
            }
        }
        if (content.isEmpty()) {
            content.add(Paragraph.empty());
        }
        return AdfDocument.of(content);
    }
}

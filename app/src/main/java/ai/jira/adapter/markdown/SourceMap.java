package ai.jira.adapter.markdown;

import ai.jira.adapter.adf.AdfNode;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the markdown each produced node came from, keyed by node identity, so invalid nodes can fall back to
 * their original text.
 */
public final class SourceMap {

    private final Map<AdfNode, String> sources = new IdentityHashMap<>();

    public <T extends AdfNode> T record(T node, String source) {
        sources.put(node, source);
        return node;
    }

    public Optional<String> sourceOf(AdfNode node) {
        return Optional.ofNullable(sources.get(node));
    }
}

package ai.jira.adapter.adf;

/**
 * Thematic break.
 */
public record Rule() implements BlockNode {

    @Override
    public String type() {
        return "rule";
    }
}

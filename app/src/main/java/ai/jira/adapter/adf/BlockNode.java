package ai.jira.adapter.adf;

/**
 * Node occupying its own line(s) in a document: the only kind allowed directly under {@code doc}.
 */
public interface BlockNode extends AdfNode {
}

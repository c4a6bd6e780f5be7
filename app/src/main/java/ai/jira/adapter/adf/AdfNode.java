package ai.jira.adapter.adf;

/**
 * Node of an Atlassian Document Format tree.
 */
public interface AdfNode {

    /**
     * @return the ADF {@code type} tag of this node
     */
    String type();
}

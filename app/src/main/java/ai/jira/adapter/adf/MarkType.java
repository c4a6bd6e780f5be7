package ai.jira.adapter.adf;

/**
 * Formatting attributes a text run may carry. Declaration order is the serialization order.
 */
public enum MarkType {
    STRONG("strong"),
    EM("em"),
    CODE("code"),
    STRIKE("strike"),
    LINK("link");

    private final String adfName;

    MarkType(String adfName) {
        this.adfName = adfName;
    }

    public String adfName() {
        return adfName;
    }
}

package ai.jira.adapter.adf;

import java.util.Optional;

/**
 * Verbatim code; never carries inline marks.
 */
public record CodeBlock(Optional<String> language, String text) implements BlockNode {

    public CodeBlock {
        language = language == null ? Optional.empty() : language;
        text = text == null ? "" : text;
    }

    @Override
    public String type() {
        return "codeBlock";
    }
}

package ai.jira.adapter.adf;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Contiguous run of text sharing one set of marks. {@code href} accompanies the {@link MarkType#LINK} mark.
 */
public record TextRun(String text, Set<MarkType> marks, Optional<String> href) implements AdfNode {

    public TextRun {
        text = text == null ? "" : text;
        marks = copyOf(marks);
        href = href == null ? Optional.empty() : href;
    }

    public static TextRun plain(String text) {
        return new TextRun(text, Set.of(), Optional.empty());
    }

    public static TextRun marked(String text, Collection<MarkType> marks) {
        return new TextRun(text, copyOf(marks), Optional.empty());
    }

    public static TextRun link(String text, String href, Collection<MarkType> marks) {
        Set<MarkType> linked = EnumSet.of(MarkType.LINK);
        linked.addAll(marks);
        return new TextRun(text, linked, Optional.ofNullable(href));
    }

    public boolean hasMark(MarkType mark) {
        return marks.contains(mark);
    }

    @Override
    public String type() {
        return "text";
    }

    private static Set<MarkType> copyOf(Collection<MarkType> marks) {
        EnumSet<MarkType> copy = EnumSet.noneOf(MarkType.class);
        if (marks != null) {
            copy.addAll(marks);
        }
        return Collections.unmodifiableSet(copy);
    }
}

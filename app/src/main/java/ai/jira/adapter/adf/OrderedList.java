package ai.jira.adapter.adf;

import java.util.List;

/**
 * Numbered list; {@code order} is the number of the first item.
 */
public record OrderedList(int order, List<ListItem> items) implements BlockNode {

    public OrderedList {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public String type() {
        return "orderedList";
    }
}

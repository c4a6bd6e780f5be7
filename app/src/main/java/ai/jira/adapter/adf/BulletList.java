package ai.jira.adapter.adf;

import java.util.List;

public record BulletList(List<ListItem> items) implements BlockNode {

    public BulletList {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public String type() {
        return "bulletList";
    }
}

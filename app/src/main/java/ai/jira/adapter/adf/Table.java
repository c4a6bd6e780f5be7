package ai.jira.adapter.adf;

import java.util.List;

public record Table(List<TableRow> rows) implements BlockNode {

    public Table {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    @Override
    public String type() {
        return "table";
    }
}

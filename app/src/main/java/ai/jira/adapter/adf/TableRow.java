package ai.jira.adapter.adf;

import java.util.List;

public record TableRow(List<TableCell> cells) implements AdfNode {

    public TableRow {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    @Override
    public String type() {
        return "tableRow";
    }
}

package io.landadvisor.reportservice.domain.model.document;

import java.util.List;

/**
 * Header row plus body rows. Every body row has exactly {@link #columnCount()} cells.
 */
public record Table(List<TableCell> header, List<List<TableCell>> rows) implements DocumentNode {

    public Table {
        if (header.isEmpty()) {
            throw new IllegalArgumentException("Table needs at least one header cell");
        }
        header = List.copyOf(header);
        int columns = header.size();
        rows = rows.stream().map(List::copyOf).toList();
        for (List<TableCell> row : rows) {
            if (row.size() != columns) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells, header has " + columns);
            }
        }
    }

    public int columnCount() {
        return header.size();
    }

    @Override
    public <R> R accept(DocumentVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}

package io.landadvisor.reportservice.domain.model.document;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;

import java.util.List;

public record TableCell(List<InlineRun> runs) {

    private static final TableCell EMPTY = new TableCell(List.of());

    public TableCell {
        runs = List.copyOf(runs);
    }

    public static TableCell empty() {
        return EMPTY;
    }

    public String text() {
        return InlineRun.plainText(runs);
    }
}

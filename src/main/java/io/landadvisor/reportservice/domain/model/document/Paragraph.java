package io.landadvisor.reportservice.domain.model.document;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;

import java.util.List;

public record Paragraph(List<InlineRun> runs) implements DocumentNode {

    public Paragraph {
        runs = List.copyOf(runs);
    }

    @Override
    public <R> R accept(DocumentVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}

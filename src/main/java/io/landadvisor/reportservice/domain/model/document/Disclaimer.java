package io.landadvisor.reportservice.domain.model.document;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;

import java.util.List;

/**
 * Framed closing note of a report. Never produced by the parser; the report composer promotes
 * matching paragraphs or appends a default one.
 */
public record Disclaimer(List<InlineRun> runs) implements DocumentNode {

    public Disclaimer {
        runs = List.copyOf(runs);
    }

    @Override
    public <R> R accept(DocumentVisitor<R> visitor) {
        return visitor.visitDisclaimer(this);
    }
}

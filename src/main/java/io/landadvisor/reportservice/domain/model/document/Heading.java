package io.landadvisor.reportservice.domain.model.document;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;

import java.util.List;

public record Heading(int level, List<InlineRun> runs) implements DocumentNode {

    public static final int MAX_LEVEL = 3;

    public Heading {
        if (level < 1 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Heading level must be 1-" + MAX_LEVEL + ": " + level);
        }
        runs = List.copyOf(runs);
    }

    @Override
    public <R> R accept(DocumentVisitor<R> visitor) {
        return visitor.visitHeading(this);
    }
}

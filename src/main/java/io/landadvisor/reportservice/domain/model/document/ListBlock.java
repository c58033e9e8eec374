package io.landadvisor.reportservice.domain.model.document;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;

import java.util.List;

/**
 * Flat list of items. Ordered lists are numbered by item position from 1, whatever numbers the
 * source used.
 */
public record ListBlock(boolean ordered, List<List<InlineRun>> items) implements DocumentNode {

    public ListBlock {
        items = items.stream().map(List::copyOf).toList();
    }

    public String marker(int index) {
        return ordered ? (index + 1) + "." : "•";
    }

    @Override
    public <R> R accept(DocumentVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}

package io.landadvisor.reportservice.domain.model.document;

/** Thematic break. */
public record Rule() implements DocumentNode {

    @Override
    public <R> R accept(DocumentVisitor<R> visitor) {
        return visitor.visitRule(this);
    }
}

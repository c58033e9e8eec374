package io.landadvisor.reportservice.domain.model.document;

import java.util.List;

/**
 * Parsed report: block nodes in source order.
 */
public record Document(List<DocumentNode> nodes) {

    public Document {
        nodes = List.copyOf(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}

package io.landadvisor.reportservice.domain.model.document;

/**
 * Block-level element of a parsed report. The set of variants is closed; consumers dispatch
 * through {@link DocumentVisitor} so that a new variant fails to compile until every consumer
 * handles it.
 */
public sealed interface DocumentNode permits Heading, Paragraph, ListBlock, Table, Rule, Disclaimer {

    <R> R accept(DocumentVisitor<R> visitor);
}

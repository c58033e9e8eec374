package io.landadvisor.reportservice.domain.model.document;

public interface DocumentVisitor<R> {

    R visitHeading(Heading heading);

    R visitParagraph(Paragraph paragraph);

    R visitList(ListBlock list);

    R visitTable(Table table);

    R visitRule(Rule rule);

    R visitDisclaimer(Disclaimer disclaimer);
}

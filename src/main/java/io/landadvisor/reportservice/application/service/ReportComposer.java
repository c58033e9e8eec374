package io.landadvisor.reportservice.application.service;

import io.landadvisor.reportservice.domain.dto.ReportOptions;
import io.landadvisor.reportservice.domain.model.ReportLanguage;
import io.landadvisor.reportservice.domain.model.document.Disclaimer;
import io.landadvisor.reportservice.domain.model.document.Document;
import io.landadvisor.reportservice.domain.model.document.DocumentNode;
import io.landadvisor.reportservice.domain.model.document.DocumentVisitor;
import io.landadvisor.reportservice.domain.model.document.Heading;
import io.landadvisor.reportservice.domain.model.document.ListBlock;
import io.landadvisor.reportservice.domain.model.document.Paragraph;
import io.landadvisor.reportservice.domain.model.document.Rule;
import io.landadvisor.reportservice.domain.model.document.Table;
import io.landadvisor.reportservice.domain.model.document.TableCell;
import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Wraps the parsed answer in the report frame: title heading, "Prepared for" and "Location"
 * lines on top, and a disclaimer at the end. A paragraph starting with "Disclaimer:" (or its
 * Hindi equivalent) is promoted to the disclaimer block; when no node mentions a disclaimer at
 * all, the default one for the report language is appended.
 */
@Service
public class ReportComposer {

    static final String DEFAULT_NAME = "User";
    static final String DEFAULT_LOCATION = "Not Specified";

    private static final NodeText NODE_TEXT = new NodeText();

    public Document compose(Document body, ReportOptions options, ReportLanguage language) {
        List<DocumentNode> nodes = new ArrayList<>(body.nodes().size() + 4);
        nodes.add(new Heading(1, List.of(InlineRun.bold(orDefault(options.getTitle(), language.reportTitle())))));
        nodes.add(new Paragraph(List.of(
                InlineRun.bold(language.preparedForLabel() + orDefault(options.getAuthorName(), DEFAULT_NAME)))));
        nodes.add(new Paragraph(List.of(
                InlineRun.bold(language.locationLabel() + orDefault(options.getLocation(), DEFAULT_LOCATION)))));
        nodes.add(new Rule());

        boolean hasDisclaimer = false;
        for (DocumentNode node : body.nodes()) {
            if (node instanceof Paragraph p && startsWithDisclaimer(p)) {
                nodes.add(new Disclaimer(p.runs()));
                hasDisclaimer = true;
            } else {
                nodes.add(node);
                hasDisclaimer |= mentionsDisclaimer(node.accept(NODE_TEXT));
            }
        }
        if (!hasDisclaimer) {
            nodes.add(new Disclaimer(List.of(InlineRun.plain(language.defaultDisclaimer()))));
        }
        return new Document(nodes);
    }

    private static boolean startsWithDisclaimer(Paragraph paragraph) {
        String text = InlineRun.plainText(paragraph.runs()).strip().toLowerCase(Locale.ROOT);
        for (ReportLanguage language : ReportLanguage.values()) {
            if (text.startsWith(language.disclaimerKeyword().toLowerCase(Locale.ROOT) + ":")) return true;
        }
        return false;
    }

    private static boolean mentionsDisclaimer(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (ReportLanguage language : ReportLanguage.values()) {
            if (lower.contains(language.disclaimerKeyword().toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.strip();
    }

    /** Plain text of a node, for keyword checks. */
    private static final class NodeText implements DocumentVisitor<String> {

        @Override
        public String visitHeading(Heading heading) {
            return InlineRun.plainText(heading.runs());
        }

        @Override
        public String visitParagraph(Paragraph paragraph) {
            return InlineRun.plainText(paragraph.runs());
        }

        @Override
        public String visitList(ListBlock list) {
            StringBuilder sb = new StringBuilder();
            for (List<InlineRun> item : list.items()) sb.append(InlineRun.plainText(item)).append('\n');
            return sb.toString();
        }

        @Override
        public String visitTable(Table table) {
            StringBuilder sb = new StringBuilder();
            for (TableCell cell : table.header()) sb.append(cell.text()).append(' ');
            for (List<TableCell> row : table.rows()) {
                for (TableCell cell : row) sb.append(cell.text()).append(' ');
            }
            return sb.toString();
        }

        @Override
        public String visitRule(Rule rule) {
            return "";
        }

        @Override
        public String visitDisclaimer(Disclaimer disclaimer) {
            return InlineRun.plainText(disclaimer.runs());
        }
    }
}

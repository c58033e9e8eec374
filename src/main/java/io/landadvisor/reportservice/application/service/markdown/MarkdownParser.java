package io.landadvisor.reportservice.application.service.markdown;

import io.landadvisor.reportservice.application.util.ReportTextUtils;
import io.landadvisor.reportservice.domain.model.document.Document;
import io.landadvisor.reportservice.domain.model.document.DocumentNode;
import io.landadvisor.reportservice.domain.model.document.Heading;
import io.landadvisor.reportservice.domain.model.document.ListBlock;
import io.landadvisor.reportservice.domain.model.document.Paragraph;
import io.landadvisor.reportservice.domain.model.document.Rule;
import io.landadvisor.reportservice.domain.model.document.Table;
import io.landadvisor.reportservice.domain.model.document.TableCell;
import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parser for the Markdown subset the report model is prompted to emit: ATX headings
 * (levels 1-3), flat bulleted and numbered lists, pipe tables, thematic breaks, paragraphs and
 * inline emphasis.
 * <p>
 * Never fails: anything it does not recognise becomes paragraph text, so a malformed answer
 * still yields a report.
 */
@Service
public class MarkdownParser {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownParser.class);

    private static final Pattern HEADING = Pattern.compile("^(#+)\\s+(.*?)(?:\\s+#+)?\\s*$");
    private static final Pattern UNORDERED_ITEM = Pattern.compile("^[-*]\\s+(.*)$");
    private static final Pattern ORDERED_ITEM = Pattern.compile("^(\\d{1,9})\\.\\s+(.*)$");
    private static final Pattern THEMATIC_BREAK = Pattern.compile("^(?:(?:-[ ]*){3,}|(?:\\*[ ]*){3,})$");
    private static final Pattern TABLE_SEPARATOR = Pattern.compile("^[\\s|:-]*-[\\s|:-]*$");

    private record ListItemLine(boolean ordered, String content) {
    }

    public Document parse(String text) {
        String[] lines = ReportTextUtils.normalize(text).split("\\R", -1);
        List<DocumentNode> nodes = new ArrayList<>();

        int i = 0;
        while (i < lines.length) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                i++;
            } else if (THEMATIC_BREAK.matcher(line).matches()) {
                nodes.add(new Rule());
                i++;
            } else if (HEADING.matcher(line).matches()) {
                nodes.add(parseHeading(line));
                i++;
            } else if (startsTable(lines, i)) {
                i = parseTable(lines, i, nodes);
            } else if (listItem(line) != null) {
                i = parseList(lines, i, nodes);
            } else {
                i = parseParagraph(lines, i, nodes);
            }
        }

        logger.debug("Parsed {} blocks from {} lines", nodes.size(), lines.length);
        return new Document(nodes);
    }

    // ---------- blocks ----------

    private Heading parseHeading(String line) {
        Matcher m = HEADING.matcher(line);
        if (!m.matches()) {
            throw new IllegalStateException("Not a heading: " + line);
        }
        int level = Math.min(m.group(1).length(), Heading.MAX_LEVEL);
        return new Heading(level, InlineParser.parse(m.group(2)));
    }

    private int parseList(String[] lines, int start, List<DocumentNode> out) {
        ListItemLine first = listItem(lines[start].strip());
        List<List<InlineRun>> items = new ArrayList<>();

        int i = start;
        while (i < lines.length) {
            String line = lines[i].strip();
            if (line.isEmpty() || THEMATIC_BREAK.matcher(line).matches()) break;
            ListItemLine item = listItem(line);
            if (item == null || item.ordered() != first.ordered()) break;
            items.add(InlineParser.parse(item.content()));
            i++;
        }

        out.add(new ListBlock(first.ordered(), items));
        return i;
    }

    private int parseTable(String[] lines, int start, List<DocumentNode> out) {
        List<String> headerCells = splitRow(lines[start]);
        int columns = headerCells.size();
        List<TableCell> header = new ArrayList<>(columns);
        for (String cell : headerCells) {
            header.add(new TableCell(InlineParser.parse(cell)));
        }

        List<List<TableCell>> rows = new ArrayList<>();
        int i = start + 2; // header + separator
        while (i < lines.length) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.indexOf('|') < 0 || endsTable(line)) break;
            i++;
            if (isSeparator(line)) continue;
            rows.add(normalizeRow(splitRow(line), columns));
        }

        out.add(new Table(header, rows));
        return i;
    }

    private int parseParagraph(String[] lines, int start, List<DocumentNode> out) {
        StringBuilder text = new StringBuilder(lines[start].strip());
        int i = start + 1;
        while (i < lines.length) {
            String line = lines[i].strip();
            if (line.isEmpty() || startsBlock(lines, i)) break;
            text.append(' ').append(line);
            i++;
        }

        List<InlineRun> runs = InlineParser.parse(text.toString());
        if (!runs.isEmpty()) {
            out.add(new Paragraph(runs));
        }
        return i;
    }

    private boolean startsBlock(String[] lines, int index) {
        String line = lines[index].strip();
        return THEMATIC_BREAK.matcher(line).matches()
                || HEADING.matcher(line).matches()
                || startsTable(lines, index)
                || listItem(line) != null;
    }

    // ---------- line classification ----------

    private static ListItemLine listItem(String line) {
        Matcher ordered = ORDERED_ITEM.matcher(line);
        if (ordered.matches()) {
            return new ListItemLine(true, ordered.group(2));
        }
        Matcher unordered = UNORDERED_ITEM.matcher(line);
        if (unordered.matches()) {
            return new ListItemLine(false, unordered.group(1));
        }
        return null;
    }

    private static boolean startsTable(String[] lines, int index) {
        if (index + 1 >= lines.length) return false;
        String header = lines[index].strip();
        String separator = lines[index + 1].strip();
        if (header.indexOf('|') < 0 || !isSeparator(separator)) return false;
        // a bare "---" under a pipe-less header would be a thematic break, not a table
        return separator.indexOf('|') >= 0 || (header.startsWith("|") && header.endsWith("|"));
    }

    /** Headings and list items end a table even when they contain a pipe. */
    private static boolean endsTable(String line) {
        return HEADING.matcher(line).matches() || listItem(line) != null;
    }

    private static boolean isSeparator(String line) {
        return TABLE_SEPARATOR.matcher(line).matches();
    }

    // ---------- table rows ----------

    static List<String> splitRow(String line) {
        String row = line.strip();
        if (row.startsWith("|")) row = row.substring(1);
        if (row.endsWith("|") && !row.endsWith("\\|")) row = row.substring(0, row.length() - 1);

        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        for (int i = 0; i < row.length(); i++) {
            char c = row.charAt(i);
            if (c == '\\' && i + 1 < row.length() && row.charAt(i + 1) == '|') {
                cell.append('|');
                i++;
            } else if (c == '|') {
                cells.add(cell.toString().strip());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString().strip());
        return cells;
    }

    private static List<TableCell> normalizeRow(List<String> cells, int columns) {
        List<TableCell> row = new ArrayList<>(columns);
        for (int c = 0; c < columns; c++) {
            row.add(c < cells.size() ? new TableCell(InlineParser.parse(cells.get(c))) : TableCell.empty());
        }
        return row;
    }
}

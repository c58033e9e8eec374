package io.landadvisor.reportservice.application.service.layout;

import io.landadvisor.reportservice.application.service.script.ScriptSegmenter;
import io.landadvisor.reportservice.domain.dto.DegradedRenderWarning;
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
import io.landadvisor.reportservice.domain.model.layout.LineBox;
import io.landadvisor.reportservice.domain.model.layout.Page;
import io.landadvisor.reportservice.domain.model.layout.PageGeometry;
import io.landadvisor.reportservice.domain.model.layout.RectBox;
import io.landadvisor.reportservice.domain.model.layout.TextBox;
import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Flows document nodes top to bottom over fixed-size pages and turns them into positioned
 * text, line and rectangle boxes.
 * <ul>
 *   <li>a heading is never the last thing on a page: it moves to the next page unless the start
 *   of the block after it fits below it (one body line, a table header with its first row, or the
 *   next heading with its own follower)</li>
 *   <li>paragraph and list lines break between lines</li>
 *   <li>tables break between rows and repeat their header row on every page they touch</li>
 *   <li>a row taller than a page is drawn past the bottom margin and reported</li>
 * </ul>
 * Coordinates use a top-left origin; the page writer flips them.
 */
@Service
public class LayoutEngine {

    private static final Logger logger = LoggerFactory.getLogger(LayoutEngine.class);

    private static final int WARNING_SNIPPET = 40;
    private static final float MARKER_GAP = 4f;

    private final ScriptSegmenter segmenter;
    private final TextMeasurer measurer;
    private final LineWrapper wrapper;

    public LayoutEngine(ScriptSegmenter segmenter, TextMeasurer measurer) {
        this.segmenter = segmenter;
        this.measurer = measurer;
        this.wrapper = new LineWrapper(measurer);
    }

    public List<Page> layout(Document document, PageGeometry geometry) {
        return layout(document, geometry, warning -> { });
    }

    /**
     * Lays out the document. Always returns at least one page, even for an empty document.
     */
    public List<Page> layout(Document document, PageGeometry geometry, Consumer<DegradedRenderWarning> warnings) {
        PageFlow flow = new PageFlow(geometry);
        List<DocumentNode> nodes = document.nodes();
        BlockLayouter layouter = new BlockLayouter(flow, geometry, warnings, nodes);
        for (int i = 0; i < nodes.size(); i++) {
            layouter.position = i;
            nodes.get(i).accept(layouter);
        }
        List<Page> pages = flow.finish();
        logger.debug("Laid out {} nodes on {} pages", document.nodes().size(), pages.size());
        return pages;
    }

    private final class BlockLayouter implements DocumentVisitor<Void> {

        private final PageFlow flow;
        private final PageGeometry g;
        private final Consumer<DegradedRenderWarning> warnings;
        private final float left;
        private final float contentWidth;
        private final List<DocumentNode> nodes;
        private final StartHeight startHeights = new StartHeight();
        private int position;

        BlockLayouter(PageFlow flow, PageGeometry geometry, Consumer<DegradedRenderWarning> warnings,
                      List<DocumentNode> nodes) {
            this.flow = flow;
            this.g = geometry;
            this.warnings = warnings;
            this.nodes = nodes;
            this.left = geometry.getMarginLeft();
            this.contentWidth = geometry.contentWidth();
        }

        // ---------- headings ----------

        @Override
        public Void visitHeading(Heading heading) {
            int level = heading.level();
            float size = g.headingFontSize(level);
            float leading = g.headingLeading(level);
            List<TextLine> lines = wrap(restyle(heading.runs(), TextStyle::withBold), size, contentWidth);
            if (lines.isEmpty()) return null;

            if (!flow.atTop()) flow.advance(g.getHeadingSpaceBefore());
            float block = headingBlockHeight(lines.size(), level);
            float needed = block + startHeight(position + 1);
            if (needed > g.contentBottom() - g.getMarginTop()) {
                // a run of headings taller than a page cannot stay together
                needed = block + g.getBodyLeading();
            }
            if (!flow.fits(needed) && !flow.atTop()) {
                flow.newPage();
            }

            for (TextLine line : lines) {
                emitLine(line, left, flow.y(), leading, size, g.headingColor(level));
                flow.advance(leading);
            }
            flow.advance(g.getHeadingRuleGap());
            flow.add(new LineBox(flow.pageIndex(), left, flow.y(), left + contentWidth, flow.y(),
                    g.getRuleLineWidth(), g.getRuleColor()));
            flow.advance(g.headingSpaceAfter(level));
            return null;
        }

        /** Heading lines, rule and the space below the rule. */
        private float headingBlockHeight(int lineCount, int level) {
            return lineCount * g.headingLeading(level) + g.getHeadingRuleGap() + g.getRuleLineWidth()
                    + g.headingSpaceAfter(level);
        }

        /**
         * Height the node at {@code index} needs on the current page before its first line can be
         * drawn. Headings and empty nodes add the start of whatever follows them.
         */
        private float startHeight(int index) {
            if (index >= nodes.size()) return 0f;
            DocumentNode node = nodes.get(index);
            float own = node.accept(startHeights);
            if (own == 0f || node instanceof Heading) {
                return own + startHeight(index + 1);
            }
            return own;
        }

        private final class StartHeight implements DocumentVisitor<Float> {

            @Override
            public Float visitHeading(Heading heading) {
                int level = heading.level();
                List<TextLine> lines = wrap(restyle(heading.runs(), TextStyle::withBold),
                        g.headingFontSize(level), contentWidth);
                if (lines.isEmpty()) return 0f;
                return g.getHeadingSpaceBefore() + headingBlockHeight(lines.size(), level);
            }

            @Override
            public Float visitParagraph(Paragraph paragraph) {
                return paragraph.runs().isEmpty() ? 0f : g.getBodyLeading();
            }

            @Override
            public Float visitList(ListBlock list) {
                return list.items().isEmpty() ? 0f : g.getBodyLeading();
            }

            @Override
            public Float visitTable(Table table) {
                return tableStartHeight(table);
            }

            @Override
            public Float visitRule(Rule rule) {
                return 2 * g.getRuleSpacing();
            }

            @Override
            public Float visitDisclaimer(Disclaimer disclaimer) {
                if (disclaimer.runs().isEmpty()) return 0f;
                return g.getDisclaimerSpaceBefore() + 2 * g.getDisclaimerPadding() + g.getBodyLeading();
            }
        }

        // ---------- paragraphs ----------

        @Override
        public Void visitParagraph(Paragraph paragraph) {
            List<TextLine> lines = wrap(paragraph.runs(), g.getBodyFontSize(), contentWidth);
            if (lines.isEmpty()) return null;
            flowLines(lines, left, g.getBodyFontSize(), g.getBodyLeading(), g.getTextColor());
            flow.advance(g.getParagraphSpacing());
            return null;
        }

        private void flowLines(List<TextLine> lines, float x, float size, float leading, Color color) {
            for (TextLine line : lines) {
                flow.ensureSpace(leading);
                emitLine(line, x, flow.y(), leading, size, color);
                flow.advance(leading);
            }
        }

        // ---------- lists ----------

        @Override
        public Void visitList(ListBlock list) {
            float size = g.getBodyFontSize();
            float leading = g.getBodyLeading();
            float contentX = left + g.getListIndent();
            float itemWidth = contentWidth - g.getListIndent();

            for (int i = 0; i < list.items().size(); i++) {
                List<TextLine> lines = wrap(list.items().get(i), size, itemWidth);
                List<TextLine> markerLines = wrap(List.of(InlineRun.plain(list.marker(i))), size, Float.MAX_VALUE);

                flow.ensureSpace(leading);
                float top = flow.y();
                TextLine first = lines.isEmpty() ? null : lines.get(0);
                float baseline = baseline(first != null ? first : markerLines.get(0), top, leading, size);

                if (!markerLines.isEmpty()) {
                    TextLine marker = markerLines.get(0);
                    // wide numbers ("100.") are right-aligned against the item text instead
                    float markerX = Math.min(left + g.getMarkerIndent(), contentX - MARKER_GAP - marker.width());
                    emitFragments(marker, markerX, top, baseline, leading, size, g.getTextColor());
                }
                if (first != null) {
                    emitFragments(first, contentX, top, baseline, leading, size, g.getTextColor());
                    reportOverflow(first);
                }
                flow.advance(leading);
                if (lines.size() > 1) {
                    flowLines(lines.subList(1, lines.size()), contentX, size, leading, g.getTextColor());
                }
                flow.advance(g.getListItemSpacing());
            }
            return null;
        }

        // ---------- tables ----------

        @Override
        public Void visitTable(Table table) {
            float[] widths = g.getColumnWidthPolicy().widths(table.columnCount(), contentWidth);
            float pad = g.getCellPadding();

            float headerSize = g.getTableHeaderFontSize();
            float headerLeading = tableHeaderLeading();
            List<List<TextLine>> header = wrapRow(table.header(), widths, headerSize, TextStyle::withBold);
            float headerHeight = rowHeight(header, headerLeading, pad);

            List<List<List<TextLine>>> rows = new ArrayList<>(table.rows().size());
            for (List<TableCell> row : table.rows()) {
                rows.add(wrapRow(row, widths, g.getTableFontSize(), UnaryOperator.identity()));
            }

            // the header never stays behind without the first body row
            float firstBlock = headerHeight
                    + (rows.isEmpty() ? 0f : rowHeight(rows.get(0), g.getTableLeading(), pad));
            flow.ensureSpace(firstBlock);

            float fragmentTop = flow.y();
            drawRow(header, widths, headerHeight, headerSize, headerLeading, g.getTableHeaderFill());
            int rowsOnPage = 0;

            for (int r = 0; r < rows.size(); r++) {
                List<List<TextLine>> row = rows.get(r);
                float height = rowHeight(row, g.getTableLeading(), pad);
                if (!flow.fits(height) && rowsOnPage > 0) {
                    closeTableFragment(fragmentTop);
                    flow.newPage();
                    fragmentTop = flow.y();
                    drawRow(header, widths, headerHeight, headerSize, headerLeading, g.getTableHeaderFill());
                    rowsOnPage = 0;
                }
                if (!flow.fits(height)) {
                    warn(DegradedRenderWarning.Kind.OVERSIZED_ROW,
                            "row " + (r + 1) + " is " + height + "pt tall, taller than the space left on a page");
                }
                Color fill = r % 2 == 1 ? g.getTableStripeFill() : null;
                drawRow(row, widths, height, g.getTableFontSize(), g.getTableLeading(), fill);
                rowsOnPage++;
            }
            closeTableFragment(fragmentTop);
            flow.advance(g.getTableSpacing());
            return null;
        }

        private float tableStartHeight(Table table) {
            float[] widths = g.getColumnWidthPolicy().widths(table.columnCount(), contentWidth);
            float pad = g.getCellPadding();
            float height = rowHeight(wrapRow(table.header(), widths, g.getTableHeaderFontSize(), TextStyle::withBold),
                    tableHeaderLeading(), pad);
            if (!table.rows().isEmpty()) {
                height += rowHeight(wrapRow(table.rows().get(0), widths, g.getTableFontSize(), UnaryOperator.identity()),
                        g.getTableLeading(), pad);
            }
            return height;
        }

        private float tableHeaderLeading() {
            return g.getTableLeading() * g.getTableHeaderFontSize() / g.getTableFontSize();
        }

        private List<List<TextLine>> wrapRow(List<TableCell> cells, float[] widths, float size,
                                             UnaryOperator<TextStyle> styling) {
            List<List<TextLine>> out = new ArrayList<>(cells.size());
            for (int c = 0; c < cells.size(); c++) {
                float inner = Math.max(1f, widths[c] - 2 * g.getCellPadding());
                out.add(wrap(restyle(cells.get(c).runs(), styling), size, inner));
            }
            return out;
        }

        private float rowHeight(List<List<TextLine>> cells, float leading, float pad) {
            int maxLines = 1;
            for (List<TextLine> cell : cells) {
                maxLines = Math.max(maxLines, cell.size());
            }
            return maxLines * leading + 2 * pad;
        }

        private void drawRow(List<List<TextLine>> cells, float[] widths, float height, float size,
                             float leading, Color fill) {
            int page = flow.pageIndex();
            float top = flow.y();
            float pad = g.getCellPadding();
            if (fill != null) {
                flow.add(RectBox.filled(page, left, top, contentWidth, height, fill));
            }
            float x = left;
            for (int c = 0; c < cells.size(); c++) {
                float lineTop = top + pad;
                for (TextLine line : cells.get(c)) {
                    emitLine(line, x + pad, lineTop, leading, size, g.getTextColor());
                    lineTop += leading;
                }
                x += widths[c];
            }
            x = left;
            for (float width : widths) {
                flow.add(RectBox.outlined(page, x, top, width, height, g.getGridColor(), g.getGridLineWidth()));
                x += width;
            }
            flow.advance(height);
        }

        private void closeTableFragment(float fragmentTop) {
            flow.add(RectBox.outlined(flow.pageIndex(), left, fragmentTop, contentWidth, flow.y() - fragmentTop,
                    g.getTableBorderColor(), g.getTableBorderWidth()));
        }

        // ---------- rules ----------

        @Override
        public Void visitRule(Rule rule) {
            flow.ensureSpace(2 * g.getRuleSpacing());
            flow.advance(g.getRuleSpacing());
            flow.add(new LineBox(flow.pageIndex(), left, flow.y(), left + contentWidth, flow.y(),
                    g.getRuleLineWidth(), g.getRuleColor()));
            flow.advance(g.getRuleSpacing());
            return null;
        }

        // ---------- disclaimer ----------

        @Override
        public Void visitDisclaimer(Disclaimer disclaimer) {
            float pad = g.getDisclaimerPadding();
            float size = g.getBodyFontSize();
            float leading = g.getBodyLeading();
            List<TextLine> lines = wrap(restyle(disclaimer.runs(), TextStyle::withItalic), size, contentWidth - 2 * pad);
            if (lines.isEmpty()) return null;

            if (!flow.atTop()) flow.advance(g.getDisclaimerSpaceBefore());
            flow.ensureSpace(2 * pad + leading);
            float frameTop = flow.y();
            flow.advance(pad);
            int linesInFrame = 0;
            for (TextLine line : lines) {
                if (linesInFrame > 0 && !flow.fits(leading + pad)) {
                    closeFrame(frameTop);
                    flow.newPage();
                    frameTop = flow.y();
                    flow.advance(pad);
                    linesInFrame = 0;
                }
                emitLine(line, left + pad, flow.y(), leading, size, g.getDisclaimerTextColor());
                flow.advance(leading);
                linesInFrame++;
            }
            flow.advance(pad);
            closeFrame(frameTop);
            flow.advance(g.getParagraphSpacing());
            return null;
        }

        private void closeFrame(float frameTop) {
            flow.add(RectBox.outlined(flow.pageIndex(), left, frameTop, contentWidth, flow.y() - frameTop,
                    g.getDisclaimerFrameColor(), 1f));
        }

        // ---------- lines ----------

        private List<TextLine> wrap(List<InlineRun> runs, float size, float width) {
            return wrapper.wrap(segmenter.segment(runs), size, width);
        }

        private void emitLine(TextLine line, float x, float top, float leading, float size, Color color) {
            emitFragments(line, x, top, baseline(line, top, leading, size), leading, size, color);
            reportOverflow(line);
        }

        private void emitFragments(TextLine line, float x, float top, float baseline, float leading,
                                   float size, Color color) {
            float cursor = x;
            for (TextLine.Fragment f : line.fragments()) {
                flow.add(new TextBox(flow.pageIndex(), cursor, top, f.width(), leading, baseline,
                        f.text(), f.script(), f.style(), size, color));
                cursor += f.width();
            }
        }

        /** All fragments of a line share one baseline, placed by the tallest script on it. */
        private float baseline(TextLine line, float top, float leading, float size) {
            float ascent = 0f;
            float descent = 0f;
            for (TextLine.Fragment f : line.fragments()) {
                ascent = Math.max(ascent, measurer.ascent(f.script(), size));
                descent = Math.max(descent, measurer.descent(f.script(), size));
            }
            if (ascent == 0f) {
                ascent = measurer.ascent(ScriptClass.LATIN, size);
                descent = measurer.descent(ScriptClass.LATIN, size);
            }
            return top + (leading - ascent - descent) / 2f + ascent;
        }

        private void reportOverflow(TextLine line) {
            if (!line.overflow()) return;
            String text = line.text();
            String snippet = text.length() > WARNING_SNIPPET ? text.substring(0, WARNING_SNIPPET) + "..." : text;
            warn(DegradedRenderWarning.Kind.OVERFLOW_LINE, "'" + snippet + "' does not fit its box");
        }

        private void warn(DegradedRenderWarning.Kind kind, String detail) {
            warnings.accept(new DegradedRenderWarning(kind, flow.pageIndex(), detail));
        }
    }

    private static List<InlineRun> restyle(List<InlineRun> runs, UnaryOperator<TextStyle> styling) {
        List<InlineRun> out = new ArrayList<>(runs.size());
        for (InlineRun run : runs) {
            out.add(run.withStyle(styling.apply(run.style())));
        }
        return out;
    }
}

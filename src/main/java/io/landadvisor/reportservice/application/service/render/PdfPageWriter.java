package io.landadvisor.reportservice.application.service.render;

import io.landadvisor.reportservice.domain.dto.DegradedRenderWarning;
import io.landadvisor.reportservice.domain.model.layout.LayoutBox;
import io.landadvisor.reportservice.domain.model.layout.LineBox;
import io.landadvisor.reportservice.domain.model.layout.Page;
import io.landadvisor.reportservice.domain.model.layout.RectBox;
import io.landadvisor.reportservice.domain.model.layout.TextBox;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.util.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Paints laid-out pages into a PDF with embedded, subset fonts. Layout coordinates have a
 * top-left origin; PDF user space has a bottom-left one, so every y is flipped here.
 */
@Service
public class PdfPageWriter {

    private static final Logger logger = LoggerFactory.getLogger(PdfPageWriter.class);

    static final int REPLACEMENT = '?';
    private static final float OBLIQUE_SHEAR = 0.21f;
    private static final String PRODUCER = "report-service";

    private final FontRegistry fonts;

    public PdfPageWriter(FontRegistry fonts) {
        this.fonts = fonts;
    }

    public byte[] render(List<Page> pages, DocumentInfo info, Consumer<DegradedRenderWarning> warnings)
            throws IOException {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             PDDocument doc = new PDDocument()) {

            applyInfo(doc, info);
            RenderContext ctx = new RenderContext(doc, warnings);

            if (pages.isEmpty()) {
                doc.addPage(new PDPage(PDRectangle.A4));
            }
            for (Page page : pages) {
                PDPage pdPage = new PDPage(new PDRectangle(page.width(), page.height()));
                doc.addPage(pdPage);
                try (PDPageContentStream content = new PDPageContentStream(doc, pdPage)) {
                    for (LayoutBox box : page.boxes()) {
                        paint(content, box, page.height(), ctx);
                    }
                }
            }

            doc.save(out);
            logger.debug("Wrote {} pages, {} fonts embedded", doc.getNumberOfPages(), ctx.loaded.size());
            return out.toByteArray();
        }
    }

    private void applyInfo(PDDocument doc, DocumentInfo info) {
        PDDocumentInformation pdInfo = doc.getDocumentInformation();
        pdInfo.setTitle(info.title());
        pdInfo.setAuthor(info.author());
        pdInfo.setSubject(info.subject());
        pdInfo.setProducer(PRODUCER);
        pdInfo.setCreationDate(Calendar.getInstance());
        if (info.languageTag() != null) {
            doc.getDocumentCatalog().setLanguage(info.languageTag());
        }
    }

    private void paint(PDPageContentStream content, LayoutBox box, float pageHeight, RenderContext ctx)
            throws IOException {
        if (box instanceof RectBox rect) {
            paintRect(content, rect, pageHeight);
        } else if (box instanceof LineBox line) {
            paintLine(content, line, pageHeight);
        } else if (box instanceof TextBox text) {
            paintText(content, text, pageHeight, ctx);
        } else {
            throw new IllegalStateException("Unknown box type: " + box.getClass().getName());
        }
    }

    private void paintRect(PDPageContentStream content, RectBox rect, float pageHeight) throws IOException {
        float y = pageHeight - rect.y() - rect.height();
        if (rect.fill() != null) {
            content.setNonStrokingColor(rect.fill());
            content.addRect(rect.x(), y, rect.width(), rect.height());
            content.fill();
        }
        if (rect.stroke() != null && rect.lineWidth() > 0f) {
            content.setStrokingColor(rect.stroke());
            content.setLineWidth(rect.lineWidth());
            content.addRect(rect.x(), y, rect.width(), rect.height());
            content.stroke();
        }
    }

    private void paintLine(PDPageContentStream content, LineBox line, float pageHeight) throws IOException {
        content.setStrokingColor(line.color());
        content.setLineWidth(line.lineWidth());
        content.moveTo(line.x1(), pageHeight - line.y1());
        content.lineTo(line.x2(), pageHeight - line.y2());
        content.stroke();
    }

    private void paintText(PDPageContentStream content, TextBox box, float pageHeight, RenderContext ctx)
            throws IOException {
        float x = box.x();
        float y = pageHeight - box.baseline();
        boolean oblique = box.style().italic() && box.script() == ScriptClass.LATIN;

        content.setNonStrokingColor(box.color());
        for (Segment segment : segments(box, ctx)) {
            content.beginText();
            content.setFont(ctx.font(segment.face()), box.fontSize());
            content.setTextMatrix(oblique
                    ? new Matrix(1f, 0f, OBLIQUE_SHEAR, 1f, x, y)
                    : Matrix.getTranslateInstance(x, y));
            content.showText(segment.text());
            content.endText();
            x += segment.advance() / 1000f * box.fontSize();
        }
    }

    private record Segment(FontFace face, String text, int advance) {
    }

    /**
     * Splits a text box by the face each code point is drawn with. Code points no face covers
     * become {@link #REPLACEMENT} in the primary face and are reported once per document.
     */
    private List<Segment> segments(TextBox box, RenderContext ctx) {
        FontFace primary = fonts.primary(box.script(), box.style());
        List<Segment> out = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        FontFace current = null;
        int advance = 0;

        String s = box.text();
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            i += Character.charCount(cp);

            FontFace face = fonts.resolve(cp, box.script(), box.style());
            if (face == null) {
                ctx.missing(cp, box.pageIndex());
                face = primary;
                cp = REPLACEMENT;
            }
            if (current != null && face != current) {
                out.add(new Segment(current, text.toString(), advance));
                text.setLength(0);
                advance = 0;
            }
            current = face;
            text.appendCodePoint(cp);
            advance += face.advance(cp);
        }
        if (current != null && text.length() > 0) {
            out.add(new Segment(current, text.toString(), advance));
        }
        return out;
    }

    /** Per-document state: embedded fonts and glyphs already reported. */
    private final class RenderContext {
        private final PDDocument doc;
        private final Consumer<DegradedRenderWarning> warnings;
        private final Map<FontKey, PDFont> loaded = new EnumMap<>(FontKey.class);
        private final Set<Integer> reported = new HashSet<>();

        RenderContext(PDDocument doc, Consumer<DegradedRenderWarning> warnings) {
            this.doc = doc;
            this.warnings = warnings;
        }

        PDFont font(FontFace face) throws IOException {
            PDFont font = loaded.get(face.key());
            if (font == null) {
                try (InputStream in = face.openStream()) {
                    font = PDType0Font.load(doc, in, true);
                }
                loaded.put(face.key(), font);
            }
            return font;
        }

        void missing(int codePoint, int pageIndex) {
            if (reported.add(codePoint)) {
                warnings.accept(new DegradedRenderWarning(DegradedRenderWarning.Kind.MISSING_GLYPH, pageIndex,
                        String.format("U+%04X has no glyph in any configured font", codePoint)));
            }
        }
    }
}

package io.landadvisor.reportservice.application.service.render;

import io.landadvisor.reportservice.domain.dto.DegradedRenderWarning;
import io.landadvisor.reportservice.domain.model.layout.LayoutBox;
import io.landadvisor.reportservice.domain.model.layout.LineBox;
import io.landadvisor.reportservice.domain.model.layout.Page;
import io.landadvisor.reportservice.domain.model.layout.RectBox;
import io.landadvisor.reportservice.domain.model.layout.TextBox;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PdfPageWriterTest {

    private final PdfPageWriter writer = new PdfPageWriter(TestFonts.registry());
    private final DocumentInfo info = new DocumentInfo("Land Report", "Asha", "Land use report", "en-IN");

    @Test
    void shouldWriteTextOfEveryPage() throws Exception {
        List<Page> pages = List.of(
                page(0, text(0, "First page", TextStyle.BOLD), new LineBox(0, 36, 80, 559, 80, 0.5f, Color.GRAY)),
                page(1, text(1, "Second page", TextStyle.ITALIC),
                        RectBox.filled(1, 36, 100, 200, 20, Color.LIGHT_GRAY)));

        byte[] pdf = writer.render(pages, info, warning -> { });

        try (PDDocument doc = Loader.loadPDF(pdf)) {
            assertThat(doc.getNumberOfPages()).isEqualTo(2);
            String text = new PDFTextStripper().getText(doc);
            assertThat(text).contains("First page").contains("Second page");
        }
    }

    @Test
    void shouldSetMetadataAndLanguage() throws Exception {
        byte[] pdf = writer.render(List.of(page(0)), info, warning -> { });

        try (PDDocument doc = Loader.loadPDF(pdf)) {
            assertThat(doc.getDocumentInformation().getTitle()).isEqualTo("Land Report");
            assertThat(doc.getDocumentInformation().getAuthor()).isEqualTo("Asha");
            assertThat(doc.getDocumentCatalog().getLanguage()).isEqualTo("en-IN");
        }
    }

    @Test
    void uncoveredGlyphIsReplacedAndReportedOnce() throws Exception {
        List<DegradedRenderWarning> warnings = new ArrayList<>();
        List<Page> pages = List.of(page(0, text(0, "中 and 中", TextStyle.PLAIN)));

        byte[] pdf = writer.render(pages, info, warnings::add);

        assertThat(warnings).singleElement().satisfies(warning -> {
            assertThat(warning.kind()).isEqualTo(DegradedRenderWarning.Kind.MISSING_GLYPH);
            assertThat(warning.detail()).contains("U+4E2D");
        });
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            assertThat(new PDFTextStripper().getText(doc)).contains("? and ?");
        }
    }

    @Test
    void devanagariTextIsEmbeddedWithoutWarnings() throws Exception {
        List<DegradedRenderWarning> warnings = new ArrayList<>();
        TextBox hindi = new TextBox(0, 36, 54, 200, 14, 66, "भूमि रिपोर्ट", ScriptClass.DEVANAGARI,
                TextStyle.BOLD, 10f, Color.BLACK);

        byte[] pdf = writer.render(List.of(page(0, hindi)), info, warnings::add);

        assertThat(warnings).isEmpty();
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            assertThat(new PDFTextStripper().getText(doc)).contains("भ", "म", "र", "प", "ट");
        }
    }

    @Test
    void noPagesStillProducesDocument() throws Exception {
        byte[] pdf = writer.render(List.of(), info, warning -> { });

        try (PDDocument doc = Loader.loadPDF(pdf)) {
            assertThat(doc.getNumberOfPages()).isEqualTo(1);
        }
    }

    private static Page page(int index, LayoutBox... boxes) {
        return new Page(index, 595.28f, 841.89f, List.of(boxes));
    }

    private static TextBox text(int page, String text, TextStyle style) {
        return new TextBox(page, 36, 54, 200, 14, 66, text, ScriptClass.LATIN, style, 10f, Color.BLACK);
    }
}

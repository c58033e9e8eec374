package io.landadvisor.reportservice.application.service;

import io.landadvisor.reportservice.domain.dto.PdfGenerationResult;
import io.landadvisor.reportservice.domain.dto.ReportOptions;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ReportPdfServiceTest {

    private static final String REPORT = """
            # Land Report

            Your plot is **excellent** for _retail_.

            ## Options

            1. Shop
            2. Office

            | Use | Cost |
            |---|---|
            | Shop | 5L |
            | Office |
            """;

    @Autowired
    private ReportPdfService service;

    @Test
    void shouldRenderReport() throws Exception {
        ReportOptions options = ReportOptions.builder().authorName("Asha").location("Pune").build();

        PdfGenerationResult result = service.renderReport(REPORT, options);

        assertThat(result.fileName()).isEqualTo("AI_Land_Report.pdf");
        assertThat(result.pageCount()).isEqualTo(1);
        try (PDDocument doc = Loader.loadPDF(result.pdfBytes())) {
            String text = new PDFTextStripper().getText(doc);
            assertThat(text).contains("Prepared for: Asha")
                    .contains("excellent")
                    .contains("Shop")
                    .contains("Page 1 of 1")
                    .contains("Disclaimer:");
            assertThat(doc.getDocumentCatalog().getLanguage()).isEqualTo("en-IN");
        }
    }

    @Test
    void shouldRenderHindiReport() throws Exception {
        ReportOptions options = ReportOptions.builder().languageTag("hindi").location("पुणे").build();

        PdfGenerationResult result = service.renderReport("# भूमि रिपोर्ट\n\nयह भूखंड अच्छा है।", options);

        assertThat(result.fileName()).isEqualTo("भूमि_रिपोर्ट.pdf");
        assertThat(result.warnings()).isEmpty();
        try (PDDocument doc = Loader.loadPDF(result.pdfBytes())) {
            String text = new PDFTextStripper().getText(doc);
            assertThat(text.codePoints().filter(cp -> cp >= 0x0900 && cp <= 0x097F).count()).isGreaterThan(50);
            assertThat(text).contains("भ", "ख", "ड", "ण", "ष");
            assertThat(doc.getDocumentCatalog().getLanguage()).isEqualTo("hi-IN");
        }
    }

    @Test
    void devanagariInEnglishReportHasNoWarnings() {
        PdfGenerationResult result = service.renderReport("## भूमि रिपोर्ट\n\nPlot near **मंदिर** road.", null);

        assertThat(result.warnings()).isEmpty();
        assertThat(result.pageCount()).isEqualTo(1);
    }

    @Test
    void longReportSpansSeveralPages() throws Exception {
        String markdown = REPORT + "\n" + "| Row | Value |\n|---|---|\n" + "| item | 10 |\n".repeat(200);

        PdfGenerationResult result = service.renderReport(markdown, null);

        assertThat(result.pageCount()).isGreaterThan(1);
        try (PDDocument doc = Loader.loadPDF(result.pdfBytes())) {
            assertThat(doc.getNumberOfPages()).isEqualTo(result.pageCount());
            assertThat(new PDFTextStripper().getText(doc)).contains("Page 2 of " + result.pageCount());
        }
    }

    @Test
    void garbageInputStillYieldsPdf() {
        List<String> inputs = List.of("", "\u0000\u0001", "|||||\n|-|\n", "**", "x".repeat(5000), "#\n##\n###");

        for (String input : inputs) {
            byte[] pdf = service.renderReportToPdf(input, ReportOptions.defaults());
            assertThat(pdf).as(input).startsWith("%PDF".getBytes());
        }
    }

    @Test
    void concurrentRequestsAreIndependent() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<PdfGenerationResult>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String name = "Client " + i;
                futures.add(pool.submit(() -> service.renderReport(REPORT,
                        ReportOptions.builder().authorName(name).build())));
            }
            for (int i = 0; i < futures.size(); i++) {
                PdfGenerationResult result = futures.get(i).get();
                try (PDDocument doc = Loader.loadPDF(result.pdfBytes())) {
                    assertThat(new PDFTextStripper().getText(doc)).contains("Prepared for: Client " + i);
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }
}

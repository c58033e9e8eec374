package io.landadvisor.reportservice.application.service;

import io.landadvisor.reportservice.application.service.layout.FooterDecorator;
import io.landadvisor.reportservice.application.service.layout.LayoutEngine;
import io.landadvisor.reportservice.application.service.markdown.MarkdownParser;
import io.landadvisor.reportservice.application.service.render.DocumentInfo;
import io.landadvisor.reportservice.application.service.render.PdfPageWriter;
import io.landadvisor.reportservice.domain.dto.DegradedRenderWarning;
import io.landadvisor.reportservice.domain.dto.PdfGenerationResult;
import io.landadvisor.reportservice.domain.dto.ReportOptions;
import io.landadvisor.reportservice.domain.model.ReportLanguage;
import io.landadvisor.reportservice.domain.model.document.Document;
import io.landadvisor.reportservice.domain.model.layout.Page;
import io.landadvisor.reportservice.domain.model.layout.PageGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Entry point of the pipeline: Markdown text in, PDF bytes out.
 * <p>
 * Never throws for bad input. Malformed Markdown still renders, overflowing content is drawn
 * degraded and reported, and an unexpected failure yields the fallback error document instead
 * of an exception. Stateless apart from the shared immutable fonts, so concurrent calls are safe.
 */
@Service
public class ReportPdfService {

    private static final Logger logger = LoggerFactory.getLogger(ReportPdfService.class);

    private final MarkdownParser parser;
    private final ReportComposer composer;
    private final LayoutEngine layoutEngine;
    private final FooterDecorator footerDecorator;
    private final PdfPageWriter pageWriter;
    private final FallbackPdfWriter fallbackWriter;
    private final PageGeometry geometry;

    public ReportPdfService(MarkdownParser parser,
                            ReportComposer composer,
                            LayoutEngine layoutEngine,
                            FooterDecorator footerDecorator,
                            PdfPageWriter pageWriter,
                            FallbackPdfWriter fallbackWriter,
                            PageGeometry geometry) {
        this.parser = parser;
        this.composer = composer;
        this.layoutEngine = layoutEngine;
        this.footerDecorator = footerDecorator;
        this.pageWriter = pageWriter;
        this.fallbackWriter = fallbackWriter;
        this.geometry = geometry;
    }

    public byte[] renderReportToPdf(String markdown, ReportOptions options) {
        return renderReport(markdown, options).pdfBytes();
    }

    public PdfGenerationResult renderReport(String markdown, ReportOptions options) {
        ReportOptions opts = options == null ? ReportOptions.defaults() : options;
        ReportLanguage language = ReportLanguage.fromTag(opts.getLanguageTag());

        List<DegradedRenderWarning> warnings = new ArrayList<>();
        Consumer<DegradedRenderWarning> sink = warning -> {
            logger.warn("Degraded render: {}", warning);
            warnings.add(warning);
        };

        try {
            Document body = parser.parse(markdown);
            Document document = composer.compose(body, opts, language);
            List<Page> pages = layoutEngine.layout(document, geometry, sink);
            pages = footerDecorator.decorate(pages, geometry, language);

            DocumentInfo info = new DocumentInfo(titleOf(opts, language), opts.getAuthorName(),
                    opts.getLocation(), language.languageTag());
            byte[] pdf = pageWriter.render(pages, info, sink);

            logger.info("Rendered {} report: {} pages, {} bytes, {} warnings",
                    language, pages.size(), pdf.length, warnings.size());
            return new PdfGenerationResult(language.fileName(), pdf, pages.size(), warnings);
        } catch (IOException | RuntimeException e) {
            logger.error("Report rendering failed, returning fallback document", e);
            byte[] pdf = fallbackWriter.write(e, opts, language);
            return new PdfGenerationResult(language.fileName(), pdf, 1, warnings);
        }
    }

    private static String titleOf(ReportOptions options, ReportLanguage language) {
        String title = options.getTitle();
        return title == null || title.isBlank() ? language.reportTitle() : title.strip();
    }
}

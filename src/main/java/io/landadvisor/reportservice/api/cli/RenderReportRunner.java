package io.landadvisor.reportservice.api.cli;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import io.landadvisor.reportservice.application.service.ReportPdfService;
import io.landadvisor.reportservice.application.util.ReportTextUtils;
import io.landadvisor.reportservice.domain.dto.PdfGenerationResult;
import io.landadvisor.reportservice.domain.dto.ReportOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders a Markdown file from the command line:
 * <pre>
 * --input=answer.md [--output=report.pdf] [--name=...] [--location=...] [--title=...] [--language=hindi]
 * </pre>
 * Without {@code --input} the application only starts, which verifies the font configuration.
 */
@Component
public class RenderReportRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(RenderReportRunner.class);

    private final ReportPdfService reportPdfService;

    public RenderReportRunner(ReportPdfService reportPdfService) {
        this.reportPdfService = reportPdfService;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String input = option(args, "input");
        if (input == null) {
            logger.info("Report service ready; pass --input=<file.md> to render a report");
            return;
        }

        Path source = Path.of(input);
        String markdown = readTextContent(Files.readAllBytes(source));
        ReportOptions options = ReportOptions.builder()
                .title(option(args, "title"))
                .authorName(option(args, "name"))
                .location(option(args, "location"))
                .languageTag(option(args, "language"))
                .build();

        PdfGenerationResult result = reportPdfService.renderReport(markdown, options);
        String output = option(args, "output");
        Path target = output != null ? Path.of(output) : source.toAbsolutePath().resolveSibling(result.fileName());
        Files.write(target, result.pdfBytes());
        logger.info("Wrote {} ({} pages, {} warnings)", target, result.pageCount(), result.warnings().size());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    static String readTextContent(byte[] bytes) {
        CharsetDetector detector = new CharsetDetector();
        detector.setText(bytes);
        CharsetMatch match = detector.detect();

        Charset charset = StandardCharsets.UTF_8;
        if (match != null && match.getName() != null) {
            try {
                charset = Charset.forName(match.getName());
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                logger.debug("Detected charset {} is not supported, reading as UTF-8", match.getName());
            }
        }
        return ReportTextUtils.stripBom(new String(bytes, charset));
    }
}

package io.landadvisor.reportservice.application.service;

import io.landadvisor.reportservice.domain.dto.ReportOptions;
import io.landadvisor.reportservice.domain.model.ReportLanguage;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * One-page "PDF Generation Failed" document, set in the built-in Helvetica so it cannot fail
 * for lack of a font. Text outside printable ASCII is replaced with '?'.
 */
@Component
public class FallbackPdfWriter {

    private static final float MARGIN = 72f;
    private static final float FONT_SIZE = 11f;
    private static final float LEADING = 16f;

    public byte[] write(Exception error, ReportOptions options, ReportLanguage language) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             PDDocument doc = new PDDocument()) {

            PDPage page = new PDPage(PDRectangle.A4);
            doc.addPage(page);
            PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
            float width = page.getMediaBox().getWidth() - 2 * MARGIN;

            try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                float y = page.getMediaBox().getHeight() - MARGIN;
                content.setNonStrokingColor(Color.RED);
                y = write(content, bold, 16f, "PDF Generation Failed", y, width);
                content.setNonStrokingColor(Color.BLACK);
                y -= LEADING;
                y = write(content, regular, FONT_SIZE, "An error occurred while trying to create your PDF report. "
                        + "The report text is still available in the application.", y, width);
                y -= LEADING;
                y = write(content, bold, FONT_SIZE, "Error Details:", y, width);
                y = write(content, regular, FONT_SIZE, describe(error), y, width);
                y -= LEADING;
                y = write(content, bold, FONT_SIZE, "Debug Info:", y, width);
                y = write(content, regular, FONT_SIZE, "Name: " + options.getAuthorName(), y, width);
                y = write(content, regular, FONT_SIZE, "Location: " + options.getLocation(), y, width);
                write(content, regular, FONT_SIZE, "Language: " + language.languageTag(), y, width);
            }

            doc.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Fallback PDF could not be written", e);
        }
    }

    private static float write(PDPageContentStream content, PDFont font, float size, String text, float y,
                               float width) throws IOException {
        for (String line : wrap(font, size, sanitize(text), width)) {
            content.beginText();
            content.setFont(font, size);
            content.newLineAtOffset(MARGIN, y);
            content.showText(line);
            content.endText();
            y -= LEADING;
        }
        return y;
    }

    private static List<String> wrap(PDFont font, float size, String text, float width) throws IOException {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : text.split(" ")) {
            String candidate = line.length() == 0 ? word : line + " " + word;
            if (line.length() > 0 && font.getStringWidth(candidate) / 1000 * size > width) {
                lines.add(line.toString());
                line.setLength(0);
                line.append(word);
            } else {
                line.setLength(0);
                line.append(candidate);
            }
        }
        if (line.length() > 0) lines.add(line.toString());
        return lines;
    }

    private static String describe(Exception error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    /** Helvetica here is WinAnsi-encoded; anything else would make showText throw. */
    static String sanitize(String text) {
        if (text == null) return "null";
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            sb.append(ch >= 0x20 && ch < 0x7F ? ch : Character.isWhitespace(ch) ? ' ' : '?');
        }
        return sb.toString();
    }
}

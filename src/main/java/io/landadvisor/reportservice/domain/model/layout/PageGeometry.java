package io.landadvisor.reportservice.domain.model.layout;

import lombok.Builder;
import lombok.Value;

import java.awt.Color;
import java.util.List;

/**
 * Page size, margins, type sizes and the fixed report theme, in PDF points. One instance is
 * used for a whole generation run and never changes.
 */
@Value
@Builder(toBuilder = true)
public class PageGeometry {

    // ---- page & margins ----
    @Builder.Default float pageWidth = 595.28f;
    @Builder.Default float pageHeight = 841.89f;
    @Builder.Default float marginLeft = 36f;
    @Builder.Default float marginRight = 36f;
    @Builder.Default float marginTop = 54f;
    @Builder.Default float marginBottom = 54f;

    // ---- type ----
    @Builder.Default float bodyFontSize = 10f;
    @Builder.Default float bodyLeading = 14f;
    @Builder.Default float tableFontSize = 9f;
    @Builder.Default float tableLeading = 11f;
    @Builder.Default float tableHeaderFontSize = 10f;
    @Builder.Default List<Float> headingFontSizes = List.of(18f, 14f, 12f);
    @Builder.Default float headingLineHeight = 1.25f;
    @Builder.Default float footerFontSize = 8f;

    // ---- tables & lists ----
    @Builder.Default ColumnWidthPolicy columnWidthPolicy = ColumnWidthPolicy.EQUAL;
    @Builder.Default float cellPadding = 6f;
    @Builder.Default float listIndent = 20f;
    @Builder.Default float markerIndent = 10f;

    // ---- vertical rhythm ----
    @Builder.Default float headingSpaceBefore = 6f;
    @Builder.Default List<Float> headingSpaceAfter = List.of(12f, 10f, 8f);
    @Builder.Default float headingRuleGap = 3f;
    @Builder.Default float paragraphSpacing = 6f;
    @Builder.Default float listItemSpacing = 4f;
    @Builder.Default float tableSpacing = 7.2f;
    @Builder.Default float ruleSpacing = 6f;
    @Builder.Default float disclaimerSpaceBefore = 12f;
    @Builder.Default float disclaimerPadding = 10f;

    // ---- theme ----
    @Builder.Default Color textColor = Color.BLACK;
    @Builder.Default List<Color> headingColors = List.of(
            new Color(0x2C3E50), new Color(0x16A085), new Color(0x34495E));
    @Builder.Default Color ruleColor = new Color(0xBDC3C7);
    @Builder.Default float ruleLineWidth = 0.5f;
    @Builder.Default Color tableHeaderFill = new Color(0xECF0F1);
    @Builder.Default Color tableStripeFill = new Color(0xF7F9F9);
    @Builder.Default Color gridColor = new Color(0xBDC3C7);
    @Builder.Default float gridLineWidth = 0.5f;
    @Builder.Default Color tableBorderColor = Color.BLACK;
    @Builder.Default float tableBorderWidth = 1f;
    @Builder.Default Color disclaimerTextColor = Color.GRAY;
    @Builder.Default Color disclaimerFrameColor = Color.LIGHT_GRAY;
    @Builder.Default Color footerColor = Color.DARK_GRAY;

    public static PageGeometry a4() {
        return PageGeometry.builder().build();
    }

    public float contentWidth() {
        return pageWidth - marginLeft - marginRight;
    }

    public float contentBottom() {
        return pageHeight - marginBottom;
    }

    public float headingFontSize(int level) {
        return headingFontSizes.get(levelIndex(level, headingFontSizes.size()));
    }

    public float headingLeading(int level) {
        return headingFontSize(level) * headingLineHeight;
    }

    public float headingSpaceAfter(int level) {
        return headingSpaceAfter.get(levelIndex(level, headingSpaceAfter.size()));
    }

    public Color headingColor(int level) {
        return headingColors.get(levelIndex(level, headingColors.size()));
    }

    private static int levelIndex(int level, int size) {
        return Math.max(0, Math.min(level, size) - 1);
    }
}

package io.landadvisor.reportservice.domain.dto;

/**
 * Recoverable rendering problem. The document is still produced, with visibly degraded content.
 */
public record DegradedRenderWarning(Kind kind, int pageIndex, String detail) {

    public enum Kind {
        /** Unbreakable text wider than its box, drawn past the edge. */
        OVERFLOW_LINE,
        /** Table row taller than a page, drawn past the bottom margin. */
        OVERSIZED_ROW,
        /** Code point no configured font covers, painted as a substitute. */
        MISSING_GLYPH
    }

    @Override
    public String toString() {
        return kind + " on page " + (pageIndex + 1) + ": " + detail;
    }
}

package io.landadvisor.reportservice.domain.dto;

import java.util.List;
import java.util.Objects;

public record PdfGenerationResult(String fileName,
                                  byte[] pdfBytes,
                                  int pageCount,
                                  List<DegradedRenderWarning> warnings) {

    public PdfGenerationResult {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(pdfBytes, "pdfBytes");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean degraded() {
        return !warnings.isEmpty();
    }
}

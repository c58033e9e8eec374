package io.landadvisor.reportservice.domain.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request cosmetic options. Blank values fall back to the localised defaults.
 */
@Value
@Builder
public class ReportOptions {
    String title;
    String authorName;
    String location;
    String languageTag;

    public static ReportOptions defaults() {
        return ReportOptions.builder().build();
    }
}

package io.landadvisor.reportservice.domain.model;

import java.util.Locale;

/**
 * Language of the cosmetic report labels. Parsing and layout never depend on it; they are
 * driven by the script of each character.
 */
public enum ReportLanguage {

    ENGLISH("en-IN",
            "Professional Land Use Report",
            "Prepared for: ",
            "Location: ",
            "Disclaimer",
            "Disclaimer: This report is for informational purposes only. Please consult with local "
                    + "zoning authorities, financial advisors, and legal professionals before making any "
                    + "investment decisions.",
            "Page %d of %d",
            "AI_Land_Report.pdf"),

    HINDI("hi-IN",
            "पेशेवर भूमि उपयोग रिपोर्ट",
            "तैयार की गई: ",
            "स्थान: ",
            "अस्वीकरण",
            "अस्वीकरण: यह रिपोर्ट केवल सूचनात्मक उद्देश्यों के लिए है। किसी भी निवेश निर्णय लेने से पहले "
                    + "कृपया स्थानीय जोनिंग अधिकारियों, वित्तीय सलाहकारों और कानूनी पेशेवरों से परामर्श करें।",
            "पृष्ठ %d / %d",
            "भूमि_रिपोर्ट.pdf");

    private final String languageTag;
    private final String reportTitle;
    private final String preparedForLabel;
    private final String locationLabel;
    private final String disclaimerKeyword;
    private final String defaultDisclaimer;
    private final String pageLabelFormat;
    private final String fileName;

    ReportLanguage(String languageTag, String reportTitle, String preparedForLabel, String locationLabel,
                   String disclaimerKeyword, String defaultDisclaimer, String pageLabelFormat, String fileName) {
        this.languageTag = languageTag;
        this.reportTitle = reportTitle;
        this.preparedForLabel = preparedForLabel;
        this.locationLabel = locationLabel;
        this.disclaimerKeyword = disclaimerKeyword;
        this.defaultDisclaimer = defaultDisclaimer;
        this.pageLabelFormat = pageLabelFormat;
        this.fileName = fileName;
    }

    /**
     * Accepts the form values {@code english}/{@code hindi} as well as BCP-47 tags such as
     * {@code hi} or {@code hi-IN}. Unknown or blank tags map to English.
     */
    public static ReportLanguage fromTag(String tag) {
        if (tag == null || tag.isBlank()) return ENGLISH;
        String t = tag.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (t.equals("hindi") || t.equals("hi") || t.startsWith("hi-")) {
            return HINDI;
        }
        return ENGLISH;
    }

    public String languageTag() {
        return languageTag;
    }

    public String reportTitle() {
        return reportTitle;
    }

    public String preparedForLabel() {
        return preparedForLabel;
    }

    public String locationLabel() {
        return locationLabel;
    }

    public String disclaimerKeyword() {
        return disclaimerKeyword;
    }

    public String defaultDisclaimer() {
        return defaultDisclaimer;
    }

    public String fileName() {
        return fileName;
    }

    public String pageLabel(int pageNumber, int pageCount) {
        return String.format(Locale.ROOT, pageLabelFormat, pageNumber, pageCount);
    }
}

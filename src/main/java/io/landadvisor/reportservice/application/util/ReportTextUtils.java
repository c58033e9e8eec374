package io.landadvisor.reportservice.application.util;

import com.ibm.icu.text.Normalizer2;

public final class ReportTextUtils {

    private static final char BOM = '\uFEFF';

    private ReportTextUtils() {
    }

    /**
     * Prepares machine-generated report text for parsing: drops a leading BOM, composes to NFC
     * (Devanagari nukta and vowel-sign sequences become their canonical form), turns tabs into
     * spaces and removes C0 control characters other than line breaks.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        String composed = Normalizer2.getNFCInstance().normalize(stripBom(text));
        StringBuilder sb = new StringBuilder(composed.length());
        for (int i = 0; i < composed.length(); i++) {
            char ch = composed.charAt(i);
            switch (ch) {
                case '\t' -> sb.append(' ');
                case '\n', '\r' -> sb.append(ch);
                default -> {
                    if (ch >= 0x20 && ch != 0x7F) sb.append(ch);
                }
            }
        }
        return sb.toString();
    }

    public static String stripBom(String input) {
        if (input == null || input.isEmpty()) {
            return input == null ? "" : input;
        }
        if (input.charAt(0) == BOM) {
            return input.substring(1);
        }
        return input;
    }

    public static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || codePoint == 0x00A0;
    }
}

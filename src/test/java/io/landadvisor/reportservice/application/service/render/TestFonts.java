package io.landadvisor.reportservice.application.service.render;

import org.springframework.core.io.DefaultResourceLoader;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry over the bundled DejaVu faces for Latin and the derived test faces for Devanagari.
 * Neither covers CJK, so CJK text exercises the missing-glyph path.
 */
final class TestFonts {

    static final String REGULAR = "classpath:fonts/DejaVuSans.ttf";
    static final String BOLD = "classpath:fonts/DejaVuSans-Bold.ttf";
    static final String DEVANAGARI_REGULAR = "classpath:fonts/ReportTestDevanagari-Regular.ttf";
    static final String DEVANAGARI_BOLD = "classpath:fonts/ReportTestDevanagari-Bold.ttf";

    private static FontRegistry registry;

    private TestFonts() {
    }

    static synchronized FontRegistry registry() {
        if (registry == null) {
            registry = FontRegistry.load(locations(), new DefaultResourceLoader());
        }
        return registry;
    }

    static Map<FontKey, String> locations() {
        Map<FontKey, String> map = new EnumMap<>(FontKey.class);
        map.put(FontKey.LATIN_REGULAR, REGULAR);
        map.put(FontKey.LATIN_BOLD, BOLD);
        map.put(FontKey.DEVANAGARI_REGULAR, DEVANAGARI_REGULAR);
        map.put(FontKey.DEVANAGARI_BOLD, DEVANAGARI_BOLD);
        return map;
    }
}

package io.landadvisor.reportservice.application.service.render;

import io.landadvisor.reportservice.application.service.layout.TextMeasurer;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;
import org.springframework.stereotype.Component;

/**
 * Measures with the same per-code-point face choice the page writer paints with, so laid-out
 * widths match what ends up on the page. Uncovered code points count as '?'.
 * Advances ignore GSUB shaping; conjuncts are measured as their component characters.
 */
@Component
public class FontMetricsMeasurer implements TextMeasurer {

    private final FontRegistry fonts;

    public FontMetricsMeasurer(FontRegistry fonts) {
        this.fonts = fonts;
    }

    @Override
    public float width(String text, ScriptClass script, TextStyle style, float fontSize) {
        FontFace primary = fonts.primary(script, style);
        int units = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            FontFace face = fonts.resolve(cp, script, style);
            units += face != null ? face.advance(cp) : primary.advance(PdfPageWriter.REPLACEMENT);
            i += Character.charCount(cp);
        }
        return units / 1000f * fontSize;
    }

    @Override
    public float ascent(ScriptClass script, float fontSize) {
        return fonts.primary(script, TextStyle.PLAIN).ascent() / 1000f * fontSize;
    }

    @Override
    public float descent(ScriptClass script, float fontSize) {
        return fonts.primary(script, TextStyle.PLAIN).descent() / 1000f * fontSize;
    }
}

package io.landadvisor.reportservice.application.service.layout;

import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;

/**
 * Every code point is half an em wide, so widths are easy to predict in tests.
 */
class FixedWidthMeasurer implements TextMeasurer {

    static final float ADVANCE = 0.5f;

    @Override
    public float width(String text, ScriptClass script, TextStyle style, float fontSize) {
        return text.codePointCount(0, text.length()) * ADVANCE * fontSize;
    }

    @Override
    public float ascent(ScriptClass script, float fontSize) {
        return 0.8f * fontSize;
    }

    @Override
    public float descent(ScriptClass script, float fontSize) {
        return 0.2f * fontSize;
    }
}

package io.landadvisor.reportservice.application.service.layout;

import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;

/**
 * Font metrics as seen by the layout engine. All results are in PDF points for the given size.
 * Implementations must be safe for concurrent use.
 */
public interface TextMeasurer {

    float width(String text, ScriptClass script, TextStyle style, float fontSize);

    float ascent(ScriptClass script, float fontSize);

    float descent(ScriptClass script, float fontSize);
}

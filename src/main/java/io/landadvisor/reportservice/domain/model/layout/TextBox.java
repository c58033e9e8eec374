package io.landadvisor.reportservice.domain.model.layout;

import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;

import java.awt.Color;

/**
 * One script run on one line. {@code y} is the top of the line box, {@code baseline} the
 * absolute baseline position.
 */
public record TextBox(int pageIndex,
                      float x,
                      float y,
                      float width,
                      float height,
                      float baseline,
                      String text,
                      ScriptClass script,
                      TextStyle style,
                      float fontSize,
                      Color color) implements LayoutBox {
}

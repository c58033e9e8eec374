package io.landadvisor.reportservice.domain.model.layout;

import java.awt.Color;

/**
 * Rectangle painted with an optional fill and an optional outline.
 */
public record RectBox(int pageIndex,
                      float x,
                      float y,
                      float width,
                      float height,
                      Color fill,
                      Color stroke,
                      float lineWidth) implements LayoutBox {

    public static RectBox filled(int pageIndex, float x, float y, float width, float height, Color fill) {
        return new RectBox(pageIndex, x, y, width, height, fill, null, 0f);
    }

    public static RectBox outlined(int pageIndex, float x, float y, float width, float height,
                                   Color stroke, float lineWidth) {
        return new RectBox(pageIndex, x, y, width, height, null, stroke, lineWidth);
    }
}

package io.landadvisor.reportservice.domain.model.layout;

import java.awt.Color;

public record LineBox(int pageIndex,
                      float x1,
                      float y1,
                      float x2,
                      float y2,
                      float lineWidth,
                      Color color) implements LayoutBox {
}

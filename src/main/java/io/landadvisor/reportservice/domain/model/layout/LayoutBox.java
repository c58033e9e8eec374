package io.landadvisor.reportservice.domain.model.layout;

/**
 * Positioned paint instruction on one page. Coordinates are PDF points measured from the
 * top-left corner of the page.
 */
public sealed interface LayoutBox permits TextBox, LineBox, RectBox {

    int pageIndex();
}

package io.landadvisor.reportservice.application.service.layout;

import io.landadvisor.reportservice.domain.model.layout.LayoutBox;
import io.landadvisor.reportservice.domain.model.layout.Page;
import io.landadvisor.reportservice.domain.model.layout.PageGeometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Vertical cursor over the pages of one layout call. Not shared between calls.
 */
final class PageFlow {

    private static final float EPSILON = 0.01f;

    private final PageGeometry geometry;
    private final List<List<LayoutBox>> pages = new ArrayList<>();
    private float y;

    PageFlow(PageGeometry geometry) {
        this.geometry = geometry;
        newPage();
    }

    void newPage() {
        pages.add(new ArrayList<>());
        y = geometry.getMarginTop();
    }

    int pageIndex() {
        return pages.size() - 1;
    }

    float y() {
        return y;
    }

    void advance(float dy) {
        y += dy;
    }

    boolean atTop() {
        return y <= geometry.getMarginTop() + EPSILON;
    }

    boolean fits(float height) {
        return y + height <= geometry.contentBottom() + EPSILON;
    }

    /** Breaks to a new page unless {@code height} fits below the cursor or the page is still empty. */
    boolean ensureSpace(float height) {
        if (fits(height) || atTop()) return false;
        newPage();
        return true;
    }

    void add(LayoutBox box) {
        pages.get(pageIndex()).add(box);
    }

    List<Page> finish() {
        List<Page> out = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            out.add(new Page(i, geometry.getPageWidth(), geometry.getPageHeight(), pages.get(i)));
        }
        return out;
    }
}

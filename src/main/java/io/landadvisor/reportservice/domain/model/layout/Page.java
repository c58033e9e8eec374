package io.landadvisor.reportservice.domain.model.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Laid-out page: its size and paint instructions in painting order. Every box carries this
 * page's index.
 */
public record Page(int index, float width, float height, List<LayoutBox> boxes) {

    public Page {
        boxes = List.copyOf(boxes);
        for (LayoutBox box : boxes) {
            if (box.pageIndex() != index) {
                throw new IllegalArgumentException("Box for page " + box.pageIndex() + " added to page " + index);
            }
        }
    }

    public Page withAdditionalBoxes(List<? extends LayoutBox> extra) {
        List<LayoutBox> all = new ArrayList<>(boxes.size() + extra.size());
        all.addAll(boxes);
        all.addAll(extra);
        return new Page(index, width, height, all);
    }
}

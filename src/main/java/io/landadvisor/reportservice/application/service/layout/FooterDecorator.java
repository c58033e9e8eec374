package io.landadvisor.reportservice.application.service.layout;

import io.landadvisor.reportservice.application.service.script.ScriptSegmenter;
import io.landadvisor.reportservice.domain.model.ReportLanguage;
import io.landadvisor.reportservice.domain.model.layout.Page;
import io.landadvisor.reportservice.domain.model.layout.PageGeometry;
import io.landadvisor.reportservice.domain.model.layout.TextBox;
import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptRun;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds the centred "Page n of m" label to the bottom margin. Runs after layout because the
 * total page count is only known then.
 */
@Service
public class FooterDecorator {

    private final ScriptSegmenter segmenter;
    private final TextMeasurer measurer;

    public FooterDecorator(ScriptSegmenter segmenter, TextMeasurer measurer) {
        this.segmenter = segmenter;
        this.measurer = measurer;
    }

    public List<Page> decorate(List<Page> pages, PageGeometry geometry, ReportLanguage language) {
        float size = geometry.getFooterFontSize();
        int total = pages.size();
        List<Page> out = new ArrayList<>(total);
        for (Page page : pages) {
            String label = language.pageLabel(page.index() + 1, total);
            List<ScriptRun> runs = segmenter.segment(InlineRun.plain(label));

            float[] widths = new float[runs.size()];
            float labelWidth = 0f;
            for (int i = 0; i < runs.size(); i++) {
                ScriptRun run = runs.get(i);
                widths[i] = measurer.width(run.text(), run.script(), run.style(), size);
                labelWidth += widths[i];
            }

            float baseline = page.height() - geometry.getMarginBottom() / 2f;
            float x = (page.width() - labelWidth) / 2f;
            List<TextBox> boxes = new ArrayList<>(runs.size());
            for (int i = 0; i < runs.size(); i++) {
                ScriptRun run = runs.get(i);
                boxes.add(new TextBox(page.index(), x, baseline - size, widths[i], size * 1.2f, baseline,
                        run.text(), run.script(), run.style(), size, geometry.getFooterColor()));
                x += widths[i];
            }
            out.add(page.withAdditionalBoxes(boxes));
        }
        return out;
    }
}

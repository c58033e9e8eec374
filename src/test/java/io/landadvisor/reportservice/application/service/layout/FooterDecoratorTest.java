package io.landadvisor.reportservice.application.service.layout;

import io.landadvisor.reportservice.application.service.script.ScriptSegmenter;
import io.landadvisor.reportservice.domain.model.ReportLanguage;
import io.landadvisor.reportservice.domain.model.layout.Page;
import io.landadvisor.reportservice.domain.model.layout.PageGeometry;
import io.landadvisor.reportservice.domain.model.layout.TextBox;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class FooterDecoratorTest {

    private final FooterDecorator decorator = new FooterDecorator(new ScriptSegmenter(), new FixedWidthMeasurer());
    private final PageGeometry geometry = PageGeometry.a4();

    @Test
    void shouldLabelEveryPageWithTotal() {
        List<Page> pages = decorator.decorate(blankPages(3), geometry, ReportLanguage.ENGLISH);

        assertThat(pages).extracting(FooterDecoratorTest::label)
                .containsExactly("Page 1 of 3", "Page 2 of 3", "Page 3 of 3");
    }

    @Test
    void hindiLabelIsCentredInBottomMargin() {
        List<Page> pages = decorator.decorate(blankPages(1), geometry, ReportLanguage.HINDI);

        assertThat(label(pages.get(0))).isEqualTo("पृष्ठ 1 / 1");
        List<TextBox> boxes = pages.get(0).boxes().stream().map(TextBox.class::cast).toList();
        float width = 0f;
        for (TextBox box : boxes) width += box.width();
        assertThat(boxes.get(0).x()).isCloseTo((geometry.getPageWidth() - width) / 2f, offset(0.01f));
        assertThat(boxes.get(0).baseline()).isGreaterThan(geometry.contentBottom());
    }

    private static List<Page> blankPages(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Page(i, 595.28f, 841.89f, List.of()))
                .toList();
    }

    private static String label(Page page) {
        StringBuilder sb = new StringBuilder();
        page.boxes().forEach(box -> sb.append(((TextBox) box).text()));
        return sb.toString();
    }
}

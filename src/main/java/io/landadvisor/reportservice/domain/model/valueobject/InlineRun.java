package io.landadvisor.reportservice.domain.model.valueobject;

import java.util.List;
import java.util.Objects;

/**
 * A span of raw text with one emphasis style. Runs of a block are painted in order with no
 * separator in between.
 */
public record InlineRun(String text, TextStyle style) {

    public InlineRun {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(style, "style");
    }

    public static InlineRun plain(String text) {
        return new InlineRun(text, TextStyle.PLAIN);
    }

    public static InlineRun bold(String text) {
        return new InlineRun(text, TextStyle.BOLD);
    }

    public static InlineRun italic(String text) {
        return new InlineRun(text, TextStyle.ITALIC);
    }

    public InlineRun withStyle(TextStyle newStyle) {
        return new InlineRun(text, newStyle);
    }

    public static String plainText(List<InlineRun> runs) {
        StringBuilder sb = new StringBuilder();
        for (InlineRun run : runs) {
            sb.append(run.text());
        }
        return sb.toString();
    }
}

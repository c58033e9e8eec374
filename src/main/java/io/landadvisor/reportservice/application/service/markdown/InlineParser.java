package io.landadvisor.reportservice.application.service.markdown;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Emphasis scanner for one line of block text.
 * <p>
 * Recognises {@code ***x***} (bold italic), {@code **x**} (bold), {@code *x*} and {@code _x_}
 * (italic). The line is scanned left to right and each opener is paired with the nearest
 * closer of the same kind; emphasis does not nest. An opener without a closer stays literal.
 */
public final class InlineParser {

    private enum Delimiter {
        TRIPLE_STAR("***", TextStyle.BOLD_ITALIC),
        DOUBLE_STAR("**", TextStyle.BOLD),
        STAR("*", TextStyle.ITALIC),
        UNDERSCORE("_", TextStyle.ITALIC);

        final String token;
        final TextStyle style;

        Delimiter(String token, TextStyle style) {
            this.token = token;
            this.style = style;
        }

        int length() {
            return token.length();
        }
    }

    private InlineParser() {
    }

    public static List<InlineRun> parse(String text) {
        List<InlineRun> runs = new ArrayList<>();
        if (text == null || text.isEmpty()) return runs;

        StringBuilder plain = new StringBuilder();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c != '*' && c != '_') {
                plain.append(c);
                i++;
                continue;
            }

            int consumed = tryEmphasis(text, i, plain, runs);
            if (consumed > 0) {
                i += consumed;
                continue;
            }

            // unmatched: keep the whole delimiter literal so "**" is not retried as "*"
            int literal = c == '*' ? starCount(text, i) : 1;
            plain.append(text, i, i + literal);
            i += literal;
        }
        flush(plain, TextStyle.PLAIN, runs);
        return merge(runs);
    }

    private static int tryEmphasis(String text, int at, StringBuilder plain, List<InlineRun> runs) {
        for (Delimiter d : candidates(text, at)) {
            if (!canOpen(text, at, d)) continue;
            int close = findClose(text, at + d.length(), d);
            if (close < 0) continue;

            flush(plain, TextStyle.PLAIN, runs);
            runs.add(new InlineRun(text.substring(at + d.length(), close), d.style));
            return close + d.length() - at;
        }
        return 0;
    }

    private static List<Delimiter> candidates(String text, int at) {
        if (text.charAt(at) == '_') return List.of(Delimiter.UNDERSCORE);
        int stars = starCount(text, at);
        if (stars >= 3) return List.of(Delimiter.TRIPLE_STAR, Delimiter.DOUBLE_STAR);
        if (stars == 2) return List.of(Delimiter.DOUBLE_STAR);
        return List.of(Delimiter.STAR);
    }

    private static boolean canOpen(String text, int at, Delimiter d) {
        int after = at + d.length();
        if (after >= text.length() || Character.isWhitespace(text.charAt(after))) return false;
        if (d == Delimiter.UNDERSCORE && at > 0 && Character.isLetterOrDigit(text.charAt(at - 1))) {
            return false;
        }
        return true;
    }

    private static int findClose(String text, int from, Delimiter d) {
        int n = text.length();
        int j = from;
        while (j < n) {
            char c = text.charAt(j);
            if (d == Delimiter.UNDERSCORE) {
                if (c == '_' && j > from && isCloser(text, j, d)) return j;
                j++;
                continue;
            }
            if (c != '*') {
                j++;
                continue;
            }
            int stars = starCount(text, j);
            // a run of stars closes only a delimiter of the same kind; "**" inside "*x*" is text
            if (j > from && stars >= d.length() && (d != Delimiter.STAR || stars == 1) && isCloser(text, j, d)) {
                return j;
            }
            j += stars;
        }
        return -1;
    }

    private static boolean isCloser(String text, int at, Delimiter d) {
        if (Character.isWhitespace(text.charAt(at - 1))) return false;
        if (d == Delimiter.UNDERSCORE) {
            int after = at + 1;
            return after >= text.length() || !Character.isLetterOrDigit(text.charAt(after));
        }
        return true;
    }

    private static int starCount(String text, int at) {
        int j = at;
        while (j < text.length() && text.charAt(j) == '*') j++;
        return j - at;
    }

    private static void flush(StringBuilder plain, TextStyle style, List<InlineRun> runs) {
        if (plain.length() == 0) return;
        runs.add(new InlineRun(plain.toString(), style));
        plain.setLength(0);
    }

    private static List<InlineRun> merge(List<InlineRun> runs) {
        List<InlineRun> out = new ArrayList<>(runs.size());
        for (InlineRun run : runs) {
            if (run.text().isEmpty()) continue;
            int last = out.size() - 1;
            if (last >= 0 && out.get(last).style().equals(run.style())) {
                out.set(last, new InlineRun(out.get(last).text() + run.text(), run.style()));
            } else {
                out.add(run);
            }
        }
        return out;
    }
}

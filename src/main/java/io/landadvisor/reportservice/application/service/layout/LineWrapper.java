package io.landadvisor.reportservice.application.service.layout;

import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;
import io.landadvisor.reportservice.application.util.ReportTextUtils;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptRun;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy line breaker. Break opportunities come from the ICU line-break rules applied to the
 * whole block, so words spanning several style runs stay together and Devanagari text breaks
 * where Hindi typography allows. Text between two opportunities is never split: if it is wider
 * than the line it is placed alone on a line marked as overflowing.
 */
final class LineWrapper {

    private static final float EPSILON = 0.01f;

    private final TextMeasurer measurer;

    LineWrapper(TextMeasurer measurer) {
        this.measurer = measurer;
    }

    List<TextLine> wrap(List<ScriptRun> runs, float fontSize, float maxWidth) {
        StringBuilder sb = new StringBuilder();
        int[] runStarts = new int[runs.size() + 1];
        for (int r = 0; r < runs.size(); r++) {
            runStarts[r] = sb.length();
            sb.append(runs.get(r).text());
        }
        runStarts[runs.size()] = sb.length();
        String full = sb.toString();
        if (full.isBlank()) return List.of();

        BreakIterator breaks = BreakIterator.getLineInstance(ULocale.ROOT);
        breaks.setText(full);

        List<TextLine> lines = new ArrayList<>();
        List<TextLine.Fragment> line = new ArrayList<>();
        float lineWidth = 0f;

        int start = breaks.first();
        for (int end = breaks.next(); end != BreakIterator.DONE; start = end, end = breaks.next()) {
            List<TextLine.Fragment> atom = slice(runs, runStarts, start, end, fontSize);
            float atomWidth = totalWidth(atom);
            float visible = atomWidth - trailingWhitespaceWidth(atom, fontSize);

            if (!line.isEmpty() && lineWidth + visible > maxWidth + EPSILON) {
                addLine(lines, line, fontSize, maxWidth);
                line = new ArrayList<>();
                lineWidth = 0f;
            }
            for (TextLine.Fragment f : atom) append(line, f);
            lineWidth += atomWidth;
        }
        addLine(lines, line, fontSize, maxWidth);
        return lines;
    }

    private List<TextLine.Fragment> slice(List<ScriptRun> runs, int[] runStarts, int start, int end, float fontSize) {
        List<TextLine.Fragment> out = new ArrayList<>(2);
        for (int r = 0; r < runs.size(); r++) {
            int from = Math.max(start, runStarts[r]);
            int to = Math.min(end, runStarts[r + 1]);
            if (from >= to) continue;
            ScriptRun run = runs.get(r);
            String text = run.text().substring(from - runStarts[r], to - runStarts[r]);
            out.add(fragment(text, run, fontSize));
        }
        return out;
    }

    private TextLine.Fragment fragment(String text, ScriptRun run, float fontSize) {
        return new TextLine.Fragment(text, run.script(), run.style(),
                measurer.width(text, run.script(), run.style(), fontSize));
    }

    private float trailingWhitespaceWidth(List<TextLine.Fragment> atom, float fontSize) {
        if (atom.isEmpty()) return 0f;
        TextLine.Fragment last = atom.get(atom.size() - 1);
        String trimmed = stripTrailing(last.text());
        if (trimmed.length() == last.text().length()) return 0f;
        return measurer.width(last.text().substring(trimmed.length()), last.script(), last.style(), fontSize);
    }

    private static void append(List<TextLine.Fragment> line, TextLine.Fragment f) {
        int last = line.size() - 1;
        if (last >= 0) {
            TextLine.Fragment prev = line.get(last);
            if (prev.script() == f.script() && prev.style().equals(f.style())) {
                line.set(last, new TextLine.Fragment(prev.text() + f.text(), f.script(), f.style(),
                        prev.width() + f.width()));
                return;
            }
        }
        line.add(f);
    }

    private void addLine(List<TextLine> lines, List<TextLine.Fragment> line, float fontSize, float maxWidth) {
        // trailing spaces are not painted and do not count towards the line width
        while (!line.isEmpty()) {
            int last = line.size() - 1;
            TextLine.Fragment f = line.get(last);
            String trimmed = stripTrailing(f.text());
            if (trimmed.isEmpty()) {
                line.remove(last);
                continue;
            }
            if (trimmed.length() != f.text().length()) {
                line.set(last, fragment(trimmed, new ScriptRun(trimmed, f.script(), f.style()), fontSize));
            }
            break;
        }
        if (line.isEmpty()) return;
        float width = totalWidth(line);
        lines.add(new TextLine(line, width, width > maxWidth + EPSILON));
    }

    private static float totalWidth(List<TextLine.Fragment> fragments) {
        float w = 0f;
        for (TextLine.Fragment f : fragments) w += f.width();
        return w;
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0) {
            int cp = s.codePointBefore(end);
            if (!ReportTextUtils.isWhitespace(cp)) break;
            end -= Character.charCount(cp);
        }
        return s.substring(0, end);
    }
}

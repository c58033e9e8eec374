package io.landadvisor.reportservice.application.service.script;

import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Sorted table of Unicode block ranges that carry a script of their own. Code points outside
 * every range (digits, punctuation, spaces, symbols) are neutral and take the script of the
 * text around them.
 */
public final class ScriptRanges {

    private record Range(int first, int last, ScriptClass script) {
    }

    private static final Range[] RANGES = sorted(
            new Range(0x0041, 0x005A, ScriptClass.LATIN),       // A-Z
            new Range(0x0061, 0x007A, ScriptClass.LATIN),       // a-z
            new Range(0x00AA, 0x00AA, ScriptClass.LATIN),
            new Range(0x00BA, 0x00BA, ScriptClass.LATIN),
            new Range(0x00C0, 0x00D6, ScriptClass.LATIN),       // Latin-1 letters
            new Range(0x00D8, 0x00F6, ScriptClass.LATIN),
            new Range(0x00F8, 0x024F, ScriptClass.LATIN),       // + Extended-A/B
            new Range(0x1E00, 0x1EFF, ScriptClass.LATIN),       // Latin Extended Additional
            new Range(0x0900, 0x097F, ScriptClass.DEVANAGARI),
            new Range(0x1CD0, 0x1CFF, ScriptClass.DEVANAGARI),  // Vedic Extensions
            new Range(0xA8E0, 0xA8FF, ScriptClass.DEVANAGARI)   // Devanagari Extended
    );

    private ScriptRanges() {
    }

    /**
     * @return the script owning {@code codePoint}, or {@code null} when it is neutral
     */
    public static ScriptClass classify(int codePoint) {
        int lo = 0;
        int hi = RANGES.length - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            Range r = RANGES[mid];
            if (codePoint < r.first()) {
                hi = mid - 1;
            } else if (codePoint > r.last()) {
                lo = mid + 1;
            } else {
                return r.script();
            }
        }
        return null;
    }

    private static Range[] sorted(Range... ranges) {
        Range[] copy = ranges.clone();
        Arrays.sort(copy, Comparator.comparingInt(Range::first));
        for (int i = 1; i < copy.length; i++) {
            if (copy[i].first() <= copy[i - 1].last()) {
                throw new IllegalStateException("Overlapping script ranges at U+" + Integer.toHexString(copy[i].first()));
            }
        }
        return copy;
    }
}

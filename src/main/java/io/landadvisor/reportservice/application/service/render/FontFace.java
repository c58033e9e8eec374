package io.landadvisor.reportservice.application.service.render;

import org.apache.fontbox.ttf.CmapLookup;
import org.apache.fontbox.ttf.HorizontalHeaderTable;
import org.apache.fontbox.ttf.TTFParser;
import org.apache.fontbox.ttf.TrueTypeFont;
import org.apache.pdfbox.io.RandomAccessReadBuffer;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * A loaded TrueType file plus the metrics layout needs, read once at startup. Immutable and
 * shared by all requests; each PDF embeds its own {@code PDType0Font} from {@link #openStream()}.
 * Widths are in 1/1000 em.
 */
public final class FontFace {

    /** Code point blocks the report can contain. Anything else is reported as a missing glyph. */
    private static final int[][] SCANNED_BLOCKS = {
            {0x0020, 0x024F},   // Basic Latin .. Latin Extended-B
            {0x0900, 0x097F},   // Devanagari
            {0x1CD0, 0x1CFF},   // Vedic Extensions
            {0x1E00, 0x1EFF},   // Latin Extended Additional
            {0x2000, 0x206F},   // General Punctuation
            {0x20A0, 0x20CF},   // Currency Symbols (₹)
            {0x2100, 0x214F},   // Letterlike Symbols
            {0x2190, 0x21FF},   // Arrows
            {0x25A0, 0x25FF},   // Geometric Shapes
            {0xA8E0, 0xA8FF},   // Devanagari Extended
    };

    private final FontKey key;
    private final String location;
    private final byte[] data;
    private final Map<Integer, Integer> advances;
    private final int ascent;
    private final int descent;

    private FontFace(FontKey key, String location, byte[] data, Map<Integer, Integer> advances,
                     int ascent, int descent) {
        this.key = key;
        this.location = location;
        this.data = data;
        this.advances = advances;
        this.ascent = ascent;
        this.descent = descent;
    }

    public static FontFace parse(FontKey key, String location, byte[] data) throws IOException {
        try (TrueTypeFont ttf = new TTFParser().parse(new RandomAccessReadBuffer(data))) {
            CmapLookup cmap = ttf.getUnicodeCmapLookup();
            if (cmap == null) {
                throw new IOException("No Unicode cmap in " + location);
            }
            float scale = 1000f / ttf.getUnitsPerEm();

            Map<Integer, Integer> advances = new HashMap<>();
            for (int[] block : SCANNED_BLOCKS) {
                for (int cp = block[0]; cp <= block[1]; cp++) {
                    int gid = cmap.getGlyphId(cp);
                    if (gid > 0) {
                        advances.put(cp, Math.round(ttf.getAdvanceWidth(gid) * scale));
                    }
                }
            }

            HorizontalHeaderTable hhea = ttf.getHorizontalHeader();
            int ascent = Math.round(hhea.getAscender() * scale);
            int descent = Math.round(Math.abs(hhea.getDescender()) * scale);
            return new FontFace(key, location, data, Map.copyOf(advances), ascent, descent);
        }
    }

    public boolean covers(int codePoint) {
        return advances.containsKey(codePoint);
    }

    /** Advance of a covered code point; callers check {@link #covers(int)} first. */
    public int advance(int codePoint) {
        Integer width = advances.get(codePoint);
        return width == null ? 0 : width;
    }

    public int ascent() {
        return ascent;
    }

    public int descent() {
        return descent;
    }

    public int mappedCodePoints() {
        return advances.size();
    }

    public FontKey key() {
        return key;
    }

    public String location() {
        return location;
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(data);
    }
}

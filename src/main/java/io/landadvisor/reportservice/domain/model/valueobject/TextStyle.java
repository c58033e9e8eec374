package io.landadvisor.reportservice.domain.model.valueobject;

/**
 * Emphasis flags of an inline span. Both flags may be set at once.
 */
public record TextStyle(boolean bold, boolean italic) {

    public static final TextStyle PLAIN = new TextStyle(false, false);
    public static final TextStyle BOLD = new TextStyle(true, false);
    public static final TextStyle ITALIC = new TextStyle(false, true);
    public static final TextStyle BOLD_ITALIC = new TextStyle(true, true);

    public TextStyle withBold() {
        return bold ? this : new TextStyle(true, italic);
    }

    public TextStyle withItalic() {
        return italic ? this : new TextStyle(bold, true);
    }
}

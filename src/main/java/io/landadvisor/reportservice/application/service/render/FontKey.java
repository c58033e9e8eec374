package io.landadvisor.reportservice.application.service.render;

import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;

/**
 * The four font slots of a report. Italic has no slot of its own: Latin italic is drawn
 * oblique from the upright face and Devanagari has no italic convention.
 */
public enum FontKey {
    LATIN_REGULAR(ScriptClass.LATIN, false),
    LATIN_BOLD(ScriptClass.LATIN, true),
    DEVANAGARI_REGULAR(ScriptClass.DEVANAGARI, false),
    DEVANAGARI_BOLD(ScriptClass.DEVANAGARI, true);

    private final ScriptClass script;
    private final boolean bold;

    FontKey(ScriptClass script, boolean bold) {
        this.script = script;
        this.bold = bold;
    }

    public static FontKey of(ScriptClass script, TextStyle style) {
        return switch (script) {
            case LATIN -> style.bold() ? LATIN_BOLD : LATIN_REGULAR;
            case DEVANAGARI -> style.bold() ? DEVANAGARI_BOLD : DEVANAGARI_REGULAR;
        };
    }

    /** Same weight, other script. Used when the primary face lacks a glyph. */
    public FontKey sibling() {
        ScriptClass other = script == ScriptClass.LATIN ? ScriptClass.DEVANAGARI : ScriptClass.LATIN;
        return of(other, bold ? TextStyle.BOLD : TextStyle.PLAIN);
    }

    public ScriptClass script() {
        return script;
    }

    public boolean bold() {
        return bold;
    }
}

package io.landadvisor.reportservice.domain.model.valueobject;

import java.util.Objects;

/**
 * A script-homogeneous slice of an {@link InlineRun}. It keeps the parent's style.
 */
public record ScriptRun(String text, ScriptClass script, TextStyle style) {

    public ScriptRun {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(style, "style");
    }
}

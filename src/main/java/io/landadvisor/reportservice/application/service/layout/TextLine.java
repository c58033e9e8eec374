package io.landadvisor.reportservice.application.service.layout;

import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;

import java.util.List;

/**
 * One wrapped line: script/style-homogeneous fragments in source order.
 * {@code overflow} is set when the line is wider than the width it was wrapped to.
 */
record TextLine(List<Fragment> fragments, float width, boolean overflow) {

    record Fragment(String text, ScriptClass script, TextStyle style, float width) {
    }

    TextLine {
        fragments = List.copyOf(fragments);
    }

    String text() {
        StringBuilder sb = new StringBuilder();
        for (Fragment f : fragments) sb.append(f.text());
        return sb.toString();
    }
}

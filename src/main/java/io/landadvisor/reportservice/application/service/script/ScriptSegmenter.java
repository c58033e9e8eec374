package io.landadvisor.reportservice.application.service.script;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptRun;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits inline runs into script-homogeneous runs so each can be set in the matching font.
 * Neutral characters (digits, punctuation, spaces) inherit the script of the character before
 * them, or Latin at the start of a run, so "भूमि 123" stays one Devanagari run. The split is
 * lossless: the pieces concatenate back to the source text.
 */
@Service
public class ScriptSegmenter {

    public List<ScriptRun> segment(InlineRun run) {
        String text = run.text();
        List<ScriptRun> out = new ArrayList<>();
        if (text.isEmpty()) return out;

        ScriptClass current = null;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            ScriptClass script = ScriptRanges.classify(cp);
            if (script == null) {
                script = current == null ? ScriptClass.LATIN : current;
            }
            if (current != null && script != current) {
                out.add(new ScriptRun(text.substring(start, i), current, run.style()));
                start = i;
            }
            current = script;
            i += Character.charCount(cp);
        }
        out.add(new ScriptRun(text.substring(start), current, run.style()));
        return out;
    }

    public List<ScriptRun> segment(List<InlineRun> runs) {
        List<ScriptRun> out = new ArrayList<>();
        for (InlineRun run : runs) {
            out.addAll(segment(run));
        }
        return out;
    }
}

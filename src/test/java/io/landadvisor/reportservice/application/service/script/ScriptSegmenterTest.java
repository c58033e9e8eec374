package io.landadvisor.reportservice.application.service.script;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptRun;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptSegmenterTest {

    private final ScriptSegmenter segmenter = new ScriptSegmenter();

    @Test
    void numbersInheritPrecedingScript() {
        assertThat(segmenter.segment(InlineRun.plain("भूमि 123")))
                .containsExactly(new ScriptRun("भूमि 123", ScriptClass.DEVANAGARI, TextStyle.PLAIN));
    }

    @Test
    void shouldSplitAtScriptChange() {
        List<ScriptRun> runs = segmenter.segment(InlineRun.bold("Plot भूमि, area 5"));

        assertThat(runs).extracting(ScriptRun::text).containsExactly("Plot ", "भूमि, ", "area 5");
        assertThat(runs).extracting(ScriptRun::script)
                .containsExactly(ScriptClass.LATIN, ScriptClass.DEVANAGARI, ScriptClass.LATIN);
        assertThat(runs).extracting(ScriptRun::style).containsOnly(TextStyle.BOLD);
    }

    @Test
    void leadingNeutralsAreLatin() {
        List<ScriptRun> runs = segmenter.segment(InlineRun.plain("(भूमि)"));

        assertThat(runs).extracting(ScriptRun::script).containsExactly(ScriptClass.LATIN, ScriptClass.DEVANAGARI);
    }

    @Test
    void concatenationReproducesSource() {
        List<String> samples = List.of("", "abc", "१२३ अंक", "Mixed हिंदी and English, ₹5,00,000!", "😀 emoji क");

        for (String sample : samples) {
            StringBuilder joined = new StringBuilder();
            for (ScriptRun run : segmenter.segment(InlineRun.plain(sample))) joined.append(run.text());
            assertThat(joined.toString()).isEqualTo(sample);
        }
    }

    @Test
    void rangesAreClassifiedByBlock() {
        assertThat(ScriptRanges.classify('a')).isEqualTo(ScriptClass.LATIN);
        assertThat(ScriptRanges.classify('é')).isEqualTo(ScriptClass.LATIN);
        assertThat(ScriptRanges.classify('क')).isEqualTo(ScriptClass.DEVANAGARI);
        assertThat(ScriptRanges.classify('5')).isNull();
        assertThat(ScriptRanges.classify(' ')).isNull();
    }
}

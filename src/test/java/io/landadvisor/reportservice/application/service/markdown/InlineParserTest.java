package io.landadvisor.reportservice.application.service.markdown;

import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InlineParserTest {

    @Test
    void shouldRecognizeBoldAndItalic() {
        List<InlineRun> runs = InlineParser.parse("Your plot is **excellent** for _retail_ and *offices*.");

        assertThat(runs).containsExactly(
                InlineRun.plain("Your plot is "),
                InlineRun.bold("excellent"),
                InlineRun.plain(" for "),
                InlineRun.italic("retail"),
                InlineRun.plain(" and "),
                InlineRun.italic("offices"),
                InlineRun.plain("."));
    }

    @Test
    void shouldRecognizeBoldItalic() {
        assertThat(InlineParser.parse("***both***"))
                .containsExactly(new InlineRun("both", TextStyle.BOLD_ITALIC));
    }

    @Test
    void unbalancedBoldStaysLiteral() {
        assertThat(InlineParser.parse("**bold text")).containsExactly(InlineRun.plain("**bold text"));
    }

    @Test
    void delimitersSurroundedBySpacesAreText() {
        assertThat(InlineParser.parse("2 * 3 * 4")).containsExactly(InlineRun.plain("2 * 3 * 4"));
    }

    @Test
    void underscoresInsideWordsAreText() {
        assertThat(InlineParser.parse("snake_case_word")).containsExactly(InlineRun.plain("snake_case_word"));
    }

    @Test
    void emphasisDoesNotNest() {
        assertThat(InlineParser.parse("*a **b** c*"))
                .containsExactly(InlineRun.italic("a **b** c"));
    }

    @Test
    void emptyInputYieldsNoRuns() {
        assertThat(InlineParser.parse("")).isEmpty();
        assertThat(InlineParser.parse(null)).isEmpty();
    }
}

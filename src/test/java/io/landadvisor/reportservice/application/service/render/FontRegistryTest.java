package io.landadvisor.reportservice.application.service.render;

import io.landadvisor.reportservice.domain.exception.ReportConfigurationException;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FontRegistryTest {

    private final FontRegistry registry = TestFonts.registry();

    @Test
    void missingFontIsFatal() {
        Map<FontKey, String> locations = TestFonts.locations();
        locations.put(FontKey.DEVANAGARI_BOLD, "classpath:fonts/DoesNotExist.ttf");

        assertThatThrownBy(() -> FontRegistry.load(locations, new DefaultResourceLoader()))
                .isInstanceOf(ReportConfigurationException.class)
                .hasMessageContaining("DoesNotExist.ttf");
    }

    @Test
    void unconfiguredSlotIsFatal() {
        Map<FontKey, String> locations = TestFonts.locations();
        locations.remove(FontKey.LATIN_BOLD);

        assertThatThrownBy(() -> FontRegistry.load(locations, new DefaultResourceLoader()))
                .isInstanceOf(ReportConfigurationException.class)
                .hasMessageContaining("LATIN_BOLD");
    }

    @Test
    void nonFontFileIsFatal() {
        Map<FontKey, String> locations = TestFonts.locations();
        locations.put(FontKey.LATIN_REGULAR, "classpath:application.yml");

        assertThatThrownBy(() -> FontRegistry.load(locations, new DefaultResourceLoader()))
                .isInstanceOf(ReportConfigurationException.class);
    }

    @Test
    void boldTakesPrecedenceOverItalic() {
        assertThat(FontKey.of(ScriptClass.LATIN, TextStyle.BOLD_ITALIC)).isEqualTo(FontKey.LATIN_BOLD);
        assertThat(FontKey.of(ScriptClass.DEVANAGARI, TextStyle.ITALIC)).isEqualTo(FontKey.DEVANAGARI_REGULAR);
        assertThat(FontKey.LATIN_BOLD.sibling()).isEqualTo(FontKey.DEVANAGARI_BOLD);
    }

    @Test
    void shouldResolveCoveredCodePoints() {
        FontFace face = registry.resolve('A', ScriptClass.LATIN, TextStyle.BOLD);

        assertThat(face).isNotNull();
        assertThat(face.key()).isEqualTo(FontKey.LATIN_BOLD);
        assertThat(face.advance('A')).isPositive();
        assertThat(face.ascent()).isPositive();
        assertThat(face.descent()).isPositive();
    }

    @Test
    void devanagariResolvesToDevanagariFace() {
        FontFace face = registry.resolve('क', ScriptClass.DEVANAGARI, TextStyle.BOLD);

        assertThat(face).isNotNull();
        assertThat(face.key()).isEqualTo(FontKey.DEVANAGARI_BOLD);
        assertThat(face.advance('क')).isPositive();
    }

    @Test
    void punctuationInDevanagariRunFallsBackToLatinFace() {
        FontFace face = registry.resolve(':', ScriptClass.DEVANAGARI, TextStyle.PLAIN);

        assertThat(face).isNotNull();
        assertThat(face.key()).isEqualTo(FontKey.LATIN_REGULAR);
    }

    @Test
    void uncoveredCodePointResolvesToNull() {
        assertThat(registry.resolve('中', ScriptClass.LATIN, TextStyle.PLAIN)).isNull();
    }

    @Test
    void measurerUsesFontAdvances() {
        FontMetricsMeasurer measurer = new FontMetricsMeasurer(registry);

        float narrow = measurer.width("iiii", ScriptClass.LATIN, TextStyle.PLAIN, 10f);
        float wide = measurer.width("WWWW", ScriptClass.LATIN, TextStyle.PLAIN, 10f);

        assertThat(narrow).isPositive().isLessThan(wide);
        assertThat(measurer.width("WWWW", ScriptClass.LATIN, TextStyle.PLAIN, 20f)).isEqualTo(wide * 2f);
    }
}

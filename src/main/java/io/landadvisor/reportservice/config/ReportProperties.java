package io.landadvisor.reportservice.config;

import io.landadvisor.reportservice.application.service.render.FontKey;
import io.landadvisor.reportservice.domain.model.layout.ColumnWidthPolicy;
import io.landadvisor.reportservice.domain.model.layout.PageGeometry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@code report.*} settings: font locations (any Spring resource location) and page geometry.
 * Theme colours and spacing are fixed in {@link PageGeometry}.
 */
@Validated
@ConfigurationProperties(prefix = "report")
public record ReportProperties(@Valid @NotNull Fonts fonts, @Valid @NotNull Page page) {

    public record Fonts(@NotBlank String latinRegular,
                        @NotBlank String latinBold,
                        @NotBlank String devanagariRegular,
                        @NotBlank String devanagariBold) {

        public Map<FontKey, String> locations() {
            Map<FontKey, String> map = new EnumMap<>(FontKey.class);
            map.put(FontKey.LATIN_REGULAR, latinRegular);
            map.put(FontKey.LATIN_BOLD, latinBold);
            map.put(FontKey.DEVANAGARI_REGULAR, devanagariRegular);
            map.put(FontKey.DEVANAGARI_BOLD, devanagariBold);
            return map;
        }
    }

    public record Page(@Positive float width,
                       @Positive float height,
                       @PositiveOrZero float marginLeft,
                       @PositiveOrZero float marginRight,
                       @PositiveOrZero float marginTop,
                       @PositiveOrZero float marginBottom,
                       @Positive float bodyFontSize,
                       @Positive float bodyLeading,
                       @Positive float tableFontSize,
                       @Positive float tableLeading,
                       @NotEmpty List<@Positive Float> headingFontSizes,
                       @NotNull ColumnWidthPolicy columnWidthPolicy) {

        public PageGeometry toGeometry() {
            return PageGeometry.builder()
                    .pageWidth(width)
                    .pageHeight(height)
                    .marginLeft(marginLeft)
                    .marginRight(marginRight)
                    .marginTop(marginTop)
                    .marginBottom(marginBottom)
                    .bodyFontSize(bodyFontSize)
                    .bodyLeading(bodyLeading)
                    .tableFontSize(tableFontSize)
                    .tableLeading(tableLeading)
                    .headingFontSizes(List.copyOf(headingFontSizes))
                    .columnWidthPolicy(columnWidthPolicy)
                    .build();
        }
    }
}

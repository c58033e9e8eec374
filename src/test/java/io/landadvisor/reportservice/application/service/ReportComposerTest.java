package io.landadvisor.reportservice.application.service;

import io.landadvisor.reportservice.application.service.markdown.MarkdownParser;
import io.landadvisor.reportservice.domain.dto.ReportOptions;
import io.landadvisor.reportservice.domain.model.ReportLanguage;
import io.landadvisor.reportservice.domain.model.document.Disclaimer;
import io.landadvisor.reportservice.domain.model.document.Document;
import io.landadvisor.reportservice.domain.model.document.Heading;
import io.landadvisor.reportservice.domain.model.document.Paragraph;
import io.landadvisor.reportservice.domain.model.valueobject.InlineRun;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReportComposerTest {

    private final ReportComposer composer = new ReportComposer();
    private final MarkdownParser parser = new MarkdownParser();

    @Test
    void shouldAddHeaderAndDefaultDisclaimer() {
        ReportOptions options = ReportOptions.builder().authorName("Asha").location("Pune").build();

        Document doc = composer.compose(parser.parse("Plot analysis."), options, ReportLanguage.ENGLISH);

        Heading title = (Heading) doc.nodes().get(0);
        assertThat(InlineRun.plainText(title.runs())).isEqualTo("Professional Land Use Report");
        assertThat(text(doc, 1)).isEqualTo("Prepared for: Asha");
        assertThat(text(doc, 2)).isEqualTo("Location: Pune");
        Disclaimer disclaimer = (Disclaimer) doc.nodes().get(doc.nodes().size() - 1);
        assertThat(InlineRun.plainText(disclaimer.runs())).startsWith("Disclaimer:");
    }

    @Test
    void blankOptionsFallBackToDefaults() {
        Document doc = composer.compose(parser.parse(""), ReportOptions.defaults(), ReportLanguage.HINDI);

        assertThat(InlineRun.plainText(((Heading) doc.nodes().get(0)).runs())).isEqualTo("पेशेवर भूमि उपयोग रिपोर्ट");
        assertThat(text(doc, 1)).endsWith(ReportComposer.DEFAULT_NAME);
        assertThat(text(doc, 2)).endsWith(ReportComposer.DEFAULT_LOCATION);
        assertThat(doc.nodes().get(doc.nodes().size() - 1)).isInstanceOf(Disclaimer.class);
    }

    @Test
    void disclaimerParagraphIsPromoted() {
        Document doc = composer.compose(parser.parse("Body.\n\n**Disclaimer:** consult a lawyer."),
                ReportOptions.defaults(), ReportLanguage.ENGLISH);

        assertThat(doc.nodes()).filteredOn(Disclaimer.class::isInstance).hasSize(1);
        Disclaimer disclaimer = (Disclaimer) doc.nodes().get(doc.nodes().size() - 1);
        assertThat(InlineRun.plainText(disclaimer.runs())).isEqualTo("Disclaimer: consult a lawyer.");
    }

    @Test
    void mentionedDisclaimerIsNotDuplicated() {
        Document doc = composer.compose(parser.parse("## अस्वीकरण\n\nयह केवल जानकारी है।"),
                ReportOptions.defaults(), ReportLanguage.HINDI);

        assertThat(doc.nodes()).noneMatch(Disclaimer.class::isInstance);
    }

    private static String text(Document doc, int index) {
        return InlineRun.plainText(((Paragraph) doc.nodes().get(index)).runs());
    }
}

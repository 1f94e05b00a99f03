package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.CrawlTestSupport;
import com.delta.siteextract.crawl.model.FieldSchema;
import com.delta.siteextract.crawl.model.FieldValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExtractionEngineTest {
    private final ExtractionEngine engine = CrawlTestSupport.extractionEngine();

    @Test
    void ordersStrategiesByConfidence() {
        assertThat(engine.strategies())
            .extracting(ExtractionStrategy::name)
            .containsExactly(StructuredDataStrategy.NAME, MicrodataStrategy.NAME, HeuristicStrategy.NAME);
    }

    @Test
    void structuredDataWinsAndHeuristicsFillTheGaps() {
        String html = CrawlTestSupport.html(
            """
                <title>Some Other Name</title>
                <script type="application/ld+json">{"@type":"Restaurant","name":"Tony's","telephone":"217-555-0134"}</script>
                """,
            "<p>Email: hello@tonys.example</p><p>Phone: 217-555-9999</p>"
        );

        Map<String, List<FieldValue>> fields = engine.extract(PageContent.parse("https://tonys.example/", html), FieldSchema.restaurant());

        FieldValue name = fields.get("name").get(0);
        assertThat(name.text()).isEqualTo("Tony's");
        assertThat(name.strategy()).isEqualTo(StructuredDataStrategy.NAME);
        assertThat(name.confidence()).isCloseTo(0.9, within(1e-9));

        FieldValue phone = fields.get("phone").get(0);
        assertThat(phone.text()).isEqualTo("(217) 555-0134");
        assertThat(phone.confidence()).isCloseTo(0.95, within(1e-9));

        FieldValue email = fields.get("email").get(0);
        assertThat(email.text()).isEqualTo("hello@tonys.example");
        assertThat(email.strategy()).isEqualTo(HeuristicStrategy.NAME);
        assertThat(email.sourceUrl()).isEqualTo("https://tonys.example/");
    }

    @Test
    void malformedJsonLdDegradesToLowerStrategies() {
        String html = CrawlTestSupport.html(
            "<title>Tony's</title><script type=\"application/ld+json\">{\"@type\": \"Restaurant\", </script>",
            "<div itemscope itemtype=\"https://schema.org/Restaurant\"><span itemprop=\"telephone\">217-555-0134</span></div>"
        );

        Map<String, List<FieldValue>> fields = engine.extract(PageContent.parse("https://tonys.example/", html), FieldSchema.restaurant());

        assertThat(fields.get("phone").get(0).strategy()).isEqualTo(MicrodataStrategy.NAME);
        assertThat(fields.get("name").get(0).strategy()).isEqualTo(HeuristicStrategy.NAME);
        assertThat(fields.get("name").get(0).text()).isEqualTo("Tony's");
    }

    @Test
    void failingStrategyDoesNotLoseOtherFields() {
        ExtractionStrategy broken = new ExtractionStrategy() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public double baseConfidence() {
                return 0.99;
            }

            @Override
            public Map<String, List<String>> extract(PageContent page, FieldSchema schema) {
                throw new IllegalStateException("boom");
            }
        };
        ExtractionEngine withBroken = new ExtractionEngine(List.of(broken, new HeuristicStrategy()));
        String html = CrawlTestSupport.html("", "<p>Phone: 555-1234</p>");

        Map<String, List<FieldValue>> fields = withBroken.extract(PageContent.parse("https://tonys.example/", html), FieldSchema.restaurant());

        assertThat(fields.get("phone").get(0).text()).isEqualTo("555-1234");
    }

    @Test
    void resultFollowsSchemaOrderWithOneValuePerField() {
        String html = CrawlTestSupport.html(
            "<title>Tony's</title>",
            "<p>Phone: 555-1234</p><address>123 Main St</address>"
        );

        Map<String, List<FieldValue>> fields = engine.extract(PageContent.parse("https://tonys.example/", html), FieldSchema.restaurant());

        assertThat(fields.keySet()).containsExactly("name", "address", "phone");
        assertThat(fields.values()).allSatisfy(values -> assertThat(values).hasSize(1));
    }
}

package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructuredDataStrategyTest {
    private final StructuredDataStrategy strategy = new StructuredDataStrategy(new ObjectMapper());

    @Test
    void extractsRestaurantFromJsonLdGraph() {
        String html =
            """
                <html>
                <head>
                  <script type="application/ld+json">
                    {
                      "@context":"https://schema.org",
                      "@graph":[
                        {"@type":"WebSite","name":"Tony's Website"},
                        {
                          "@type":["Restaurant","LocalBusiness"],
                          "name":"Tony's Trattoria",
                          "telephone":"+1 217-555-0134",
                          "address":{"@type":"PostalAddress","streetAddress":"123 Main St",
                                     "addressLocality":"Springfield","addressRegion":"IL","postalCode":"62701"},
                          "openingHoursSpecification":[
                            {"@type":"OpeningHoursSpecification","dayOfWeek":"https://schema.org/Monday",
                             "opens":"11:00:00","closes":"22:00:00"},
                            {"@type":"OpeningHoursSpecification","dayOfWeek":["Saturday","Sunday"],
                             "opens":"12:00","closes":"23:00"}
                          ],
                          "servesCuisine":["Italian","Pizza"],
                          "priceRange":"$$",
                          "sameAs":["https://facebook.com/tonys","https://instagram.com/tonys"],
                          "hasMenu":{
                            "@type":"Menu",
                            "hasMenuSection":[
                              {"@type":"MenuSection","name":"Pasta",
                               "hasMenuItem":[{"@type":"MenuItem","name":"Spaghetti"},{"@type":"MenuItem","name":"Lasagna"}]},
                              {"@type":"MenuSection","name":"Pizza",
                               "hasMenuItem":{"@type":"MenuItem","name":"Margherita"}}
                            ]
                          }
                        }
                      ]
                    }
                  </script>
                </head>
                <body></body>
                </html>
                """;

        Map<String, List<String>> fields = strategy.extract(
            PageContent.parse("https://tonys.example/", html),
            FieldSchema.restaurant()
        );

        assertThat(fields.get("name")).containsExactly("Tony's Trattoria");
        assertThat(fields.get("phone")).containsExactly("+1 217-555-0134");
        assertThat(fields.get("address")).containsExactly("123 Main St, Springfield, IL 62701");
        assertThat(fields.get("hours")).containsExactly("Monday 11:00-22:00; Saturday, Sunday 12:00-23:00");
        assertThat(fields.get("cuisine")).containsExactly("Italian, Pizza");
        assertThat(fields.get("price_range")).containsExactly("$$");
        assertThat(fields.get("menu_items")).containsExactly("Spaghetti", "Lasagna", "Margherita");
        assertThat(fields.get("social_media")).containsExactly("https://facebook.com/tonys", "https://instagram.com/tonys");
    }

    @Test
    void ignoresNodesOfOtherTypes() {
        String html = """
            <script type="application/ld+json">{"@type":"Organization","name":"Holding Co","telephone":"555-0000"}</script>
            """;

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://x.example/", html), FieldSchema.restaurant());

        assertThat(fields).isEmpty();
    }

    @Test
    void malformedJsonLdRaisesExtractionException() {
        String html = "<script type=\"application/ld+json\">{\"@type\":\"Restaurant\", \"name\": </script>";

        assertThatThrownBy(() -> strategy.extract(PageContent.parse("https://x.example/", html), FieldSchema.restaurant()))
            .isInstanceOf(ExtractionException.class);
    }

    @Test
    void oneMalformedBlockDoesNotHideAValidOne() {
        String html = """
            <script type="application/ld+json">{ broken</script>
            <script type="application/ld+json">{"@type":"Restaurant","name":"Tony's"}</script>
            """;

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://x.example/", html), FieldSchema.restaurant());

        assertThat(fields.get("name")).containsExactly("Tony's");
    }
}

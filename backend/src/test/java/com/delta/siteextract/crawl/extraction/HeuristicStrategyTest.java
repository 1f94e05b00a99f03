package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.CrawlTestSupport;
import com.delta.siteextract.crawl.model.FieldSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicStrategyTest {
    private final HeuristicStrategy strategy = new HeuristicStrategy();

    @Test
    void readsContactDetailsFromLabelsAndLinks() {
        String html = CrawlTestSupport.html(
            "<title>Contact | Tony's Trattoria</title>",
            """
                <h1>Contact Us</h1>
                <p>Phone: <a href="tel:+12175550134">217-555-0134</a></p>
                <p>Email: <a href="mailto:hello@tonys.example">hello@tonys.example</a></p>
                <address>123 Main St, Springfield, IL 62701</address>
                <p>Hours: Mon-Fri 11am-10pm</p>
                <a href="https://www.instagram.com/tonys">Instagram</a>
                """
        );

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://tonys.example/contact", html), FieldSchema.restaurant());

        assertThat(fields.get("name")).containsExactly("Tony's Trattoria");
        assertThat(fields.get("phone")).containsExactly("+12175550134");
        assertThat(fields.get("email")).containsExactly("hello@tonys.example");
        assertThat(fields.get("address")).containsExactly("123 Main St, Springfield, IL 62701");
        assertThat(fields.get("hours")).containsExactly("Mon-Fri 11am-10pm");
        assertThat(fields.get("social_media")).containsExactly("https://www.instagram.com/tonys");
    }

    @Test
    void shortLocalNumberIsTakenFromItsLabel() {
        String html = CrawlTestSupport.html("<title>Contact</title>", "<h1>Contact</h1><p>Phone: 555-1234</p>");

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://tonys.example/contact", html), FieldSchema.restaurant());

        assertThat(fields.get("phone")).containsExactly("555-1234");
        assertThat(fields).doesNotContainKey("name");
    }

    @Test
    void menuItemsComeFromItemMarkupButNotSiteNavigation() {
        String html = CrawlTestSupport.html(
            "<title>Menu - Tony's</title>",
            """
                <nav><ul><li class="menu-item menu-item-type-post_type"><a href="/">Home</a></li></ul></nav>
                <ul>
                  <li class="menu-item"><h3>Pasta</h3><span>$14</span></li>
                  <li class="menu-item"><h3>Pizza</h3><span>$12</span></li>
                </ul>
                """
        );

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://tonys.example/menu", html), FieldSchema.restaurant());

        assertThat(fields.get("menu_items")).containsExactly("Pasta", "Pizza");
        assertThat(fields.get("name")).containsExactly("Tony's");
    }

    @Test
    void menuSectionsFallBackToHeadingSiblings() {
        String html = CrawlTestSupport.html(
            "",
            """
                <h2>Appetizers</h2>
                <ul><li>Bruschetta - 8</li><li>Calamari \u2013 12</li></ul>
                <h2>Desserts</h2>
                <p>Tiramisu ... $9</p>
                """
        );

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://tonys.example/food", html), FieldSchema.restaurant());

        assertThat(fields.get("menu_items")).containsExactly("Bruschetta", "Calamari", "Tiramisu");
    }

    @Test
    void pageWithoutSignalsYieldsNothing() {
        String html = CrawlTestSupport.html("<title>Home</title>", "<p>Welcome!</p>");

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://tonys.example/", html), FieldSchema.restaurant());

        assertThat(fields).doesNotContainKeys("phone", "address", "email", "menu_items");
    }
}

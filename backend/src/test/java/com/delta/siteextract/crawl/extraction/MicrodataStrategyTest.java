package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MicrodataStrategyTest {
    private final MicrodataStrategy strategy = new MicrodataStrategy();

    @Test
    void readsItempropsOwnedByTheRestaurantScope() {
        String html = """
            <div itemscope itemtype="https://schema.org/Restaurant">
              <h1 itemprop="name">Tony's</h1>
              <span itemprop="telephone">(217) 555-0134</span>
              <div itemprop="address" itemscope itemtype="https://schema.org/PostalAddress">
                <span itemprop="streetAddress">123 Main St</span>
                <span itemprop="addressLocality">Springfield</span>
                <span itemprop="addressRegion">IL</span>
                <span itemprop="postalCode">62701</span>
              </div>
              <meta itemprop="openingHours" content="Mo-Fr 11:00-22:00">
              <div itemprop="hasMenu" itemscope itemtype="https://schema.org/Menu">
                <span itemprop="name">Dinner menu</span>
                <div itemscope itemtype="https://schema.org/MenuItem"><span itemprop="name">Gnocchi</span></div>
                <div itemscope itemtype="https://schema.org/MenuItem"><span itemprop="name">Risotto</span></div>
              </div>
            </div>
            """;

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://tonys.example/", html), FieldSchema.restaurant());

        assertThat(fields.get("name")).containsExactly("Tony's");
        assertThat(fields.get("phone")).containsExactly("(217) 555-0134");
        assertThat(fields.get("address")).containsExactly("123 Main St, Springfield, IL 62701");
        assertThat(fields.get("hours")).containsExactly("Mo-Fr 11:00-22:00");
        assertThat(fields.get("menu_items")).containsExactly("Gnocchi", "Risotto");
    }

    @Test
    void standaloneMenuItemsAreFoundWithoutARestaurantScope() {
        String html = """
            <section>
              <div itemscope itemtype="http://schema.org/MenuItem"><span itemprop="name">Tiramisu</span></div>
              <div itemscope itemtype="http://schema.org/MenuItem"><span itemprop="name">Cannoli</span></div>
            </section>
            """;

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://tonys.example/menu", html), FieldSchema.restaurant());

        assertThat(fields.get("menu_items")).containsExactly("Tiramisu", "Cannoli");
        assertThat(fields).doesNotContainKey("name");
    }

    @Test
    void pageWithoutMarkupYieldsNoMenuItems() {
        String html = """
            <h1>Our Menu</h1>
            <div class="menu-item"><h3>Pasta</h3></div>
            <div class="menu-item"><h3>Pizza</h3></div>
            """;

        Map<String, List<String>> fields = strategy.extract(PageContent.parse("https://tonys.example/menu", html), FieldSchema.restaurant());

        assertThat(fields).isEmpty();
    }

    @Test
    void plainMenuPropertyKeepsItsTextButNotALink() {
        String withText = """
            <div itemscope itemtype="https://schema.org/Restaurant">
              <span itemprop="hasMenu">Seasonal tasting</span>
            </div>
            """;
        String withLink = """
            <div itemscope itemtype="https://schema.org/Restaurant">
              <a itemprop="hasMenu" href="/menu">See the menu</a>
            </div>
            """;

        Map<String, List<String>> textFields = strategy.extract(PageContent.parse("https://tonys.example/", withText), FieldSchema.restaurant());
        Map<String, List<String>> linkFields = strategy.extract(PageContent.parse("https://tonys.example/", withLink), FieldSchema.restaurant());

        assertThat(textFields.get("menu_items")).containsExactly("Seasonal tasting");
        assertThat(linkFields).doesNotContainKey("menu_items");
    }
}

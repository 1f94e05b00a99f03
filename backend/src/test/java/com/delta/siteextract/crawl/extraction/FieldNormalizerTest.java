package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldFormat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FieldNormalizerTest {

    @Test
    void phonesCollapseToOneShape() {
        assertThat(FieldNormalizer.normalize(FieldFormat.PHONE, "+1 (217) 555-0134")).isEqualTo("(217) 555-0134");
        assertThat(FieldNormalizer.normalize(FieldFormat.PHONE, "217.555.0134")).isEqualTo("(217) 555-0134");
        assertThat(FieldNormalizer.normalize(FieldFormat.PHONE, "555 1234")).isEqualTo("555-1234");
        assertThat(FieldNormalizer.normalize(FieldFormat.PHONE, "12-34")).isNull();
        assertThat(FieldNormalizer.normalize(FieldFormat.PHONE, "+44 20 7946 0958")).isEqualTo("+44 20 7946 0958");
    }

    @Test
    void addressesGetConsistentSpacing() {
        assertThat(FieldNormalizer.normalize(FieldFormat.ADDRESS, "123 Main St ,Springfield,IL62701"))
            .isEqualTo("123 Main St, Springfield, IL 62701");
        assertThat(FieldNormalizer.normalize(FieldFormat.ADDRESS, "123 Main StSpringfield")).isEqualTo("123 Main St Springfield");
    }

    @Test
    void priceRangesAndHours() {
        assertThat(FieldNormalizer.normalize(FieldFormat.PRICE_RANGE, "$ $")).isEqualTo("$$");
        assertThat(FieldNormalizer.normalize(FieldFormat.PRICE_RANGE, "$10 to $25")).isEqualTo("$10-$25");
        assertThat(FieldNormalizer.normalize(FieldFormat.HOURS, "Hours: Mon \u2013 Fri 11am \u2014 10pm")).isEqualTo("Mon-Fri 11am-10pm");
    }

    @Test
    void emailsAreLowercasedAndValidated() {
        assertThat(FieldNormalizer.normalize(FieldFormat.EMAIL, "mailto:Hello@Tonys.Example?subject=hi")).isEqualTo("hello@tonys.example");
        assertThat(FieldNormalizer.normalize(FieldFormat.EMAIL, "not an email")).isNull();
    }

    @Test
    void textIsTrimmedAndBlankDropped() {
        assertThat(FieldNormalizer.normalize(FieldFormat.NAME, "  Tony's\u00a0 Trattoria | ")).isEqualTo("Tony's Trattoria");
        assertThat(FieldNormalizer.normalize(FieldFormat.TEXT, "   ")).isNull();
        assertThat(FieldNormalizer.normalize(FieldFormat.TEXT, "x".repeat(1500))).hasSize(1000);
    }

    @Test
    void listsDropDuplicatesIgnoringCaseAndSpacing() {
        assertThat(FieldNormalizer.normalizeList(FieldFormat.MENU_ITEMS, List.of("Pasta", "pasta ", " Pizza", "", "PIZZA")))
            .containsExactly("Pasta", "Pizza");
    }

    @Test
    void completeValuesEarnTheBonus() {
        assertThat(FieldNormalizer.completenessBonus(FieldFormat.PHONE, List.of("(217) 555-0134")))
            .isEqualTo(FieldNormalizer.COMPLETENESS_BONUS);
        assertThat(FieldNormalizer.completenessBonus(FieldFormat.PHONE, List.of("555-1234"))).isZero();
        assertThat(FieldNormalizer.completenessBonus(FieldFormat.ADDRESS, List.of("123 Main St, Springfield, IL 62701")))
            .isEqualTo(FieldNormalizer.COMPLETENESS_BONUS);
        assertThat(FieldNormalizer.completenessBonus(FieldFormat.MENU_ITEMS, List.of("a", "b"))).isZero();
    }
}

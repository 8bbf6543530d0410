package com.litscan.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BibtexKeyUtilsTest {

    private static final String AUTHORS = "Smith, John; Doe, Jane";
    private static final String TITLE = "A Survey of Deep Learning for Metadata Extraction";

    @Test
    void generate_shouldHonourMode() {
        assertThat(BibtexKeyUtils.generate(AUTHORS, 2020, TITLE, BibtexKeyUtils.MODE_SHORT)).isEqualTo("smith2020");
        assertThat(BibtexKeyUtils.generate(AUTHORS, 2020, TITLE, BibtexKeyUtils.MODE_MEDIUM)).isEqualTo("smith2020survey");
        assertThat(BibtexKeyUtils.generate(AUTHORS, 2020, TITLE, BibtexKeyUtils.MODE_LONG)).isEqualTo("smith2020surveydeeplearning");
    }

    @Test
    void generate_shouldUsePlaceholdersForMissingData() {
        assertThat(BibtexKeyUtils.generate(null, null, null, BibtexKeyUtils.MODE_MEDIUM)).isEqualTo("unknown0000");
    }

    @Test
    void firstAuthorKey_shouldHandleNameOrders() {
        assertThat(BibtexKeyUtils.firstAuthorKey("John O'Neil")).isEqualTo("oneil");
        assertThat(BibtexKeyUtils.firstAuthorKey("张三; 李四")).isEqualTo("张");
    }

    @Test
    void titleKeywords_shouldDropStopwordsAndShortWords() {
        assertThat(BibtexKeyUtils.titleKeywords("On the AI of Go")).isEmpty();
        assertThat(BibtexKeyUtils.titleKeywords(TITLE)).containsExactly("survey", "deep", "learning", "metadata", "extraction");
    }
}

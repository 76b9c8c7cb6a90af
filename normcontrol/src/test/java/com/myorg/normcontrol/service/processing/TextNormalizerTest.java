package com.myorg.normcontrol.service.processing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void collapsesHorizontalWhitespaceButKeepsLines() {
        assertThat(TextNormalizer.normalize("Лист  3\t\tЛистов  5\r\nМ 1:100"))
                .isEqualTo("Лист 3 Листов 5 \nМ 1:100");
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.truncate(null, 10)).isEmpty();
        assertThat(TextNormalizer.lower(null)).isEmpty();
        assertThat(TextNormalizer.isBlank(null)).isTrue();
    }

    @Test
    void truncateDoesNotSplitSurrogatePairs() {
        String text = "ab😀cd";

        assertThat(TextNormalizer.truncate(text, 3)).isEqualTo("ab");
        assertThat(TextNormalizer.truncate(text, 4)).isEqualTo("ab😀");
        assertThat(TextNormalizer.truncate(text, 100)).isSameAs(text);
        assertThat(TextNormalizer.truncate(text, 0)).isSameAs(text);
    }
}

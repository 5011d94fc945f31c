package com.legalgraph.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContextWindowTest {

    private final ContextWindow contextWindow = new ContextWindow();

    @Test
    @DisplayName("should centre the window on the match and drop partial words")
    void shouldCentreOnMatch() {
        String text = "alpha beta gamma delta epsilon zeta eta theta";

        String snippet = contextWindow.around(text, 17, 22, 20);

        assertThat(snippet).isEqualTo("gamma delta epsilon");
    }

    @Test
    @DisplayName("should never exceed the configured width")
    void shouldRespectWidth() {
        String text = "word ".repeat(200) + "section 2913.01 " + "word ".repeat(200);
        int start = text.indexOf("section");

        String snippet = contextWindow.around(text, start, start + "section 2913.01".length(), 100);

        assertThat(snippet).hasSizeLessThanOrEqualTo(100);
        assertThat(snippet).contains("section 2913.01");
        assertThat(snippet).doesNotStartWith(" ").doesNotEndWith(" ");
    }

    @Test
    @DisplayName("should move unused room to the other side at text edges")
    void shouldUseSlackAtEdges() {
        String text = "section 2913.01 applies to every person described in this chapter of the code";

        String snippet = contextWindow.around(text, 0, 15, 40);

        assertThat(snippet).startsWith("section 2913.01 applies");
        assertThat(snippet).hasSizeLessThanOrEqualTo(40);
    }

    @Test
    @DisplayName("should collapse whitespace runs including newlines")
    void shouldCollapseWhitespace() {
        String text = "first paragraph\n\n   second   paragraph";

        assertThat(contextWindow.around(text, 0, text.length(), 100))
                .isEqualTo("first paragraph second paragraph");
    }

    @Test
    @DisplayName("should truncate a match longer than the width")
    void shouldTruncateLongMatch() {
        String text = "one two three four five six";

        String snippet = contextWindow.around(text, 0, text.length(), 10);

        assertThat(snippet).isEqualTo("one two");
    }

    @Test
    void shouldReturnEmptyForEmptyText() {
        assertThat(contextWindow.around("", 0, 0, 100)).isEmpty();
        assertThat(contextWindow.around(null, 0, 0, 100)).isEmpty();
    }
}

package guraa.wiringdoc.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageRangesTest {

    @Test
    void shouldParseSinglePage() {
        assertThat(PageRanges.parse("7")).containsExactly(7);
    }

    @Test
    void shouldExpandRangesInWrittenOrder() {
        assertThat(PageRanges.parse("5-6;1; 3")).containsExactly(5, 6, 1, 3);
        assertThat(PageRanges.parse("2-4")).containsExactly(2, 3, 4);
        assertThat(PageRanges.parse("1,2")).containsExactly(1, 2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "0", "a", "3-1", "1-", "-2"})
    void shouldRejectInvalidLists(String text) {
        assertThatThrownBy(() -> PageRanges.parse(text)).isInstanceOf(IllegalArgumentException.class);
    }
}

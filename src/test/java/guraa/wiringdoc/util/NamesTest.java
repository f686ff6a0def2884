package guraa.wiringdoc.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NamesTest {

    @Test
    void shouldCollapseWhitespaceAndTrim() {
        assertThat(Names.normalise("  Plant\n  Room\t2 ")).isEqualTo("Plant Room 2");
    }

    @Test
    void shouldReplaceTypographicQuotes() {
        assertThat(Names.normalise("‘Bob’s’ “bar”")).isEqualTo("'Bob's' \"bar\"");
    }

    @Test
    void shouldPassNullThrough() {
        assertThat(Names.normalise(null)).isNull();
    }

    @Test
    void shouldMakeFileSafeNames() {
        assertThat(Names.fileSafe("Plant Room / 2")).isEqualTo("Plant_Room_2");
        assertThat(Names.fileSafe("L2-Kitchen.east")).isEqualTo("L2-Kitchen.east");
    }
}

package loci.patchsynth.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClassPairTest {

    @Test
    @DisplayName("Pairs are unordered")
    void testCanonicalOrder() {
        ClassPair pair = new ClassPair(5, 2);

        assertEquals(2, pair.first());
        assertEquals(5, pair.second());
        assertEquals(new ClassPair(2, 5), pair);
        assertEquals("2-5", pair.toString());
    }

    @Test
    void testParse() {
        assertEquals(new ClassPair(1, 3), ClassPair.parse(" 3-1 "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "1-2-3", "a-b", "2-2", ""})
    @DisplayName("Malformed pairs are rejected")
    void testParseMalformed(String text) {
        assertThrows(IllegalArgumentException.class, () -> ClassPair.parse(text));
    }

    @Test
    void testContainedIn() {
        assertTrue(new ClassPair(1, 2).isContainedIn(Set.of(0, 1, 2)));
        assertFalse(new ClassPair(1, 2).isContainedIn(Set.of(1, 3)));
    }
}

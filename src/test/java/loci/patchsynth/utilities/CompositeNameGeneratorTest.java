package loci.patchsynth.utilities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CompositeNameGenerator.
 */
class CompositeNameGeneratorTest {

    @ParameterizedTest(name = "{0} + {1} + {2} -> {3}")
    @CsvSource({
            "A.png, B.png, m1, A_B_m1",
            "A.jpg, B.jpg, m1, A_B_m1",
            "slide.1_x.png, B.png, mask, slide.1_x_B_mask",
            "A.png, A.png, m, A_A_m",
            "A.png, B.png, m.1, A_B_m.1",
            "A.png, B.png, m.2, A_B_m.2"
    })
    @DisplayName("Base name joins the patch names without extension and the mask id as given")
    void testGenerateName(String first, String second, String mask, String expected) {
        assertEquals(expected, CompositeNameGenerator.generateName(first, second, mask));
    }

    @Test
    @DisplayName("Image and label files share the base name")
    void testFileNames() {
        assertEquals("A_B_m.jpg", CompositeNameGenerator.imageFileName("A_B_m"));
        assertEquals("A_B_m.png", CompositeNameGenerator.labelFileName("A_B_m"));
    }

    @Test
    @DisplayName("Masks whose ids differ only after a dot keep distinct names")
    void testDottedMaskIdsStayDistinct() {
        assertNotEquals(CompositeNameGenerator.generateName("A.png", "B.png", "m.1"),
                CompositeNameGenerator.generateName("A.png", "B.png", "m.2"));
    }

    @Test
    void testNullRejected() {
        assertThrows(IllegalArgumentException.class, () -> CompositeNameGenerator.generateName("A.png", null, "m"));
    }
}

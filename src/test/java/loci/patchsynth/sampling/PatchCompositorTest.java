package loci.patchsynth.sampling;

import loci.patchsynth.PatchFixtures;
import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.StitchMask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatchCompositor.
 */
class PatchCompositorTest {

    private static final int RED = 0xFF0000;
    private static final int BLUE = 0x0000FF;

    private static StitchMask mask(int... samples) {
        return StitchMask.fromSamples("m", 2, 2, samples);
    }

    @Test
    @DisplayName("A cleared mask copies the first source")
    void testAllFirst() {
        BufferedImage out = PatchCompositor.compositeImage(
                PatchFixtures.solid(RED), PatchFixtures.solid(BLUE), mask(0, 0, 0, 0));

        for (int i = 0; i < 4; i++) {
            assertEquals(RED, out.getRGB(i % 2, i / 2) & 0xFFFFFF);
        }
    }

    @Test
    @DisplayName("A full mask copies the second source")
    void testAllSecond() {
        BufferedImage out = PatchCompositor.compositeImage(
                PatchFixtures.solid(RED), PatchFixtures.solid(BLUE), mask(255, 255, 255, 255));

        for (int i = 0; i < 4; i++) {
            assertEquals(BLUE, out.getRGB(i % 2, i / 2) & 0xFFFFFF);
        }
    }

    @Test
    @DisplayName("Each pixel follows its own mask value, labels included")
    void testMixed() {
        StitchMask m = mask(0, 1, 0, 1);

        BufferedImage image = PatchCompositor.compositeImage(PatchFixtures.solid(RED), PatchFixtures.solid(BLUE), m);
        LabelMask labels = PatchCompositor.compositeLabels(
                new LabelMask(2, 2, new int[] {1, 1, 1, 1}), new LabelMask(2, 2, new int[] {2, 2, 2, 2}), m);

        assertEquals(RED, image.getRGB(0, 0) & 0xFFFFFF);
        assertEquals(BLUE, image.getRGB(1, 0) & 0xFFFFFF);
        assertEquals(RED, image.getRGB(0, 1) & 0xFFFFFF);
        assertEquals(BLUE, image.getRGB(1, 1) & 0xFFFFFF);
        assertArrayEquals(new int[] {1, 2, 1, 2}, labels.getLabels());
    }

    @Test
    @DisplayName("Sources and mask must share one size")
    void testSizeMismatch() {
        assertThrows(IllegalArgumentException.class, () -> PatchCompositor.compositeImage(
                PatchFixtures.solid(3, 2, RED), PatchFixtures.solid(BLUE), mask(0, 0, 0, 0)));
        assertThrows(IllegalArgumentException.class, () -> PatchCompositor.compositeLabels(
                new LabelMask(1, 1, new int[] {1}), new LabelMask(1, 1, new int[] {2}), mask(0, 0, 0, 0)));
    }
}

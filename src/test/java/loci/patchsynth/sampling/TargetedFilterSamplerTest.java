package loci.patchsynth.sampling;

import loci.patchsynth.PatchFixtures;
import loci.patchsynth.model.ClassPair;
import loci.patchsynth.model.PatchClassIndex;
import loci.patchsynth.normalization.StainNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TargetedFilterSampler.
 */
class TargetedFilterSamplerTest {

    private static final List<ClassPair> TARGET = List.of(new ClassPair(1, 2));

    @TempDir
    Path tmp;

    private PatchFixtures fixtures;
    private PatchClassIndex index;

    private void corpus(int... stitchSamples) throws IOException {
        fixtures = new PatchFixtures(tmp)
                .patch("A", 1, 0xC03060)
                .patch("B", 2, 0x4040C0)
                .patch("C", new int[] {1, 2, 2, 1}, 0x808080)
                .stitchMask("m", stitchSamples);
        index = new PatchClassIndex(Map.of(
                "A.png", List.of(1),
                "B.png", List.of(2),
                "C.png", List.of(1, 2)));
    }

    private TargetedFilterSampler sampler(RecordingWriter writer, int n, boolean exclude, int maxAttempts) {
        PatchSource source = new PatchSource(fixtures.imageDir, fixtures.maskDir, fixtures.stitchDir, ".jpg");
        return new TargetedFilterSampler(source, writer, StainNormalizer.identity(), new Random(5),
                new SamplingContext(maxAttempts), n, TARGET, exclude, index);
    }

    @Test
    @DisplayName("Every accepted composite contains a target pair and excluded patches are never drawn")
    void testAcceptedHoldTarget() throws IOException {
        corpus(0, 255, 0, 255);
        RecordingWriter writer = new RecordingWriter(tmp.resolve("out"));

        TargetedFilterSampler sampler = sampler(writer, 6, true, 1000);
        int written = sampler.run();

        assertEquals(6, written);
        for (int i = 0; i < writer.names.size(); i++) {
            assertEquals(Set.of(1, 2), writer.labelSets.get(i));
            assertFalse(writer.names.get(i).contains("C"), writer.names.get(i));
        }
    }

    @Test
    @DisplayName("Candidates drop patches that already hold a target pair only when exclusion is on")
    void testCandidates() throws IOException {
        corpus(0, 255, 0, 255);

        assertEquals(List.of("A.png", "B.png"),
                sampler(new RecordingWriter(tmp.resolve("o1")), 1, true, 10).candidates());
        assertEquals(List.of("A.png", "B.png", "C.png"),
                sampler(new RecordingWriter(tmp.resolve("o2")), 1, false, 10).candidates());
    }

    @Test
    @DisplayName("A mask that never mixes the sources exhausts the attempt budget")
    void testExhausted() throws IOException {
        corpus(0, 0, 0, 0);
        RecordingWriter writer = new RecordingWriter(tmp.resolve("out"));
        TargetedFilterSampler sampler = sampler(writer, 1, true, 50);

        assertThrows(SamplingExhaustedException.class, sampler::run);
        assertEquals(50, sampler.getRejected());
        assertTrue(writer.names.isEmpty());
    }

    @Test
    @DisplayName("Exclusion that leaves no way to form the pair fails up front")
    void testInfeasibleAfterExclusion() throws IOException {
        fixtures = new PatchFixtures(tmp)
                .patch("A", 1, 0xC03060)
                .patch("C", new int[] {1, 2, 2, 1}, 0x808080)
                .stitchMask("m", 0, 255, 0, 255);
        index = new PatchClassIndex(Map.of("A.png", List.of(1), "C.png", List.of(1, 2)));

        TargetedFilterSampler sampler = sampler(new RecordingWriter(tmp.resolve("out")), 1, true, 10);

        assertThrows(SamplingExhaustedException.class, sampler::run);
    }

    @Test
    void testNoTargets() throws IOException {
        corpus(0, 0, 0, 0);
        PatchSource source = new PatchSource(fixtures.imageDir, fixtures.maskDir, fixtures.stitchDir, ".jpg");

        assertThrows(IllegalArgumentException.class, () -> new TargetedFilterSampler(source,
                new RecordingWriter(tmp.resolve("out")), StainNormalizer.identity(), new Random(1),
                new SamplingContext(1), 1, List.of(), false, index));
    }

    @Test
    void testHoldsTargetPair() throws IOException {
        corpus(0, 0, 0, 0);
        TargetedFilterSampler sampler = sampler(new RecordingWriter(tmp.resolve("out")), 1, false, 10);

        assertTrue(sampler.holdsTargetPair(Set.of(0, 1, 2)));
        assertFalse(sampler.holdsTargetPair(Set.of(1, 3)));
    }
}

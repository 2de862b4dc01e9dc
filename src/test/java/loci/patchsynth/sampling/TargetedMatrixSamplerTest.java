package loci.patchsynth.sampling;

import loci.patchsynth.PatchFixtures;
import loci.patchsynth.model.ClassPair;
import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.PairTask;
import loci.patchsynth.model.PatchClassIndex;
import loci.patchsynth.normalization.StainNormalizer;
import loci.patchsynth.utilities.PatchImageIO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TargetedMatrixSampler.
 */
class TargetedMatrixSamplerTest {

    @TempDir
    Path tmp;

    private PatchFixtures fixtures;

    private TargetedMatrixSampler sampler(RecordingWriter writer, List<PairTask> tasks, boolean exclude,
                                          PatchClassIndex index, SamplingContext context) {
        PatchSource source = new PatchSource(fixtures.imageDir, fixtures.maskDir, fixtures.stitchDir, ".jpg");
        return new TargetedMatrixSampler(source, writer, StainNormalizer.identity(), new Random(17),
                context, tasks, exclude, index);
    }

    private static PatchClassIndex index(Object... entries) {
        Map<String, List<Integer>> table = new LinkedHashMap<>();
        for (int i = 0; i < entries.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<Integer> classes = (List<Integer>) entries[i + 1];
            table.put((String) entries[i], classes);
        }
        return new PatchClassIndex(table);
    }

    @Test
    @DisplayName("One composite for pair 1-2 from a class-1 patch and a class-2 patch")
    void testSingleComposite() throws IOException {
        fixtures = new PatchFixtures(tmp)
                .patch("A", 1, 0xC03060)
                .patch("B", 2, 0x4040C0)
                .stitchMask("m", 0, 255, 0, 255);
        RecordingWriter writer = new RecordingWriter(tmp.resolve("out"));

        int written = sampler(writer, List.of(new PairTask(1, 2, 1)), true,
                index("A.png", List.of(1), "B.png", List.of(2)), new SamplingContext(100)).run();

        assertEquals(1, written);
        assertEquals(List.of("A_B_m"), writer.names);
        assertTrue(Files.exists(tmp.resolve("out").resolve("image").resolve("A_B_m.jpg")));
        LabelMask labels = PatchImageIO.readLabelMask(tmp.resolve("out").resolve("mask").resolve("A_B_m.png"));
        assertArrayEquals(new int[] {1, 2, 1, 2}, labels.getLabels());
        assertEquals(Set.of(1, 2), labels.distinctClasses());
    }

    @Test
    @DisplayName("Every quota is met exactly and split fragments of a pair are merged")
    void testQuotasMet() throws IOException {
        fixtures = new PatchFixtures(tmp)
                .patch("A", 1, 0xC03060)
                .patch("B", 2, 0x4040C0)
                .patch("D", 3, 0x40C040)
                .stitchMask("m", 0, 255, 0, 255);
        RecordingWriter writer = new RecordingWriter(tmp.resolve("out"));
        TargetedMatrixSampler sampler = sampler(writer,
                List.of(new PairTask(1, 2, 2), new PairTask(1, 3, 2), new PairTask(1, 2, 1)), false,
                index("A.png", List.of(1), "B.png", List.of(2), "D.png", List.of(3)), new SamplingContext(100));

        int written = sampler.run();

        assertEquals(5, written);
        Map<ClassPair, Integer> counters = sampler.getCounters();
        assertEquals(2, counters.size());
        assertEquals(3, counters.get(new ClassPair(1, 2)));
        assertEquals(2, counters.get(new ClassPair(1, 3)));
        assertEquals(List.of("A_B_m", "A_D_m", "A_B_m", "A_D_m", "A_B_m"), writer.names);
    }

    @Test
    @DisplayName("With exclusion, patches already holding both classes are never used")
    void testExclusion() throws IOException {
        fixtures = new PatchFixtures(tmp)
                .patch("A", 1, 0xC03060)
                .patch("B", 2, 0x4040C0)
                .patch("C", new int[] {1, 2, 1, 2}, 0x808080)
                .stitchMask("m", 0, 255, 0, 255);
        RecordingWriter writer = new RecordingWriter(tmp.resolve("out"));

        sampler(writer, List.of(new PairTask(1, 2, 10)), true,
                index("A.png", List.of(1), "B.png", List.of(2), "C.png", List.of(1, 2)),
                new SamplingContext(100_000)).run();

        assertEquals(10, writer.names.size());
        assertTrue(writer.names.stream().allMatch("A_B_m"::equals), writer.names.toString());
    }

    @Test
    @DisplayName("Stitch masks named m.1 and m.2 give separate composites")
    void testDottedMaskNames() throws IOException {
        fixtures = new PatchFixtures(tmp)
                .patch("A", 1, 0xC03060)
                .patch("B", 2, 0x4040C0)
                .stitchMask("m.1", 0, 255, 0, 255)
                .stitchMask("m.2", 255, 0, 255, 0);
        RecordingWriter writer = new RecordingWriter(tmp.resolve("out"));

        sampler(writer, List.of(new PairTask(1, 2, 20)), false,
                index("A.png", List.of(1), "B.png", List.of(2)), new SamplingContext(100)).run();

        assertEquals(Set.of("A_B_m.1", "A_B_m.2"), new HashSet<>(writer.names));
        assertArrayEquals(new String[] {"A_B_m.1.jpg", "A_B_m.2.jpg"},
                PatchFixtures.list(tmp.resolve("out").resolve("image")));
        assertArrayEquals(new String[] {"A_B_m.1.png", "A_B_m.2.png"},
                PatchFixtures.list(tmp.resolve("out").resolve("mask")));
    }

    @Test
    @DisplayName("A class without patches makes the pair infeasible")
    void testEmptyPool() throws IOException {
        fixtures = new PatchFixtures(tmp).patch("A", 1, 0xC03060).stitchMask("m", 0, 0, 0, 0);

        TargetedMatrixSampler sampler = sampler(new RecordingWriter(tmp.resolve("out")),
                List.of(new PairTask(1, 5, 1)), false, index("A.png", List.of(1)), new SamplingContext(10));

        assertThrows(SamplingExhaustedException.class, sampler::run);
    }

    @Test
    @DisplayName("A pool made only of excluded patches makes the pair infeasible")
    void testPoolFullyExcluded() throws IOException {
        fixtures = new PatchFixtures(tmp)
                .patch("A", 1, 0xC03060)
                .patch("C", new int[] {1, 2, 1, 2}, 0x808080)
                .stitchMask("m", 0, 0, 0, 0);

        TargetedMatrixSampler sampler = sampler(new RecordingWriter(tmp.resolve("out")),
                List.of(new PairTask(1, 2, 1)), true,
                index("A.png", List.of(1), "C.png", List.of(1, 2)), new SamplingContext(10));

        assertThrows(SamplingExhaustedException.class, sampler::run);
    }

    @Test
    void testCancelled() throws IOException {
        fixtures = new PatchFixtures(tmp)
                .patch("A", 1, 0xC03060)
                .patch("B", 2, 0x4040C0)
                .stitchMask("m", 0, 255, 0, 255);
        SamplingContext context = new SamplingContext(10);
        context.cancel();

        TargetedMatrixSampler sampler = sampler(new RecordingWriter(tmp.resolve("out")),
                List.of(new PairTask(1, 2, 3)), false, index("A.png", List.of(1), "B.png", List.of(2)), context);

        assertThrows(CancellationException.class, sampler::run);
    }
}

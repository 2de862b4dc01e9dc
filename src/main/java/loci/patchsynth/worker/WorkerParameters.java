package loci.patchsynth.worker;

import com.beust.jcommander.Parameter;
import loci.patchsynth.model.ClassPair;
import loci.patchsynth.model.PairTask;
import loci.patchsynth.model.SynthesisMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command line of one worker process, as written by the coordinator.
 */
public class WorkerParameters {

    @Parameter(
            names = "--mode",
            description = "Sampling mode: generalized, targeted_filter or targeted_matrix",
            required = true)
    public String mode;

    @Parameter(
            names = "--seed",
            description = "Seed of this worker's random stream",
            required = true)
    public long seed;

    @Parameter(
            names = "--worker-index",
            description = "Slot index of this worker, used in log messages")
    public int workerIndex;

    @Parameter(
            names = "--n-patches",
            description = "Number of composites to write (generalized, targeted_filter)")
    public Integer nPatches;

    @Parameter(
            names = "--pair",
            description = "Class pair i-j (targeted_matrix, repeatable, matched with --count)")
    public List<String> pairs = new ArrayList<>();

    @Parameter(
            names = "--count",
            description = "Quota of the --pair at the same position")
    public List<String> counts = new ArrayList<>();

    @Parameter(
            names = "--filter-pairs",
            description = "Comma separated target pairs i-j (targeted_filter)")
    public List<String> filterPairs = new ArrayList<>();

    @Parameter(
            names = "--exclude-existing",
            description = "Never draw patches that already hold a target pair")
    public boolean excludeExisting;

    @Parameter(
            names = "--patch-classes-json",
            description = "Patch-classes table (targeted modes)")
    public String patchClassesJson;

    @Parameter(
            names = "--data-root",
            description = "Folder holding the image and mask folders",
            required = true)
    public String dataRoot;

    @Parameter(
            names = "--image-dir-name",
            description = "Name of the image folder, in the data root and in the output")
    public String imageDirName = "image";

    @Parameter(
            names = "--mask-dir-name",
            description = "Name of the label mask folder, in the data root and in the output")
    public String maskDirName = "mask_FINAL";

    @Parameter(
            names = "--image-extension",
            description = "Extension of the source images")
    public String imageExtension = ".jpg";

    @Parameter(
            names = "--stitch-masks",
            description = "Folder of stitch masks",
            required = true)
    public String stitchMasks;

    @Parameter(
            names = "--output-dir",
            description = "Output folder",
            required = true)
    public String outputDir;

    @Parameter(
            names = "--norm-model",
            description = "Fitted stain normalizer; omit to leave colors unchanged")
    public String normModel;

    @Parameter(
            names = "--max-attempts",
            description = "Consecutive rejected draws tolerated before giving up")
    public int maxAttempts = 100_000;

    @Parameter(
            names = {"-h", "--help"},
            description = "Display this note",
            help = true)
    public boolean help;

    public SynthesisMode synthesisMode() {
        return SynthesisMode.fromConfigName(mode);
    }

    /**
     * @return the pair tasks given by the matching --pair and --count options
     * @throws IllegalArgumentException if the two lists do not line up or hold invalid values
     */
    public List<PairTask> pairTasks() {
        if (pairs.size() != counts.size()) {
            throw new IllegalArgumentException(String.format(
                    "%d --pair option(s) but %d --count option(s)", pairs.size(), counts.size()));
        }
        List<PairTask> tasks = new ArrayList<>();
        for (int i = 0; i < pairs.size(); i++) {
            String[] parts = pairs.get(i).split("-");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Pair must look like i-j: " + pairs.get(i));
            }
            try {
                tasks.add(new PairTask(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                        Integer.parseInt(counts.get(i).trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid pair task " + pairs.get(i) + " x " + counts.get(i), e);
            }
        }
        return tasks;
    }

    public List<ClassPair> targetPairs() {
        return filterPairs.stream().map(ClassPair::parse).collect(Collectors.toList());
    }

    public Path imageDir() {
        return Paths.get(dataRoot, imageDirName);
    }

    public Path maskDir() {
        return Paths.get(dataRoot, maskDirName);
    }

    @Override
    public String toString() {
        return "WorkerParameters{mode=" + mode + ", seed=" + seed + ", workerIndex=" + workerIndex
                + ", nPatches=" + nPatches + ", pairs=" + pairs + ", counts=" + counts
                + ", filterPairs=" + filterPairs + ", excludeExisting=" + excludeExisting
                + ", outputDir=" + outputDir + "}";
    }
}

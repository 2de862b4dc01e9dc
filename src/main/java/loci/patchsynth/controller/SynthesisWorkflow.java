package loci.patchsynth.controller;

import loci.patchsynth.model.NormalizationMethod;
import loci.patchsynth.model.PairTask;
import loci.patchsynth.model.SynthesisMode;
import loci.patchsynth.model.WorkChunk;
import loci.patchsynth.normalization.NormalizerStore;
import loci.patchsynth.service.PatchClassIndexBuilder;
import loci.patchsynth.service.ProcessWorkerLauncher;
import loci.patchsynth.service.WorkerCommandBuilder;
import loci.patchsynth.service.WorkerLauncher;
import loci.patchsynth.service.WorkerResult;
import loci.patchsynth.utilities.RunLogger;
import loci.patchsynth.utilities.SynthesisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

/**
 * Coordinator side of a synthesis run.
 *
 * <p>Steps, all in the launching process and before any worker starts:
 * <ol>
 *   <li>create the output folder and start the run log</li>
 *   <li>fit the stain normalizer, or reuse the persisted one</li>
 *   <li>build the patch-classes table when the mode needs it, or reuse the existing one</li>
 *   <li>plan the work and balance it over one slot per CPU</li>
 *   <li>run every non-empty chunk on the CPU pool and wait for all of them</li>
 * </ol>
 */
public class SynthesisWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(SynthesisWorkflow.class);

    private final SynthesisConfig config;
    private final WorkerLauncher launcher;

    public SynthesisWorkflow(SynthesisConfig config) {
        this(config, new ProcessWorkerLauncher(config.isPinCpus(), config.getWorkerTimeoutSeconds()));
    }

    public SynthesisWorkflow(SynthesisConfig config, WorkerLauncher launcher) {
        this.config = config;
        this.launcher = launcher;
    }

    /**
     * Runs the whole synthesis.
     *
     * @return results of all launched workers
     * @throws IOException          if preparation fails or any worker fails
     *                              ({@link loci.patchsynth.service.WorkerFailureException})
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public List<WorkerResult> run() throws IOException, InterruptedException {
        Files.createDirectories(config.getOutputDir());

        try (RunLogger.Session session = RunLogger.start(config.getOutputDir())) {
            logger.info("Starting {} synthesis on CPUs {} (seed {})",
                    config.getMode(), config.getCpus(), config.getSeed());

            prepareSharedResources();

            List<WorkChunk> chunks = planChunks();
            for (WorkChunk chunk : chunks) {
                logger.info("Planned {}", chunk);
            }

            WorkerPoolCoordinator coordinator = new WorkerPoolCoordinator(config.getCpus(), launcher);
            List<WorkerResult> results = coordinator.runAll(chunks,
                    chunk -> WorkerCommandBuilder.forConfig(config).chunk(chunk).build());
            logger.info("Synthesis finished, output in {}", config.getOutputDir());
            return results;
        }
    }

    /**
     * Fits or loads the normalizer and builds or loads the patch-classes table.
     */
    void prepareSharedResources() throws IOException {
        if (config.getNormalization() == NormalizationMethod.MACENKO) {
            NormalizerStore.fitOrLoad(config.getNormModel(), config.getReferenceImage());
        } else {
            logger.info("Stain normalization disabled");
        }
        if (config.getMode().usesPatchClasses()) {
            PatchClassIndexBuilder.buildIfMissing(config.getMaskDir(), config.getPatchClassesJson());
        }
    }

    /**
     * @return one chunk per CPU, some possibly empty
     */
    List<WorkChunk> planChunks() {
        int slots = config.getCpus().size();
        if (config.getMode() == SynthesisMode.TARGETED_MATRIX) {
            List<PairTask> tasks = TaskPlanner.planPairTasks(config);
            return LoadBalancer.balance(tasks, slots, config.getBalancing());
        }
        return LoadBalancer.splitCount(TaskPlanner.planPatchCount(config), slots);
    }
}

package loci.patchsynth;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import loci.patchsynth.controller.SynthesisWorkflow;
import loci.patchsynth.service.WorkerFailureException;
import loci.patchsynth.utilities.InvalidConfigurationException;
import loci.patchsynth.utilities.SynthesisConfig;
import loci.patchsynth.utilities.SynthesisConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Command line launcher: {@code PatchSynth --config run.yml}.
 *
 * <p>Exit codes: 0 success, 1 worker failure or other error, 2 configuration error.
 */
public class PatchSynth {
    private static final Logger logger = LoggerFactory.getLogger(PatchSynth.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIG_ERROR = 2;

    public static class Parameters {

        @Parameter(
                names = {"-c", "--config"},
                description = "YAML configuration of the run",
                required = true)
        public String config;

        @Parameter(
                names = {"-h", "--help"},
                description = "Display this note",
                help = true)
        public boolean help;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        Parameters parameters = new Parameters();
        JCommander commander = JCommander.newBuilder()
                .addObject(parameters)
                .programName(PatchSynth.class.getSimpleName())
                .build();
        try {
            commander.parse(args);
        } catch (ParameterException e) {
            logger.error("{}", e.getMessage());
            commander.usage();
            return EXIT_CONFIG_ERROR;
        }
        if (parameters.help) {
            commander.usage();
            return EXIT_OK;
        }

        SynthesisConfig config;
        try {
            config = SynthesisConfigManager.load(Paths.get(parameters.config)).toSynthesisConfig();
        } catch (InvalidConfigurationException e) {
            logger.error("Invalid configuration {}: {}", parameters.config, e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        try {
            new SynthesisWorkflow(config).run();
            return EXIT_OK;
        } catch (InvalidConfigurationException e) {
            logger.error("Invalid configuration {}: {}", parameters.config, e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (WorkerFailureException e) {
            logger.error("Synthesis failed: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | RuntimeException e) {
            logger.error("Synthesis failed", e);
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while waiting for workers");
            return EXIT_FAILURE;
        }
    }
}

package loci.patchsynth.normalization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import loci.patchsynth.utilities.PatchImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists the fitted stain normalizer as JSON and rebuilds the full source-patch transform
 * (luminosity standardization followed by Macenko) from it.
 */
public class NormalizerStore {
    private static final Logger logger = LoggerFactory.getLogger(NormalizerStore.class);

    public static final String METHOD = "macenko";

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private NormalizerStore() {}

    /**
     * JSON form of a fitted normalizer.
     */
    static class StainModel {
        String method;
        double[][] stainMatrix;
        double[] maxConcentrations;

        StainModel() {
        }

        StainModel(MacenkoStainNormalizer normalizer) {
            this.method = METHOD;
            this.stainMatrix = normalizer.getStainMatrix();
            this.maxConcentrations = normalizer.getMaxConcentrations();
        }
    }

    /**
     * Loads the model at {@code modelPath}, or fits it against {@code referenceImage} and saves it
     * there first if it does not exist yet.
     *
     * @return the transform applied to every source patch
     * @throws IOException if the reference or model cannot be read, or the model cannot be written
     */
    public static StainNormalizer fitOrLoad(Path modelPath, Path referenceImage) throws IOException {
        if (Files.exists(modelPath)) {
            logger.info("Stain normalizer already fitted, loading {}", modelPath);
            return load(modelPath);
        }
        if (referenceImage == null) {
            throw new IOException("No normalizer model at " + modelPath + " and no reference image to fit one");
        }
        logger.info("Fitting Macenko normalizer to {} and storing it at {}", referenceImage, modelPath);
        LuminosityStandardizer standardizer = new LuminosityStandardizer();
        BufferedImage reference = standardizer.transform(PatchImageIO.readRgb(referenceImage));
        MacenkoStainNormalizer macenko = new MacenkoStainNormalizer().fit(reference);
        save(macenko, modelPath);
        logger.info("Done with fitting Macenko normalizer");
        return standardizer.andThen(macenko);
    }

    /**
     * Writes a fitted normalizer.
     */
    public static void save(MacenkoStainNormalizer normalizer, Path modelPath) throws IOException {
        if (!normalizer.isFitted()) {
            throw new IllegalArgumentException("Cannot save a normalizer that has not been fitted");
        }
        Path parent = modelPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(modelPath, gson.toJson(new StainModel(normalizer)), StandardCharsets.UTF_8);
    }

    /**
     * @return the standardizer plus the persisted Macenko normalizer
     * @throws IOException if the file is missing or not a valid model
     */
    public static StainNormalizer load(Path modelPath) throws IOException {
        return new LuminosityStandardizer().andThen(loadMacenko(modelPath));
    }

    static MacenkoStainNormalizer loadMacenko(Path modelPath) throws IOException {
        if (!Files.exists(modelPath)) {
            throw new IOException("Normalizer model not found: " + modelPath);
        }
        StainModel model;
        try {
            model = gson.fromJson(Files.readString(modelPath, StandardCharsets.UTF_8), StainModel.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed normalizer model " + modelPath + ": " + e.getMessage(), e);
        }
        if (model == null || !METHOD.equals(model.method)) {
            throw new IOException("Unsupported normalizer model in " + modelPath
                    + (model == null ? "" : ": method " + model.method));
        }
        try {
            return MacenkoStainNormalizer.fromModel(model.stainMatrix, model.maxConcentrations);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid normalizer model " + modelPath + ": " + e.getMessage(), e);
        }
    }
}

package loci.patchsynth.service;

import com.google.gson.Gson;
import loci.patchsynth.model.LabelMask;
import loci.patchsynth.utilities.PatchImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the patch-classes table: for every label mask, the distinct class values it contains.
 *
 * <p>The table is written once as JSON, {@code {"<mask file>": [c1, c2, ...]}}, and reused by later
 * runs. Masks are visited in file name order.
 */
public class PatchClassIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(PatchClassIndexBuilder.class);

    private PatchClassIndexBuilder() {}

    /**
     * Writes the table unless it already exists.
     *
     * @param maskDir  folder of label masks
     * @param jsonPath destination of the table
     * @return true if the table was built, false if an existing one was kept
     * @throws IOException if a mask cannot be read or the table cannot be written
     */
    public static boolean buildIfMissing(Path maskDir, Path jsonPath) throws IOException {
        if (Files.exists(jsonPath)) {
            logger.info("Patch-classes table already present at {}, skipping", jsonPath);
            return false;
        }
        logger.info("Collecting classes per mask and storing them at {}", jsonPath);
        Map<String, List<Integer>> table = collect(maskDir);

        Path parent = jsonPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = jsonPath.resolveSibling(jsonPath.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            new Gson().toJson(table, writer);
        }
        Files.move(tmp, jsonPath);
        logger.info("Done with collecting classes for {} masks", table.size());
        return true;
    }

    /**
     * @param maskDir folder of label masks
     * @return mask file name to its sorted distinct class values
     */
    public static Map<String, List<Integer>> collect(Path maskDir) throws IOException {
        if (!Files.isDirectory(maskDir)) {
            throw new IOException("Label mask folder not found: " + maskDir);
        }
        List<Path> masks;
        try (Stream<Path> files = Files.list(maskDir)) {
            masks = files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        Map<String, List<Integer>> table = new LinkedHashMap<>();
        for (Path mask : masks) {
            LabelMask labels = PatchImageIO.readLabelMask(mask);
            table.put(mask.getFileName().toString(), new ArrayList<>(labels.distinctClasses()));
        }
        return table;
    }
}

package loci.patchsynth.model;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Read-only index of which tissue classes each patch contains.
 *
 * <p>Holds two views built once from the patch-classes table:
 * <ul>
 *   <li>patch id (label mask file name) to its set of classes</li>
 *   <li>class to the ordered list of patch ids containing it (the class pool)</li>
 * </ul>
 * Pool order follows the table's iteration order, so draws are reproducible for a given seed.
 */
public final class PatchClassIndex {
    private static final Logger logger = LoggerFactory.getLogger(PatchClassIndex.class);

    private static final Type TABLE_TYPE = new TypeToken<LinkedHashMap<String, List<Integer>>>() { }.getType();

    private final Map<String, Set<Integer>> classesByPatch;
    private final Map<Integer, List<String>> patchesByClass;

    /**
     * @param table patch id to the class values found in its label mask
     */
    public PatchClassIndex(Map<String, ? extends Collection<Integer>> table) {
        Map<String, Set<Integer>> byPatch = new LinkedHashMap<>();
        Map<Integer, List<String>> byClass = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<Integer>> entry : table.entrySet()) {
            Set<Integer> classes = Collections.unmodifiableSet(new TreeSet<>(entry.getValue()));
            byPatch.put(entry.getKey(), classes);
            for (Integer c : classes) {
                byClass.computeIfAbsent(c, k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        byClass.replaceAll((c, patches) -> List.copyOf(patches));
        this.classesByPatch = Collections.unmodifiableMap(byPatch);
        this.patchesByClass = Collections.unmodifiableMap(byClass);
    }

    /**
     * Loads the JSON table written by the index builder.
     *
     * @param jsonPath path to the patch-classes JSON file
     * @return the index
     * @throws IOException if the file cannot be read or is not a patch-classes table
     */
    public static PatchClassIndex load(Path jsonPath) throws IOException {
        Map<String, List<Integer>> table;
        try (Reader reader = Files.newBufferedReader(jsonPath, StandardCharsets.UTF_8)) {
            table = new Gson().fromJson(reader, TABLE_TYPE);
        } catch (JsonParseException e) {
            throw new IOException("Malformed patch-classes table: " + jsonPath, e);
        }
        if (table == null) {
            throw new IOException("Patch-classes table is empty: " + jsonPath);
        }
        PatchClassIndex index = new PatchClassIndex(table);
        logger.info("Loaded patch-classes index from {}: {} patches, {} classes",
                jsonPath, index.classesByPatch.size(), index.patchesByClass.size());
        return index;
    }

    /**
     * @param patchId label mask file name
     * @return the classes present in that patch
     * @throws IllegalArgumentException if the patch is not indexed
     */
    public Set<Integer> classesOf(String patchId) {
        Set<Integer> classes = classesByPatch.get(patchId);
        if (classes == null) {
            throw new IllegalArgumentException("Patch '" + patchId + "' is not in the patch-classes index");
        }
        return classes;
    }

    /**
     * @param classLabel tissue class
     * @return patches containing the class, in index order; empty if none
     */
    public List<String> poolOf(int classLabel) {
        return patchesByClass.getOrDefault(classLabel, Collections.emptyList());
    }

    public boolean contains(String patchId) {
        return classesByPatch.containsKey(patchId);
    }

    /**
     * @return true if the patch already contains both classes of the pair
     */
    public boolean containsPair(String patchId, ClassPair pair) {
        return pair.isContainedIn(classesOf(patchId));
    }

    public Set<Integer> classes() {
        return patchesByClass.keySet();
    }

    public int size() {
        return classesByPatch.size();
    }
}

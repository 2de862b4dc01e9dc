package loci.patchsynth.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * MinorFunctions
 *
 * <p>Small helpers that do not belong anywhere else:
 *   - platform checks used when pinning worker processes.
 *   - file name handling.
 *   - truncating long process output for log messages.
 */
public class MinorFunctions {
    private static final Logger logger = LoggerFactory.getLogger(MinorFunctions.class);

    /**
     * @return true if running on Windows, false otherwise
     */
    public static boolean isWindows() {
        String os = System.getProperty("os.name");
        return os != null && os.toLowerCase().contains("win");
    }

    /**
     * @return true if running on Linux, the only platform with {@code taskset}
     */
    public static boolean isLinux() {
        String os = System.getProperty("os.name");
        return os != null && os.toLowerCase().contains("linux");
    }

    /**
     * Looks up an executable on the {@code PATH}.
     *
     * @param name executable name, e.g. "taskset"
     * @return the resolved path, or null if not found
     */
    public static Path findOnPath(String name) {
        String path = System.getenv("PATH");
        if (path == null || path.isEmpty()) {
            return null;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            Path candidate = Paths.get(dir, name);
            if (Files.isExecutable(candidate)) {
                logger.debug("Found {} at {}", name, candidate);
                return candidate;
            }
        }
        return null;
    }

    /**
     * Strips the last extension, e.g. {@code "A_12.png" -> "A_12"}. Names without a dot are returned unchanged.
     */
    public static String stripExtension(String fileName) {
        if (fileName == null) {
            return null;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public static String firstLines(String text, int maxLines) {
        String[] lines = text.split("\r?\n");
        if (lines.length <= maxLines) return text;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < maxLines; i++) {
            sb.append(lines[i]).append('\n');
        }
        sb.append("... (truncated, see log for full details)");
        return sb.toString();
    }
}

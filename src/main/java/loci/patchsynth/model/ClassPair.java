package loci.patchsynth.model;

import java.util.Collection;

/**
 * An unordered pair of tissue classes, stored with {@code first <= second}.
 *
 * <p>The textual form is {@code "first-second"}, e.g. {@code "1-2"}.
 */
public record ClassPair(int first, int second) {

    public ClassPair {
        if (first == second) {
            throw new IllegalArgumentException("A class pair needs two different classes, got " + first + " twice");
        }
        if (first > second) {
            int tmp = first;
            first = second;
            second = tmp;
        }
    }

    /**
     * @param classes the class set of a patch or composite
     * @return true if both classes of this pair are present
     */
    public boolean isContainedIn(Collection<Integer> classes) {
        return classes.contains(first) && classes.contains(second);
    }

    /**
     * Parses {@code "i-j"}.
     *
     * @param text pair in textual form
     * @return the parsed pair
     * @throws IllegalArgumentException if the text is malformed
     */
    public static ClassPair parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Class pair is null");
        }
        String[] parts = text.trim().split("-");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Class pair must look like 'i-j', got '" + text + "'");
        }
        try {
            return new ClassPair(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Class pair must hold two integers, got '" + text + "'", e);
        }
    }

    @Override
    public String toString() {
        return first + "-" + second;
    }
}

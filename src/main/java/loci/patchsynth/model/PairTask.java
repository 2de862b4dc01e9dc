package loci.patchsynth.model;

/**
 * A request for {@code count} composites in which {@code classA} and {@code classB} co-occur.
 *
 * <p>The first source patch is drawn from patches containing {@code classA}, the second from
 * patches containing {@code classB}. Fragments produced by the load balancer are new tasks for the
 * same classes with a smaller count.
 *
 * @param classA class of the first source patch
 * @param classB class of the second source patch
 * @param count  number of composites, strictly positive
 */
public record PairTask(int classA, int classB, int count) {

    public PairTask {
        if (classA == classB) {
            throw new IllegalArgumentException("Pair task needs two different classes, got " + classA + " twice");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Pair task count must be positive, got " + count
                    + " for " + classA + "-" + classB);
        }
    }

    /**
     * @param newCount count of the fragment
     * @return a task for the same classes with a different count
     */
    public PairTask withCount(int newCount) {
        return new PairTask(classA, classB, newCount);
    }

    /**
     * @return the unordered pair of this task's classes
     */
    public ClassPair pair() {
        return new ClassPair(classA, classB);
    }

    @Override
    public String toString() {
        return classA + "-" + classB + "x" + count;
    }
}

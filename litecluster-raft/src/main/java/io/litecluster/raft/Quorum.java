package io.litecluster.raft;

public final class Quorum {

    private Quorum() {}

    public static int size(int clusterSize) {
        if (clusterSize < 1) {
            throw new IllegalArgumentException("clusterSize must be positive");
        }
        return clusterSize / 2 + 1;
    }

    /**
     * True iff {@code reachable} is a strict majority of {@code clusterSize}.
     */
    public static boolean isReached(int reachable, int clusterSize) {
        return reachable >= size(clusterSize);
    }
}

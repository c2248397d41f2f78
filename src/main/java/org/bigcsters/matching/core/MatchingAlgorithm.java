package org.bigcsters.matching.core;

/**
 * Closed set of matching strategies.
 *
 * <p>Declaration order is the deterministic order used for result lists and for the last
 * ranking tie-break in evaluation reports.</p>
 */
public enum MatchingAlgorithm {
    GREEDY("greedy"),
    WEIGHTED_OPTIMAL("weighted"),
    STABLE("stable"),
    HYBRID_PRIORITY_STABLE("hybrid"),
    ILP_OPTIMAL("ilp");

    private final String selectionName;

    MatchingAlgorithm(String selectionName) {
        this.selectionName = selectionName;
    }

    /**
     * @return name accepted by {@link AlgorithmSelection#parse(String)}.
     */
    public String selectionName() {
        return selectionName;
    }
}

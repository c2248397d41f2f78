package org.bigcsters.matching.evaluation;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.Value;
import org.bigcsters.matching.core.MatchingAlgorithm;

/**
 * Comparison metrics of one succeeded strategy.
 */
@Value
@Builder
public class StrategyMetrics {
    MatchingAlgorithm algorithm;
    double totalScore;
    int assignedCount;
    int unmatchedCount;
    /** Recomputed independently of the strategy. */
    int blockingPairs;
    int minLoad;
    int maxLoad;
    /** Load per mentor, mentor index order. */
    IntList mentorLoads;
    /** Mean score over assigned pairs; 0 when nothing is assigned. */
    double averageMatchScore;
    double minMatchScore;
    double maxMatchScore;
    long elapsedMillis;

    public boolean isStable() {
        return blockingPairs == 0;
    }
}

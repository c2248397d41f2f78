package org.bigcsters.matching.strategy;

import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingAlgorithm;
import org.bigcsters.matching.core.MatchingProblem;

/**
 * Contract shared by every matching strategy.
 *
 * <p>Implementations are pure functions of the problem: no shared mutable state, a fresh
 * {@link Assignment} per call, identical output for identical input. They may be invoked
 * concurrently on the same problem.</p>
 */
public interface MatchingStrategy {

    /**
     * @return algorithm tag of this strategy.
     */
    MatchingAlgorithm algorithm();

    /**
     * Computes an assignment.
     *
     * @param problem immutable score matrix, capacities and priorities.
     * @return capacity-respecting assignment over eligible pairs only.
     */
    Assignment solve(MatchingProblem problem);
}

package org.bigcsters.matching.core;

import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Which strategies one engine run executes, and whether their results are compared.
 */
@Value
public class AlgorithmSelection {
    public static final String EVALUATE_ALL = "evaluate-all";

    /** Strategies to run, in {@link MatchingAlgorithm} declaration order. */
    List<MatchingAlgorithm> algorithms;
    /** Whether an evaluation report is produced. */
    boolean compare;

    private AlgorithmSelection(List<MatchingAlgorithm> algorithms, boolean compare) {
        this.algorithms = algorithms;
        this.compare = compare;
    }

    /**
     * Runs one strategy without comparison.
     */
    public static AlgorithmSelection single(MatchingAlgorithm algorithm) {
        return new AlgorithmSelection(List.of(Objects.requireNonNull(algorithm, "algorithm")), false);
    }

    /**
     * Runs every strategy and compares the results.
     */
    public static AlgorithmSelection evaluateAll() {
        return new AlgorithmSelection(List.of(MatchingAlgorithm.values()), true);
    }

    /**
     * Runs a chosen subset of strategies and compares the results.
     */
    public static AlgorithmSelection compare(MatchingAlgorithm first, MatchingAlgorithm... rest) {
        EnumSet<MatchingAlgorithm> chosen = EnumSet.of(Objects.requireNonNull(first, "first"), rest);
        return new AlgorithmSelection(List.copyOf(chosen), true);
    }

    /**
     * Parses a selection name.
     *
     * <p>Accepted names are {@code greedy, weighted, stable, hybrid, ilp, evaluate-all}
     * (case-insensitive). {@code gata-mixed} and {@code ortools} are accepted as older
     * aliases of {@code hybrid} and {@code ilp}.</p>
     *
     * @param name selection name.
     * @return parsed selection.
     * @throws MatchingException with {@link MatchingException#REASON_INVALID_CONFIGURATION}
     * for blank or unknown names.
     */
    public static AlgorithmSelection parse(String name) {
        if (name == null || name.isBlank()) {
            throw new MatchingException(MatchingException.REASON_INVALID_CONFIGURATION, "algorithm name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (EVALUATE_ALL.equals(normalized)) {
            return evaluateAll();
        }
        switch (normalized) {
            case "gata-mixed" -> normalized = MatchingAlgorithm.HYBRID_PRIORITY_STABLE.selectionName();
            case "ortools" -> normalized = MatchingAlgorithm.ILP_OPTIMAL.selectionName();
            default -> {
            }
        }
        for (MatchingAlgorithm algorithm : MatchingAlgorithm.values()) {
            if (algorithm.selectionName().equals(normalized)) {
                return single(algorithm);
            }
        }
        throw new MatchingException(
                MatchingException.REASON_INVALID_CONFIGURATION,
                "unknown algorithm '" + name + "', expected one of greedy, weighted, stable, hybrid, ilp, "
                        + EVALUATE_ALL
        );
    }
}

package org.bigcsters.matching.strategy;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.extern.slf4j.Slf4j;
import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingAlgorithm;
import org.bigcsters.matching.core.MatchingProblem;
import org.bigcsters.matching.evaluation.BlockingPair;
import org.bigcsters.matching.evaluation.StabilityAnalyzer;

import java.util.List;
import java.util.Objects;

/**
 * Score-optimal start followed by a bounded stability repair.
 *
 * <p>Starts from {@link WeightedOptimalMatchingStrategy} and resolves blocking pairs one move
 * at a time as long as the total stays within {@link HybridConfig#getScoreTolerance()} of the
 * optimum. A move never costs a mentor its utilisation: a mentor with a free slot only takes
 * unassigned mentees, and a full mentor's displaced mentee takes over the newcomer's old
 * seat. Score-neutral displacements follow {@link HybridConfig.PriorityTieBreak}.</p>
 *
 * <p>Heuristic: blocking pairs may remain when every resolving move is rejected or the move
 * bound is reached.</p>
 */
@Slf4j
public final class HybridPriorityStableStrategy implements MatchingStrategy {
    private static final double NEUTRAL_EPSILON = 1e-9d;

    private final HybridConfig config;
    private final WeightedOptimalMatchingStrategy optimal = new WeightedOptimalMatchingStrategy();

    public HybridPriorityStableStrategy() {
        this(HybridConfig.defaults());
    }

    public HybridPriorityStableStrategy(HybridConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    @Override
    public MatchingAlgorithm algorithm() {
        return MatchingAlgorithm.HYBRID_PRIORITY_STABLE;
    }

    @Override
    public Assignment solve(MatchingProblem problem) {
        Objects.requireNonNull(problem, "problem");
        Assignment start = optimal.solve(problem);
        double optimalTotal = start.totalScore();
        double floor = optimalTotal * (1.0d - config.getScoreTolerance());
        int moveLimit = config.effectiveMaxRepairMoves(problem.menteeCount(), problem.mentorCount());

        Assignment.Builder builder = Assignment.builder(problem).copyOf(start);
        double total = optimalTotal;
        int applied = 0;
        List<BlockingPair> blocking = StabilityAnalyzer.findBlockingPairs(problem, builder.toMentorArray());
        while (!blocking.isEmpty() && applied < moveLimit) {
            boolean moved = false;
            for (BlockingPair pair : blocking) {
                Move move = evaluate(problem, builder, pair.mentorIndex(), pair.menteeIndex());
                if (move == null || total + move.delta() < floor - NEUTRAL_EPSILON) {
                    continue;
                }
                if (Math.abs(move.delta()) <= NEUTRAL_EPSILON && move.displaced() != Assignment.UNASSIGNED
                        && !tieBreakAllows(problem, move.mentee(), move.displaced())) {
                    continue;
                }
                apply(builder, move);
                total += move.delta();
                applied++;
                moved = true;
                break;
            }
            if (!moved) {
                break;
            }
            blocking = StabilityAnalyzer.findBlockingPairs(problem, builder.toMentorArray());
        }

        Assignment repaired = builder.build();
        log.debug("hybrid repair applied {} of at most {} moves, total {} -> {}",
                applied, moveLimit, optimalTotal, repaired.totalScore());
        if (!blocking.isEmpty()) {
            log.info("hybrid assignment keeps {} blocking pair(s) within score tolerance {}",
                    blocking.size(), config.getScoreTolerance());
        }
        return repaired;
    }

    /**
     * @return move resolving the blocking pair, or null when it would cost a mentor its utilisation.
     */
    private static Move evaluate(MatchingProblem problem, Assignment.Builder builder, int mentor, int mentee) {
        int previous = builder.mentorOf(mentee);
        if (builder.hasCapacity(mentor)) {
            if (previous != Assignment.UNASSIGNED) {
                return null;
            }
            return new Move(mentor, mentee, Assignment.UNASSIGNED, Assignment.UNASSIGNED,
                    problem.score(mentor, mentee));
        }

        int displaced = weakestMentee(problem, builder, mentor);
        double delta = problem.score(mentor, mentee) - problem.score(mentor, displaced);
        if (previous != Assignment.UNASSIGNED) {
            if (!problem.isEligible(previous, displaced)) {
                return null;
            }
            delta += problem.score(previous, displaced) - problem.score(previous, mentee);
        }
        return new Move(mentor, mentee, displaced, previous, delta);
    }

    /**
     * Lowest-scoring mentee of a mentor; ties go to the lowest priority, then the later mentee.
     */
    private static int weakestMentee(MatchingProblem problem, Assignment.Builder builder, int mentor) {
        IntList held = builder.menteesOf(mentor);
        int weakest = held.getInt(0);
        for (int i = 1; i < held.size(); i++) {
            int candidate = held.getInt(i);
            int byScore = Double.compare(problem.score(mentor, candidate), problem.score(mentor, weakest));
            if (byScore < 0) {
                weakest = candidate;
            } else if (byScore == 0) {
                int byPriority = Double.compare(problem.priority(candidate), problem.priority(weakest));
                if (byPriority < 0 || (byPriority == 0 && candidate > weakest)) {
                    weakest = candidate;
                }
            }
        }
        return weakest;
    }

    private boolean tieBreakAllows(MatchingProblem problem, int newcomer, int displaced) {
        return switch (config.getPriorityTieBreak()) {
            case PRIORITY_WEIGHT -> problem.priority(newcomer) >= problem.priority(displaced);
            case MENTEE_ORDER -> newcomer < displaced;
        };
    }

    private static void apply(Assignment.Builder builder, Move move) {
        if (move.displaced() != Assignment.UNASSIGNED) {
            builder.unassign(move.displaced());
        }
        builder.unassign(move.mentee());
        builder.assign(move.mentee(), move.mentor());
        if (move.displaced() != Assignment.UNASSIGNED && move.previousMentor() != Assignment.UNASSIGNED) {
            builder.assign(move.displaced(), move.previousMentor());
        }
    }

    /**
     * One repair step: {@code mentee} moves to {@code mentor}; {@code displaced} (if any) moves to
     * {@code previousMentor} or becomes unassigned.
     */
    private record Move(int mentor, int mentee, int displaced, int previousMentor, double delta) {
    }
}

package edu.brandeis.cosi103a.dilemma.engine;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.dilemma.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Plays all matches between two strategies under one payoff model.
 *
 * <p>Each call to {@link #run} builds a fresh {@link MatchResult}; nothing is carried
 * between calls. The strategies are reset before every match and must not be used by
 * another run while this one is in progress.
 */
public class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final PayoffModel payoffs;

    public MatchEngine(PayoffModel payoffs) {
        this.payoffs = payoffs;
    }

    public PayoffModel getPayoffs() {
        return payoffs;
    }

    /**
     * Plays {@code matchesPerPair} matches of {@code roundsPerMatch} rounds each.
     *
     * @param a first strategy
     * @param b second strategy
     * @return totals and histories of every match, A's side first
     * @throws ProtocolViolationException if either strategy returns no action
     */
    public MatchResult run(Strategy a, Strategy b) {
        return run(a, a.getName(), b, b.getName());
    }

    /**
     * Same as {@link #run(Strategy, Strategy)}, reporting the strategies under the given
     * names in logs and violations instead of their own.
     */
    public MatchResult run(Strategy a, String nameA, Strategy b, String nameB) {
        log.info("Pair-run starting: {} vs {}", nameA, nameB);

        ImmutableList.Builder<Integer> scoresA = ImmutableList.builder();
        ImmutableList.Builder<Integer> scoresB = ImmutableList.builder();
        ImmutableList.Builder<ImmutableList<Action>> historiesA = ImmutableList.builder();
        ImmutableList.Builder<ImmutableList<Action>> historiesB = ImmutableList.builder();

        for (int matchIndex = 0; matchIndex < payoffs.matchesPerPair(); matchIndex++) {
            a.reset();
            b.reset();

            SingleMatch match = playMatch(matchIndex, a, nameA, b, nameB);
            scoresA.add(match.totalA());
            scoresB.add(match.totalB());
            historiesA.add(match.historyA());
            historiesB.add(match.historyB());

            log.debug("Match {} finished: {}={}, {}={}",
                matchIndex + 1, nameA, match.totalA(), nameB, match.totalB());
        }

        MatchResult result = new MatchResult(scoresA.build(), scoresB.build(),
            historiesA.build(), historiesB.build());
        log.info("Pair-run finished: {} vs {}: {}", nameA, nameB, result);
        return result;
    }

    private SingleMatch playMatch(int matchIndex, Strategy a, String nameA, Strategy b, String nameB) {
        int rounds = payoffs.roundsPerMatch();
        List<Action> historyA = new ArrayList<>(rounds);
        List<Action> historyB = new ArrayList<>(rounds);
        List<Action> viewA = Collections.unmodifiableList(historyA);
        List<Action> viewB = Collections.unmodifiableList(historyB);
        int totalA = 0;
        int totalB = 0;

        for (int round = 0; round < rounds; round++) {
            Action actionA = a.decide(viewA, viewB);
            Action actionB = b.decide(viewB, viewA);

            if (actionA == null) {
                log.error("Invalid action from {} in match {}, round {}", nameA, matchIndex + 1, round + 1);
                throw new ProtocolViolationException(nameA, matchIndex, round);
            }
            if (actionB == null) {
                log.error("Invalid action from {} in match {}, round {}", nameB, matchIndex + 1, round + 1);
                throw new ProtocolViolationException(nameB, matchIndex, round);
            }

            PayoffModel.RoundPayoff payoff = payoffs.score(actionA, actionB);
            historyA.add(actionA);
            historyB.add(actionB);
            totalA += payoff.first();
            totalB += payoff.second();

            if (log.isTraceEnabled()) {
                log.trace("Round {}: A={}, B={}, payoff A={}, B={}",
                    round + 1, actionA, actionB, payoff.first(), payoff.second());
            }
        }

        return new SingleMatch(totalA, totalB, ImmutableList.copyOf(historyA), ImmutableList.copyOf(historyB));
    }

    private record SingleMatch(int totalA, int totalB,
                               ImmutableList<Action> historyA, ImmutableList<Action> historyB) {}
}

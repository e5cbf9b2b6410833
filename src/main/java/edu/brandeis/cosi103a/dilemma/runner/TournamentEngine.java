package edu.brandeis.cosi103a.dilemma.runner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.dilemma.engine.MatchEngine;
import edu.brandeis.cosi103a.dilemma.engine.MatchResult;
import edu.brandeis.cosi103a.dilemma.engine.PayoffModel;
import edu.brandeis.cosi103a.dilemma.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Round-robin tournament: every strategy plays every other once through a
 * {@link MatchEngine}, and is ranked by the mean of its first-quartile match totals.
 *
 * <p>Pair-runs execute one at a time in schedule order. A protocol violation in any
 * pair-run aborts the whole tournament.
 */
public class TournamentEngine {

    private static final Logger log = LoggerFactory.getLogger(TournamentEngine.class);

    private final PayoffModel payoffs;

    public TournamentEngine(PayoffModel payoffs) {
        this.payoffs = payoffs;
    }

    public PayoffModel getPayoffs() {
        return payoffs;
    }

    public TournamentResult run(List<? extends Strategy> roster) {
        return run(roster, ProgressListener.NONE);
    }

    /**
     * Runs the tournament.
     *
     * @param roster   at least two distinct strategy instances
     * @param listener notified after each pair-run
     * @throws RosterException if the roster has fewer than two entries or repeats an instance
     * @throws edu.brandeis.cosi103a.dilemma.engine.ProtocolViolationException if a strategy returns no action
     */
    public TournamentResult run(List<? extends Strategy> roster, ProgressListener listener) {
        validate(roster);

        List<String> originalNames = roster.stream().map(Strategy::getName).toList();
        List<String> names = PairScheduler.dedupeNames(originalNames);
        if (!names.equals(originalNames)) {
            log.info("Renamed duplicate strategies: {}", names);
        }

        List<PairScheduler.Pairing> schedule = PairScheduler.allPairs(roster.size());
        log.info("Tournament starting: {} strategies, {} pair-runs, {}", roster.size(), schedule.size(), payoffs);

        MatchEngine matchEngine = new MatchEngine(payoffs);
        double[] totals = new double[roster.size()];
        ImmutableList.Builder<PairResult> pairs = ImmutableList.builder();
        int completed = 0;

        for (PairScheduler.Pairing pairing : schedule) {
            int i = pairing.first();
            int j = pairing.second();
            MatchResult result = matchEngine.run(roster.get(i), names.get(i), roster.get(j), names.get(j));

            double quartileA = result.firstQuartileA();
            double quartileB = result.firstQuartileB();
            totals[i] += quartileA;
            totals[j] += quartileB;

            PairResult pair = new PairResult(names.get(i), names.get(j), result, quartileA, quartileB);
            pairs.add(pair);
            completed++;
            log.info("{} vs {}: quartile {}={}, {}={} ({}) [{}/{}]",
                pair.nameA(), pair.nameB(), pair.nameA(), quartileA, pair.nameB(), quartileB,
                result.winRecord(), completed, schedule.size());
            listener.pairCompleted(completed, schedule.size(), pair);
        }

        int opponents = roster.size() - 1;
        ImmutableMap.Builder<String, Double> scores = ImmutableMap.builder();
        for (int i = 0; i < roster.size(); i++) {
            scores.put(names.get(i), totals[i] / opponents);
        }
        ImmutableMap<String, Double> scoreMap = scores.build();
        ImmutableList<Standing> standings = rank(names, scoreMap);

        for (Standing standing : standings) {
            log.info("  {}. {}: {}", standing.rank(), standing.name(), String.format("%.2f", standing.score()));
        }

        return new TournamentResult(payoffs, ImmutableList.copyOf(names), pairs.build(), scoreMap, standings);
    }

    /**
     * Orders names by score, highest first; equal scores keep roster order.
     */
    static ImmutableList<Standing> rank(List<String> names, Map<String, Double> scores) {
        List<String> ordered = new ArrayList<>(names);
        // List.sort is stable
        ordered.sort(Comparator.comparingDouble((String name) -> scores.get(name)).reversed());

        ImmutableList.Builder<Standing> standings = ImmutableList.builder();
        for (int i = 0; i < ordered.size(); i++) {
            String name = ordered.get(i);
            standings.add(new Standing(i + 1, name, scores.get(name)));
        }
        return standings.build();
    }

    private static void validate(List<? extends Strategy> roster) {
        if (roster == null || roster.size() < 2) {
            throw new RosterException("A tournament needs at least two strategies, got "
                + (roster == null ? 0 : roster.size()));
        }
        Set<Strategy> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Strategy strategy : roster) {
            if (strategy == null) {
                throw new RosterException("Roster contains a null strategy");
            }
            if (!seen.add(strategy)) {
                throw new RosterException("Strategy instance '" + strategy.getName()
                    + "' appears more than once; each entry needs its own instance");
            }
        }
    }
}

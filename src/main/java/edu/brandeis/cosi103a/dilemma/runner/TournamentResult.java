package edu.brandeis.cosi103a.dilemma.runner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.dilemma.engine.PayoffModel;

import java.util.Optional;

/**
 * Everything a tournament produced.
 *
 * @param payoffs   payoff model every pair-run used
 * @param names     deduplicated strategy names in roster order
 * @param pairs     pair results in schedule order
 * @param scores    final score per strategy name, in roster order
 * @param standings strategies ordered by score, best first
 */
public record TournamentResult(
    PayoffModel payoffs,
    ImmutableList<String> names,
    ImmutableList<PairResult> pairs,
    ImmutableMap<String, Double> scores,
    ImmutableList<Standing> standings
) {

    public Optional<PairResult> findPair(String nameA, String nameB) {
        return pairs.stream()
            .filter(p -> (p.nameA().equals(nameA) && p.nameB().equals(nameB))
                || (p.nameA().equals(nameB) && p.nameB().equals(nameA)))
            .findFirst();
    }

    public Standing winner() {
        return standings.get(0);
    }
}

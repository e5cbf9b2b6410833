package edu.brandeis.cosi103a.dilemma.runner;

import com.google.common.collect.ImmutableList;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the round-robin schedule and the roster's unique names.
 *
 * <p>Every strategy meets every other exactly once and never itself, so every
 * strategy plays the same number of pair-runs.
 */
public final class PairScheduler {

    private PairScheduler() {}

    /**
     * A scheduled meeting between two roster positions, {@code first < second}.
     */
    public record Pairing(int first, int second) {}

    /**
     * All pairs {@code (i, j)} with {@code i < j}, ordered by {@code i} then {@code j}.
     */
    public static List<Pairing> allPairs(int rosterSize) {
        ImmutableList.Builder<Pairing> pairs = ImmutableList.builder();
        for (int i = 0; i < rosterSize; i++) {
            for (int j = i + 1; j < rosterSize; j++) {
                pairs.add(new Pairing(i, j));
            }
        }
        return pairs.build();
    }

    public static int pairCount(int rosterSize) {
        return rosterSize * (rosterSize - 1) / 2;
    }

    /**
     * Makes names unique in roster order. The first occurrence of a name keeps it;
     * later ones get {@code _1}, {@code _2}, ... appended. A suffix already taken by
     * another entry is skipped.
     */
    public static List<String> dedupeNames(List<String> names) {
        Set<String> taken = new HashSet<>(names);
        Set<String> assigned = new HashSet<>();
        Map<String, Integer> repeats = new HashMap<>();
        ImmutableList.Builder<String> unique = ImmutableList.builder();

        for (String name : names) {
            if (assigned.add(name)) {
                unique.add(name);
                continue;
            }
            int k = repeats.getOrDefault(name, 0);
            String candidate;
            do {
                k++;
                candidate = name + "_" + k;
            } while (taken.contains(candidate) || assigned.contains(candidate));
            repeats.put(name, k);
            assigned.add(candidate);
            unique.add(candidate);
        }
        return unique.build();
    }
}

package edu.brandeis.cosi103a.dilemma.viewer;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Represents the current status of a submitted tournament.
 *
 * @param scores  final quartile scores, once completed
 * @param error   failure message, once failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TournamentStatus(
    String id,
    String name,
    State state,
    int completedPairs,
    int totalPairs,
    Map<String, Double> scores,
    String error
) {
    public enum State {
        QUEUED,
        RUNNING,
        COMPLETED,
        FAILED
    }

    public static TournamentStatus queued(String id, String name, int totalPairs) {
        return new TournamentStatus(id, name, State.QUEUED, 0, totalPairs, null, null);
    }

    public static TournamentStatus running(String id, String name, int completedPairs, int totalPairs) {
        return new TournamentStatus(id, name, State.RUNNING, completedPairs, totalPairs, null, null);
    }

    public static TournamentStatus completed(String id, String name, int totalPairs, Map<String, Double> scores) {
        return new TournamentStatus(id, name, State.COMPLETED, totalPairs, totalPairs, scores, null);
    }

    public static TournamentStatus failed(String id, String name, int completedPairs, int totalPairs, String error) {
        return new TournamentStatus(id, name, State.FAILED, completedPairs, totalPairs, null, error);
    }
}

package edu.brandeis.cosi103a.dilemma.viewer;

import edu.brandeis.cosi103a.dilemma.engine.PayoffModel;
import edu.brandeis.cosi103a.dilemma.runner.ResultFileWriter;
import edu.brandeis.cosi103a.dilemma.runner.RosterException;
import edu.brandeis.cosi103a.dilemma.runner.StrategyConfig;
import edu.brandeis.cosi103a.dilemma.runner.TournamentConfig;
import edu.brandeis.cosi103a.dilemma.strategy.StrategyCatalog;
import edu.brandeis.cosi103a.dilemma.viewer.dto.StrategyConfigRequest;
import edu.brandeis.cosi103a.dilemma.viewer.dto.TournamentConfigRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for starting tournaments, polling their progress and reading their results.
 */
@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentService tournamentService;
    private final TournamentExecutionService executionService;

    public TournamentController(
            TournamentService tournamentService,
            TournamentExecutionService executionService) {
        this.tournamentService = tournamentService;
        this.executionService = executionService;
    }

    /**
     * Lists finished tournaments with their leader.
     */
    @GetMapping
    public List<TournamentService.TournamentSummary> listTournaments() throws IOException {
        return tournamentService.listTournaments();
    }

    /**
     * Serves the plain-text results summary for a given tournament.
     */
    @GetMapping(value = "/{name}/results.txt", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getSummary(@PathVariable String name) throws IOException {
        String text = tournamentService.readResultFile(name, ResultFileWriter.SUMMARY_FILE);
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(text);
    }

    /**
     * Serves the ranked standings of a given tournament.
     */
    @GetMapping(value = "/{name}/standings.json", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> getStandings(@PathVariable String name) throws IOException {
        return json(tournamentService.readResultFile(name, ResultFileWriter.STANDINGS_FILE));
    }

    /**
     * Serves the per-pair totals, quartiles and histories of a given tournament.
     */
    @GetMapping(value = "/{name}/pairs.json", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> getPairs(@PathVariable String name) throws IOException {
        return json(tournamentService.readResultFile(name, ResultFileWriter.PAIRS_FILE));
    }

    private static ResponseEntity<String> json(String body) {
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(body);
    }

    /**
     * Starts a new tournament execution.
     * Returns 202 Accepted with tournament ID for tracking progress.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startTournament(
            @Valid @RequestBody TournamentConfigRequest request) {

        TournamentConfig config = toConfig(request);
        String tournamentId = executionService.startTournament(config);

        Map<String, String> response = new HashMap<>();
        response.put("tournamentId", tournamentId);
        response.put("status", "ACCEPTED");
        response.put("message", "Tournament queued for execution");

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    /**
     * Gets the status of a submitted tournament.
     */
    @GetMapping("/{tournamentId}/status")
    public ResponseEntity<TournamentStatus> getTournamentStatus(@PathVariable String tournamentId) {
        return executionService.getTournamentStatus(tournamentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Converts the request to a runner config, applying defaults.
     *
     * @throws IllegalArgumentException if the payoffs are invalid or a strategy is unknown
     */
    static TournamentConfig toConfig(TournamentConfigRequest request) {
        PayoffModel defaults = PayoffModel.defaults();
        PayoffModel payoffs = new PayoffModel(
                orDefault(request.defectWin(), defaults.defectWin()),
                orDefault(request.mutualCooperate(), defaults.mutualCooperate()),
                orDefault(request.mutualDefect(), defaults.mutualDefect()),
                orDefault(request.cooperateLoss(), defaults.cooperateLoss()),
                orDefault(request.rounds(), defaults.roundsPerMatch()),
                orDefault(request.matches(), defaults.matchesPerPair()));

        List<StrategyConfig> strategies = new ArrayList<>();
        if (request.strategies() == null || request.strategies().isEmpty()) {
            for (String name : StrategyCatalog.names()) {
                strategies.add(new StrategyConfig(name, name));
            }
        } else {
            for (StrategyConfigRequest s : request.strategies()) {
                String source = s.source() == null || s.source().isBlank() ? s.name() : s.source();
                StrategyConfig strategy = new StrategyConfig(s.name(), source);
                if (!strategy.isClasspath() && !StrategyCatalog.contains(source)) {
                    throw new RosterException("Unknown strategy: " + source);
                }
                strategies.add(strategy);
            }
        }
        if (strategies.size() < 2) {
            throw new RosterException("At least 2 strategies are required");
        }

        return new TournamentConfig(request.tournamentName(), payoffs, request.seed(), strategies);
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    @ExceptionHandler(TournamentNotFoundException.class)
    public ResponseEntity<String> handleNotFound(TournamentNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }
}

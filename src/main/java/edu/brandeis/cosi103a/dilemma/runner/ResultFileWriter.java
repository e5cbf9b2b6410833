package edu.brandeis.cosi103a.dilemma.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import edu.brandeis.cosi103a.dilemma.engine.MatchResult;
import edu.brandeis.cosi103a.dilemma.engine.PayoffModel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes tournament metadata, pair results, standings and the text summary to disk.
 * Every file is written atomically to prevent partial writes.
 */
public class ResultFileWriter {

    public static final String TOURNAMENT_FILE = "tournament.json";
    public static final String PAIRS_FILE = "pairs.json";
    public static final String STANDINGS_FILE = "standings.json";
    public static final String SUMMARY_FILE = "results.txt";

    static final String SUMMARY_TITLE = "Iterated Dilemma Tournament Results";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public ResultFileWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Writes every result file for a finished tournament.
     */
    public void writeAll(TournamentConfig config, TournamentResult result, LocalDateTime finishedAt)
            throws IOException {
        writeTournamentMetadata(config, result, finishedAt);
        writePairs(result);
        writeStandings(result);
        writeSummary(result, finishedAt);
    }

    /**
     * Writes the tournament.json metadata file.
     */
    public void writeTournamentMetadata(TournamentConfig config, TournamentResult result,
                                        LocalDateTime finishedAt) throws IOException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", config.name());
        metadata.put("createdAt", TIME_FORMAT.format(finishedAt));
        metadata.put("payoffs", result.payoffs());
        metadata.put("seed", config.seed());
        metadata.put("roster", config.strategies());
        metadata.put("strategies", result.names());
        writeJson(TOURNAMENT_FILE, metadata);
    }

    /**
     * Writes pairs.json: one entry per pair-run with totals, quartiles and histories.
     */
    public void writePairs(TournamentResult result) throws IOException {
        List<Map<String, Object>> pairs = new ArrayList<>();
        for (PairResult pair : result.pairs()) {
            MatchResult matches = pair.result();
            MatchResult.WinRecord wins = matches.winRecord();

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("nameA", pair.nameA());
            entry.put("nameB", pair.nameB());
            entry.put("quartileA", pair.quartileA());
            entry.put("quartileB", pair.quartileB());
            entry.put("scoresA", matches.scoresA());
            entry.put("scoresB", matches.scoresB());
            entry.put("winsA", wins.winsA());
            entry.put("winsB", wins.winsB());
            entry.put("draws", wins.draws());
            entry.put("historiesA", matches.historiesA().stream().map(MatchResult::encode).toList());
            entry.put("historiesB", matches.historiesB().stream().map(MatchResult::encode).toList());
            pairs.add(entry);
        }
        writeJson(PAIRS_FILE, pairs);
    }

    /**
     * Writes standings.json.
     */
    public void writeStandings(TournamentResult result) throws IOException {
        writeJson(STANDINGS_FILE, result.standings());
    }

    /**
     * Writes the human-readable results.txt.
     */
    public void writeSummary(TournamentResult result, LocalDateTime finishedAt) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(SUMMARY_FILE);
        Path temp = outputDir.resolve(SUMMARY_FILE + ".tmp");
        Files.writeString(temp, formatSummary(result, finishedAt), StandardCharsets.UTF_8);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Renders the plain-text summary: title, time, payoff parameters, sizing, and one
     * {@code rank. name: score} line per strategy.
     */
    public static String formatSummary(TournamentResult result, LocalDateTime finishedAt) {
        PayoffModel payoffs = result.payoffs();
        StringBuilder sb = new StringBuilder();
        sb.append(SUMMARY_TITLE).append('\n');
        sb.append("Time: ").append(TIME_FORMAT.format(finishedAt)).append('\n');
        sb.append(String.format(Locale.ROOT,
            "Parameters: defectWin=%d, mutualCooperate=%d, mutualDefect=%d, cooperateLoss=%d\n",
            payoffs.defectWin(), payoffs.mutualCooperate(), payoffs.mutualDefect(), payoffs.cooperateLoss()));
        sb.append(String.format(Locale.ROOT, "Rounds per match: %d, Matches per pair: %d\n\n",
            payoffs.roundsPerMatch(), payoffs.matchesPerPair()));
        sb.append("Final standings:\n");
        for (Standing standing : result.standings()) {
            sb.append(String.format(Locale.ROOT, "%d. %s: %.2f\n", standing.rank(), standing.name(), standing.score()));
        }
        return sb.toString();
    }

    private void writeJson(String filename, Object value) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(filename);
        Path temp = outputDir.resolve(filename + ".tmp");
        objectMapper.writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}

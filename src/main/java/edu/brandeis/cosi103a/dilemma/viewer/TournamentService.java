package edu.brandeis.cosi103a.dilemma.viewer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.dilemma.runner.ResultFileWriter;
import edu.brandeis.cosi103a.dilemma.runner.Standing;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Read-only access to the result files of finished tournaments under the data directory.
 * Each tournament lives in its own subdirectory, as laid out by {@link ResultFileWriter}.
 */
@Service
public class TournamentService {

    /** Files a client may fetch from a tournament directory. */
    static final Set<String> SERVED_FILES = Set.of(
        ResultFileWriter.SUMMARY_FILE, ResultFileWriter.STANDINGS_FILE, ResultFileWriter.PAIRS_FILE);

    private static final TypeReference<List<Standing>> STANDINGS_TYPE = new TypeReference<>() {};

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public TournamentService(
            @Value("${tournament.data-dir:./data}") String dataDir,
            ObjectMapper objectMapper) {
        this.dataDir = Path.of(dataDir);
        this.objectMapper = objectMapper;
    }

    /**
     * Summarizes every finished tournament, i.e. every subdirectory holding a standings file,
     * ordered by directory name.
     */
    public List<TournamentSummary> listTournaments() throws IOException {
        List<TournamentSummary> finished = new ArrayList<>();
        if (!Files.isDirectory(dataDir)) {
            return finished;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(dataDir, Files::isDirectory)) {
            for (Path dir : dirs) {
                Path standingsFile = dir.resolve(ResultFileWriter.STANDINGS_FILE);
                if (Files.isRegularFile(standingsFile)) {
                    List<Standing> standings = objectMapper.readValue(standingsFile.toFile(), STANDINGS_TYPE);
                    finished.add(TournamentSummary.of(dir.getFileName().toString(), standings));
                }
            }
        }
        finished.sort(Comparator.comparing(TournamentSummary::name));
        return finished;
    }

    /**
     * Returns the content of one result file of a finished tournament.
     *
     * @throws TournamentNotFoundException if the name is not a plain directory name, the file is
     *         not one of {@link #SERVED_FILES}, or the file does not exist
     */
    public String readResultFile(String name, String fileName) throws IOException {
        if (name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new TournamentNotFoundException("Invalid tournament name: " + name);
        }
        if (!SERVED_FILES.contains(fileName)) {
            throw new TournamentNotFoundException("Not a result file: " + fileName);
        }
        Path file = dataDir.resolve(name).resolve(fileName);
        if (!Files.isRegularFile(file)) {
            throw new TournamentNotFoundException("No " + fileName + " for tournament: " + name);
        }
        return Files.readString(file);
    }

    /**
     * One line of the tournament listing.
     *
     * @param leader      top-ranked strategy, null if the standings are empty
     * @param leaderScore its score, 0 if the standings are empty
     */
    public record TournamentSummary(String name, int strategyCount, String leader, double leaderScore) {

        static TournamentSummary of(String name, List<Standing> standings) {
            if (standings.isEmpty()) {
                return new TournamentSummary(name, 0, null, 0.0);
            }
            Standing first = standings.get(0);
            return new TournamentSummary(name, standings.size(), first.name(), first.score());
        }
    }
}

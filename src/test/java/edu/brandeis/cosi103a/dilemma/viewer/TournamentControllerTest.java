package edu.brandeis.cosi103a.dilemma.viewer;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.dilemma.engine.InvalidConfigurationException;
import edu.brandeis.cosi103a.dilemma.engine.PayoffModel;
import edu.brandeis.cosi103a.dilemma.runner.ResultFileWriter;
import edu.brandeis.cosi103a.dilemma.runner.RosterException;
import edu.brandeis.cosi103a.dilemma.runner.StrategyConfig;
import edu.brandeis.cosi103a.dilemma.runner.TournamentConfig;
import edu.brandeis.cosi103a.dilemma.strategy.StrategyCatalog;
import edu.brandeis.cosi103a.dilemma.viewer.dto.StrategyConfigRequest;
import edu.brandeis.cosi103a.dilemma.viewer.dto.TournamentConfigRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TournamentController and TournamentService.
 */
class TournamentControllerTest {

    @TempDir
    Path tempDir;

    private TournamentController controller;
    private TournamentService service;
    private TournamentExecutionService executionService;

    @BeforeEach
    void setUp() {
        service = new TournamentService(tempDir.toString(), new ObjectMapper());
        executionService = new TournamentExecutionService(tempDir.toString(), null);
        controller = new TournamentController(service, executionService);
    }

    @AfterEach
    void tearDown() {
        executionService.shutdown();
    }

    @Test
    void listTournaments_emptyDir() throws Exception {
        assertTrue(controller.listTournaments().isEmpty());
    }

    @Test
    void listTournaments_summarizesFinishedTournaments() throws Exception {
        Path t = Files.createDirectory(tempDir.resolve("spring-2026"));
        Files.writeString(t.resolve(ResultFileWriter.STANDINGS_FILE),
            "[{\"rank\":1,\"name\":\"AlwaysDefect\",\"score\":32.0},"
                + "{\"rank\":2,\"name\":\"TitForTat\",\"score\":19.5}]");

        List<TournamentService.TournamentSummary> result = controller.listTournaments();
        assertEquals(1, result.size());
        assertEquals("spring-2026", result.get(0).name());
        assertEquals(2, result.get(0).strategyCount());
        assertEquals("AlwaysDefect", result.get(0).leader());
        assertEquals(32.0, result.get(0).leaderScore(), 1e-9);
    }

    @Test
    void listTournaments_skipsUnfinishedAndSorts() throws Exception {
        for (String name : List.of("zeta", "alpha")) {
            Path t = Files.createDirectory(tempDir.resolve(name));
            Files.writeString(t.resolve(ResultFileWriter.STANDINGS_FILE), "[]");
        }
        Files.createDirectory(tempDir.resolve("running"));
        Files.writeString(tempDir.resolve("readme.txt"), "hello");

        List<TournamentService.TournamentSummary> result = controller.listTournaments();
        assertEquals(List.of("alpha", "zeta"), result.stream().map(TournamentService.TournamentSummary::name).toList());
        assertEquals(0, result.get(0).strategyCount());
        assertNull(result.get(0).leader());
    }

    @Test
    void resultFiles_returnContent() throws Exception {
        Path t = Files.createDirectory(tempDir.resolve("test"));
        Files.writeString(t.resolve(ResultFileWriter.SUMMARY_FILE), "Iterated Dilemma Tournament Results\n");
        Files.writeString(t.resolve(ResultFileWriter.STANDINGS_FILE), "[]");
        Files.writeString(t.resolve(ResultFileWriter.PAIRS_FILE), "[{\"nameA\":\"A\"}]");

        ResponseEntity<String> summary = controller.getSummary("test");
        assertEquals(200, summary.getStatusCode().value());
        assertEquals("Iterated Dilemma Tournament Results\n", summary.getBody());
        assertEquals("[]", controller.getStandings("test").getBody());
        assertEquals("[{\"nameA\":\"A\"}]", controller.getPairs("test").getBody());
    }

    @Test
    void resultFiles_notFound() {
        assertThrows(TournamentNotFoundException.class, () -> controller.getSummary("nonexistent"));
        assertThrows(TournamentNotFoundException.class, () -> controller.getStandings("nonexistent"));
        assertThrows(TournamentNotFoundException.class, () -> controller.getPairs("nonexistent"));
    }

    @Test
    void resultFiles_rejectPathTraversal() {
        assertThrows(TournamentNotFoundException.class, () -> controller.getSummary("../../etc"));
        assertThrows(TournamentNotFoundException.class, () -> controller.getStandings("foo/bar"));
        assertThrows(TournamentNotFoundException.class, () -> controller.getPairs("foo\\bar"));
    }

    @Test
    void onlyResultFilesAreServed() throws Exception {
        Path t = Files.createDirectory(tempDir.resolve("test"));
        Files.writeString(t.resolve(ResultFileWriter.TOURNAMENT_FILE), "{}");

        assertThrows(TournamentNotFoundException.class,
            () -> service.readResultFile("test", ResultFileWriter.TOURNAMENT_FILE));
    }

    @Test
    void toConfig_appliesDefaults() {
        TournamentConfig config = TournamentController.toConfig(request("defaults", null, null, null));

        assertEquals("defaults", config.name());
        assertEquals(PayoffModel.defaults(), config.payoffs());
        assertNull(config.seed());
        assertEquals(StrategyCatalog.names().size(), config.strategies().size());
    }

    @Test
    void toConfig_sourceDefaultsToName() {
        TournamentConfig config = TournamentController.toConfig(request("named", 20, 2, List.of(
            new StrategyConfigRequest("TitForTat", null),
            new StrategyConfigRequest("Nice", "AlwaysCooperate"))));

        assertEquals(List.of(new StrategyConfig("TitForTat", "TitForTat"), new StrategyConfig("Nice", "AlwaysCooperate")),
            config.strategies());
        assertEquals(20, config.payoffs().roundsPerMatch());
        assertEquals(2, config.payoffs().matchesPerPair());
    }

    @Test
    void toConfig_rejectsUnknownStrategy() {
        assertThrows(RosterException.class, () -> TournamentController.toConfig(request("bad", null, null, List.of(
            new StrategyConfigRequest("TitForTat", null),
            new StrategyConfigRequest("Mystery", "NoSuchStrategy")))));
    }

    @Test
    void toConfig_rejectsSingleStrategy() {
        assertThrows(RosterException.class, () -> TournamentController.toConfig(request("solo", null, null, List.of(
            new StrategyConfigRequest("TitForTat", null)))));
    }

    @Test
    void toConfig_rejectsInvalidPayoffs() {
        TournamentConfigRequest request = new TournamentConfigRequest("bad", 3, 3, 1, 0, null, null, null, null);

        assertThrows(InvalidConfigurationException.class, () -> TournamentController.toConfig(request));
    }

    @Test
    void startTournament_returnsAcceptedAndTracksStatus() {
        ResponseEntity<Map<String, String>> response = controller.startTournament(request("api", 10, 2, List.of(
            new StrategyConfigRequest("TitForTat", null),
            new StrategyConfigRequest("Grudge", null))));

        assertEquals(202, response.getStatusCode().value());
        String id = response.getBody().get("tournamentId");
        assertNotNull(id);

        ResponseEntity<TournamentStatus> status = controller.getTournamentStatus(id);
        assertEquals(200, status.getStatusCode().value());
        assertEquals(id, status.getBody().id());
        assertEquals(1, status.getBody().totalPairs());
    }

    @Test
    void getTournamentStatus_unknownIdIsNotFound() {
        assertEquals(404, controller.getTournamentStatus("no-such-id").getStatusCode().value());
    }

    @Test
    void badRequestHandlerReportsMessage() {
        ResponseEntity<Map<String, String>> response =
            controller.handleBadRequest(new RosterException("Unknown strategy: X"));

        assertEquals(400, response.getStatusCode().value());
        assertEquals("Unknown strategy: X", response.getBody().get("error"));
    }

    private static TournamentConfigRequest request(String name, Integer rounds, Integer matches,
                                                   List<StrategyConfigRequest> strategies) {
        return new TournamentConfigRequest(name, null, null, null, null, rounds, matches, null, strategies);
    }
}

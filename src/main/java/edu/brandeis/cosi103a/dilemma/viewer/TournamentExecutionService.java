package edu.brandeis.cosi103a.dilemma.viewer;

import edu.brandeis.cosi103a.dilemma.runner.PairScheduler;
import edu.brandeis.cosi103a.dilemma.runner.ResultFileWriter;
import edu.brandeis.cosi103a.dilemma.runner.StrategyDiscoveryService;
import edu.brandeis.cosi103a.dilemma.runner.StrategyFactory;
import edu.brandeis.cosi103a.dilemma.runner.TournamentConfig;
import edu.brandeis.cosi103a.dilemma.runner.TournamentEngine;
import edu.brandeis.cosi103a.dilemma.runner.TournamentResult;
import edu.brandeis.cosi103a.dilemma.strategy.RandomSource;
import edu.brandeis.cosi103a.dilemma.strategy.Strategy;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Service for executing tournaments asynchronously without blocking the API.
 *
 * <p>Tournaments run one at a time on a single worker thread, in submission order.
 * Each builds its own strategy instances, so no strategy state is shared between runs.
 */
@Service
public class TournamentExecutionService {

    private static final Logger log = LoggerFactory.getLogger(TournamentExecutionService.class);

    private final Map<String, TournamentStatus> tournaments = new ConcurrentHashMap<>();
    private final ExecutorService executorService;
    private final Path dataDir;
    private final StrategyDiscoveryService discoveryService;

    /**
     * Progress listener callback interface for tournament execution.
     */
    public interface StatusListener {
        void onProgress(TournamentStatus status);
    }

    public TournamentExecutionService(
            @Value("${tournament.data-dir:./data}") String dataDir,
            StrategyDiscoveryService discoveryService) {
        this.dataDir = Path.of(dataDir);
        this.discoveryService = discoveryService;
        this.executorService = Executors.newSingleThreadExecutor();
    }

    public String startTournament(TournamentConfig config) {
        return startTournament(config, null);
    }

    /**
     * Queues a tournament and returns a unique tournament ID.
     *
     * @param config         the tournament configuration
     * @param statusListener optional callback for status updates
     * @return unique tournament ID
     */
    public String startTournament(TournamentConfig config, StatusListener statusListener) {
        String tournamentId = UUID.randomUUID().toString();
        int totalPairs = PairScheduler.pairCount(config.strategies().size());

        update(TournamentStatus.queued(tournamentId, config.name(), totalPairs), statusListener);
        executorService.submit(() -> executeTournament(tournamentId, config, statusListener));

        return tournamentId;
    }

    /**
     * Gets the current status of a tournament.
     *
     * @param tournamentId the tournament ID
     * @return the tournament status, or empty if not found
     */
    public Optional<TournamentStatus> getTournamentStatus(String tournamentId) {
        return Optional.ofNullable(tournaments.get(tournamentId));
    }

    /**
     * @return map of tournament IDs to their current status
     */
    public Map<String, TournamentStatus> getAllTournaments() {
        return new HashMap<>(tournaments);
    }

    private void executeTournament(String tournamentId, TournamentConfig config, StatusListener statusListener) {
        Path outputDir = dataDir.resolve(config.name());
        int totalPairs = PairScheduler.pairCount(config.strategies().size());
        int[] completedPairs = {0};

        try {
            RandomSource random = config.seed() == null ? RandomSource.create() : RandomSource.seeded(config.seed());
            List<Strategy> roster = createStrategyFactory().createRoster(config.strategies(), random);

            update(TournamentStatus.running(tournamentId, config.name(), 0, totalPairs), statusListener);

            TournamentEngine engine = new TournamentEngine(config.payoffs());
            TournamentResult result = engine.run(roster, (completed, total, pair) -> {
                completedPairs[0] = completed;
                update(TournamentStatus.running(tournamentId, config.name(), completed, total), statusListener);
            });

            new ResultFileWriter(outputDir).writeAll(config, result, LocalDateTime.now());

            update(TournamentStatus.completed(tournamentId, config.name(), totalPairs,
                new LinkedHashMap<>(result.scores())), statusListener);
            log.info("Tournament {} ({}) completed", tournamentId, config.name());

        } catch (Exception e) {
            log.error("Tournament {} failed", tournamentId, e);
            update(TournamentStatus.failed(tournamentId, config.name(), completedPairs[0], totalPairs,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()), statusListener);
        }
    }

    private void update(TournamentStatus status, StatusListener statusListener) {
        tournaments.put(status.id(), status);
        if (statusListener != null) {
            statusListener.onProgress(status);
        }
    }

    /**
     * Creates the factory that builds each tournament's roster.
     * Can be overridden in tests to inject custom strategies.
     */
    protected StrategyFactory createStrategyFactory() {
        return new StrategyFactory(discoveryService);
    }

    /**
     * Shuts down the executor service. Call this when the application is shutting down.
     */
    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

package edu.brandeis.cosi103a.dilemma.runner;

import edu.brandeis.cosi103a.dilemma.engine.MatchEngine;
import edu.brandeis.cosi103a.dilemma.engine.MatchResult;
import edu.brandeis.cosi103a.dilemma.engine.PayoffModel;
import edu.brandeis.cosi103a.dilemma.strategy.RandomSource;
import edu.brandeis.cosi103a.dilemma.strategy.Strategy;
import edu.brandeis.cosi103a.dilemma.strategy.StrategyCatalog;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Main entry point for the tournament runner CLI.
 *
 * <p>Invocation:
 * <pre>
 * java -jar dilemma-tournament-runner.jar \
 *   --name spring-2026 --rounds 200 --matches 10 \
 *   --output ./data \
 *   --strategy TitForTat \
 *   --strategy Nice=AlwaysCooperate \
 *   --strategy Mine=classpath:com.example.MyStrategy
 * </pre>
 *
 * <p>Single pair-run:
 * <pre>
 * java -jar dilemma-tournament-runner.jar --mode match \
 *   --strategy-a Grudge --strategy-b Random --seed 42
 * </pre>
 */
public class TournamentRunner {

    enum Mode { TOURNAMENT, MATCH }

    /**
     * Everything parsed from the command line.
     */
    record RunnerOptions(
        Mode mode,
        TournamentConfig config,
        Path outputDir,
        StrategyConfig strategyA,
        StrategyConfig strategyB
    ) {}

    public static void main(String[] args) {
        if (List.of(args).contains("--list-strategies")) {
            listStrategies();
            System.exit(0);
        }

        RunnerOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println();
            printUsage();
            System.exit(1);
            return;
        }

        try {
            StrategyDiscoveryService discoveryService = new StrategyDiscoveryService();
            discoveryService.initialize();

            if (options.mode() == Mode.MATCH) {
                runMatch(options.config(), options.strategyA(), options.strategyB(), discoveryService);
            } else {
                runTournament(options.config(), options.outputDir(), discoveryService);
            }
        } catch (Exception e) {
            System.err.println("Tournament failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Lists built-in strategies and any others discovered on the classpath.
     */
    private static void listStrategies() {
        System.out.println("Built-in strategies:");
        System.out.println();
        for (Strategy strategy : StrategyCatalog.defaultRoster(RandomSource.create())) {
            System.out.printf("  %-30s %s%n", strategy.getName(), StrategyCatalog.describe(strategy.getClass()));
        }

        StrategyDiscoveryService discoveryService = new StrategyDiscoveryService();
        discoveryService.initialize();
        List<DiscoveredStrategy> external = discoveryService.getDiscoveredStrategies().stream()
            .filter(s -> !s.className().startsWith(Strategy.class.getPackageName() + "."))
            .toList();
        if (!external.isEmpty()) {
            System.out.println();
            System.out.println("Discovered on classpath:");
            System.out.println();
            for (DiscoveredStrategy s : external) {
                String desc = s.description().isEmpty() ? "" : " - " + s.description();
                System.out.printf("  %-30s %s%s%n", s.displayName(), s.className(), desc);
            }
        }
        System.out.println();
        System.out.println("Use 'Alias=classpath:<class-name>' in --strategy arguments for classpath strategies.");
    }

    static TournamentResult runTournament(TournamentConfig config, Path outputDir,
                                          StrategyDiscoveryService discoveryService) throws IOException {
        RandomSource random = randomSource(config.seed());
        List<Strategy> roster = new StrategyFactory(discoveryService).createRoster(config.strategies(), random);

        System.out.printf("Starting tournament '%s': %d strategies, %d pair-runs%n",
            config.name(), roster.size(), PairScheduler.pairCount(roster.size()));

        TournamentEngine engine = new TournamentEngine(config.payoffs());
        TournamentResult result = engine.run(roster, (completed, total, pair) ->
            System.out.printf("Pair %d/%d complete: %s vs %s (%.2f / %.2f)%n",
                completed, total, pair.nameA(), pair.nameB(), pair.quartileA(), pair.quartileB()));

        ResultFileWriter writer = new ResultFileWriter(outputDir);
        writer.writeAll(config, result, LocalDateTime.now());

        System.out.println();
        System.out.println("Final standings:");
        for (Standing standing : result.standings()) {
            System.out.printf(Locale.ROOT, "%d. %s: %.2f%n", standing.rank(), standing.name(), standing.score());
        }
        System.out.printf("Tournament complete! Results written to %s%n", outputDir);
        return result;
    }

    static MatchResult runMatch(TournamentConfig config, StrategyConfig strategyA, StrategyConfig strategyB,
                                StrategyDiscoveryService discoveryService) {
        RandomSource random = randomSource(config.seed());
        StrategyFactory factory = new StrategyFactory(discoveryService);
        Strategy a = factory.createStrategy(strategyA, random);
        Strategy b = factory.createStrategy(strategyB, random);

        System.out.printf("Match: %s vs %s%n", a.getName(), b.getName());
        System.out.println(config.payoffs());

        MatchResult result = new MatchEngine(config.payoffs()).run(a, b);

        System.out.printf(Locale.ROOT, "%s: scores=%s avg=%.2f min=%d median=%d%n",
            a.getName(), result.scoresA(), result.averageScoreA(), result.minScoreA(), result.medianScoreA());
        System.out.printf(Locale.ROOT, "%s: scores=%s avg=%.2f min=%d median=%d%n",
            b.getName(), result.scoresB(), result.averageScoreB(), result.minScoreB(), result.medianScoreB());
        MatchResult.WinRecord wins = result.winRecord();
        System.out.printf("%s wins %d, %s wins %d, draws %d%n",
            a.getName(), wins.winsA(), b.getName(), wins.winsB(), wins.draws());
        return result;
    }

    private static RandomSource randomSource(Long seed) {
        return seed == null ? RandomSource.create() : RandomSource.seeded(seed);
    }

    /**
     * Parses CLI arguments.
     *
     * @throws IllegalArgumentException if an argument is unknown, malformed or inconsistent
     */
    static RunnerOptions parseArgs(String[] args) {
        Mode mode = Mode.TOURNAMENT;
        String name = "tournament";
        Path output = Path.of("./data");
        PayoffModel defaults = PayoffModel.defaults();
        int defectWin = defaults.defectWin();
        int mutualCooperate = defaults.mutualCooperate();
        int mutualDefect = defaults.mutualDefect();
        int cooperateLoss = defaults.cooperateLoss();
        int rounds = defaults.roundsPerMatch();
        int matches = defaults.matchesPerPair();
        Long seed = null;
        List<StrategyConfig> strategies = new ArrayList<>();
        StrategyConfig strategyA = StrategyConfig.parse("TitForTat");
        StrategyConfig strategyB = StrategyConfig.parse("Random");

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--mode" -> mode = parseMode(value(args, ++i, arg));
                case "--name" -> name = value(args, ++i, arg);
                case "--output" -> output = Path.of(value(args, ++i, arg));
                case "--defect-win" -> defectWin = intValue(args, ++i, arg);
                case "--mutual-cooperate" -> mutualCooperate = intValue(args, ++i, arg);
                case "--mutual-defect" -> mutualDefect = intValue(args, ++i, arg);
                case "--cooperate-loss" -> cooperateLoss = intValue(args, ++i, arg);
                case "--rounds" -> rounds = intValue(args, ++i, arg);
                case "--matches" -> matches = intValue(args, ++i, arg);
                case "--seed" -> seed = Long.parseLong(value(args, ++i, arg));
                case "--strategy" -> strategies.add(StrategyConfig.parse(value(args, ++i, arg)));
                case "--strategy-a" -> strategyA = StrategyConfig.parse(value(args, ++i, arg));
                case "--strategy-b" -> strategyB = StrategyConfig.parse(value(args, ++i, arg));
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }

        PayoffModel payoffs = new PayoffModel(defectWin, mutualCooperate, mutualDefect, cooperateLoss, rounds, matches);

        if (strategies.isEmpty()) {
            for (String catalogName : StrategyCatalog.names()) {
                strategies.add(new StrategyConfig(catalogName, catalogName));
            }
        }
        if (mode == Mode.TOURNAMENT && strategies.size() < 2) {
            throw new RosterException("Need at least 2 strategies for a tournament");
        }

        Path outputDir = Path.of(name).isAbsolute() ? Path.of(name) : output.resolve(name);
        return new RunnerOptions(mode, new TournamentConfig(name, payoffs, seed, strategies),
            outputDir, strategyA, strategyB);
    }

    private static Mode parseMode(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "tournament" -> Mode.TOURNAMENT;
            case "match", "individual" -> Mode.MATCH;
            default -> throw new IllegalArgumentException("Unknown mode: " + value + " (expected tournament or match)");
        };
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    private static int intValue(String[] args, int index, String flag) {
        String raw = value(args, index, flag);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects an integer, got '" + raw + "'");
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar dilemma-tournament-runner.jar [options]");
        System.err.println("       java -jar dilemma-tournament-runner.jar --list-strategies");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --mode <tournament|match>  Run a full tournament or a single pair (default: tournament)");
        System.err.println("  --name <name>              Tournament name (default: tournament)");
        System.err.println("  --output <dir>             Output directory (default: ./data)");
        System.err.println("  --defect-win <n>           Score for defecting against a cooperator (default: 5)");
        System.err.println("  --mutual-cooperate <n>     Score for mutual cooperation (default: 3)");
        System.err.println("  --mutual-defect <n>        Score for mutual defection (default: 1)");
        System.err.println("  --cooperate-loss <n>       Score for cooperating against a defector (default: 0)");
        System.err.println("  --rounds <n>               Rounds per match (default: 500)");
        System.err.println("  --matches <n>              Matches per pair (default: 30)");
        System.err.println("  --seed <n>                 Seed for the shared random source");
        System.err.println("  --strategy <spec>          Add a strategy (default: every built-in strategy)");
        System.err.println("  --strategy-a <spec>        First strategy in match mode (default: TitForTat)");
        System.err.println("  --strategy-b <spec>        Second strategy in match mode (default: Random)");
        System.err.println("  --list-strategies          List available strategies and exit");
        System.err.println();
        System.err.println("Strategy specs:");
        System.err.println("  <Name>                           Built-in strategy, e.g. TitForTat");
        System.err.println("  <Alias>=<Name>                   Built-in strategy under another name");
        System.err.println("  <Alias>=classpath:<class-name>   Strategy by class name (e.g., classpath:com.example.MyStrategy)");
        System.err.println();
        System.err.println("Payoffs must satisfy defect-win > mutual-cooperate > mutual-defect >= cooperate-loss.");
    }
}

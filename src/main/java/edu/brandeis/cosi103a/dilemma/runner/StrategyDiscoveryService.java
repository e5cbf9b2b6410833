package edu.brandeis.cosi103a.dilemma.runner;

import edu.brandeis.cosi103a.dilemma.strategy.RandomSource;
import edu.brandeis.cosi103a.dilemma.strategy.Strategy;
import edu.brandeis.cosi103a.dilemma.strategy.StrategyDescription;
import io.github.classgraph.ClassGraph;
import io.github.classgraph.ClassInfo;
import io.github.classgraph.ScanResult;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for discovering Strategy implementations on the classpath.
 * Scans for concrete classes implementing {@link Strategy} and caches their
 * metadata for fast lookup.
 */
@Service
public class StrategyDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(StrategyDiscoveryService.class);

    private final Map<String, DiscoveredStrategy> strategiesByClassName = new ConcurrentHashMap<>();
    private volatile List<DiscoveredStrategy> cachedStrategies = List.of();

    /**
     * Performs initial classpath scan on startup.
     */
    @PostConstruct
    public void initialize() {
        scanClasspath();
    }

    /**
     * Scans the application classpath for Strategy implementations.
     */
    public synchronized void scanClasspath() {
        List<RawStrategyInfo> rawStrategies = new ArrayList<>();

        try (ScanResult result = new ClassGraph()
                .enableClassInfo()
                .enableAnnotationInfo()
                .scan()) {

            for (ClassInfo classInfo : result.getClassesImplementing(Strategy.class.getName())) {
                if (classInfo.isInterface() || classInfo.isAbstract()) {
                    continue;
                }

                String className = classInfo.getName();
                try {
                    Class<?> strategyClass = Class.forName(className);
                    RawStrategyInfo info = analyzeStrategyClass(strategyClass);
                    if (info.isInstantiable()) {
                        rawStrategies.add(info);
                    }
                } catch (Exception | LinkageError e) {
                    // Classes with missing dependencies are skipped
                    log.warn("Could not analyze Strategy class {}: {}", className, e.getMessage());
                }
            }
        }

        Map<String, Integer> simpleNameCounts = new HashMap<>();
        for (RawStrategyInfo info : rawStrategies) {
            simpleNameCounts.merge(info.simpleName, 1, Integer::sum);
        }

        strategiesByClassName.clear();
        for (RawStrategyInfo info : rawStrategies) {
            boolean hasDuplicate = simpleNameCounts.get(info.simpleName) > 1;
            String displayName = hasDuplicate ? info.className : info.simpleName;

            DiscoveredStrategy strategy = new DiscoveredStrategy(
                info.simpleName,
                info.className,
                displayName,
                info.description,
                info.hasZeroArg,
                info.hasName,
                info.hasRandom,
                info.hasNameRandom
            );
            strategiesByClassName.put(info.className, strategy);
        }

        List<DiscoveredStrategy> all = new ArrayList<>(strategiesByClassName.values());
        all.sort(Comparator.comparing(DiscoveredStrategy::displayName));
        cachedStrategies = List.copyOf(all);
        log.debug("Discovered {} strategies on the classpath", cachedStrategies.size());
    }

    /**
     * Intermediate holder for strategy info before display name resolution.
     */
    private record RawStrategyInfo(
        String simpleName,
        String className,
        String description,
        boolean hasZeroArg,
        boolean hasName,
        boolean hasRandom,
        boolean hasNameRandom
    ) {
        boolean isInstantiable() {
            return hasZeroArg || hasName || hasRandom || hasNameRandom;
        }
    }

    private RawStrategyInfo analyzeStrategyClass(Class<?> strategyClass) {
        String description = "";
        StrategyDescription annotation = strategyClass.getAnnotation(StrategyDescription.class);
        if (annotation != null) {
            description = annotation.value();
        }

        boolean hasZeroArg = false;
        boolean hasName = false;
        boolean hasRandom = false;
        boolean hasNameRandom = false;

        for (Constructor<?> ctor : strategyClass.getConstructors()) {
            Class<?>[] params = ctor.getParameterTypes();
            if (params.length == 0) {
                hasZeroArg = true;
            } else if (params.length == 1 && params[0] == String.class) {
                hasName = true;
            } else if (params.length == 1 && params[0] == RandomSource.class) {
                hasRandom = true;
            } else if (params.length == 2 && params[0] == String.class && params[1] == RandomSource.class) {
                hasNameRandom = true;
            }
        }

        return new RawStrategyInfo(strategyClass.getSimpleName(), strategyClass.getName(), description,
            hasZeroArg, hasName, hasRandom, hasNameRandom);
    }

    /**
     * Returns all discovered strategies, sorted alphabetically by display name.
     */
    public List<DiscoveredStrategy> getDiscoveredStrategies() {
        return cachedStrategies;
    }

    /**
     * Finds a discovered strategy by class name.
     *
     * @param className the fully-qualified class name
     * @return the discovered strategy, or empty if not found
     */
    public Optional<DiscoveredStrategy> findByClassName(String className) {
        return Optional.ofNullable(strategiesByClassName.get(className));
    }

    /**
     * Creates a Strategy instance from a discovered strategy.
     * Prefers constructors that take the name, then those that take the random source.
     *
     * @param discovered the discovered strategy metadata
     * @param name       the name to give the strategy, where its constructors allow one
     * @param random     the run's shared random source
     * @return a new Strategy instance
     * @throws ReflectiveOperationException if instantiation fails
     */
    public Strategy createStrategy(DiscoveredStrategy discovered, String name, RandomSource random)
            throws ReflectiveOperationException {
        Class<?> strategyClass = Class.forName(discovered.className());

        if (discovered.hasNameRandomConstructor()) {
            return (Strategy) strategyClass.getConstructor(String.class, RandomSource.class).newInstance(name, random);
        }
        if (discovered.hasNameConstructor()) {
            return (Strategy) strategyClass.getConstructor(String.class).newInstance(name);
        }
        if (discovered.hasRandomConstructor()) {
            return (Strategy) strategyClass.getConstructor(RandomSource.class).newInstance(random);
        }
        if (discovered.hasZeroArgConstructor()) {
            return (Strategy) strategyClass.getConstructor().newInstance();
        }

        throw new IllegalStateException("No suitable constructor found for " + discovered.className());
    }

    /**
     * Clears all discovered strategies. Primarily for testing.
     */
    public synchronized void clear() {
        strategiesByClassName.clear();
        cachedStrategies = List.of();
    }
}

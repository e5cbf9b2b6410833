package edu.brandeis.cosi103a.dilemma.runner;

import edu.brandeis.cosi103a.dilemma.strategy.RandomSource;
import edu.brandeis.cosi103a.dilemma.strategy.Strategy;
import edu.brandeis.cosi103a.dilemma.strategy.StrategyCatalog;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns roster configuration into fresh strategy instances.
 *
 * <p>Supports:
 * <ul>
 *   <li>Catalog strategies: {@code TitForTat}, {@code Random}, ...</li>
 *   <li>Classpath strategies: {@code classpath:com.example.MyStrategy}</li>
 * </ul>
 */
public class StrategyFactory {

    private final StrategyDiscoveryService discoveryService;

    /**
     * Creates a factory without a discovery service; classpath strategies are
     * instantiated by direct reflection.
     */
    public StrategyFactory() {
        this(null);
    }

    /**
     * @param discoveryService the service for discovering classpath strategies (may be null)
     */
    public StrategyFactory(StrategyDiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    /**
     * Builds one instance per entry, all sharing {@code random}.
     *
     * @throws RosterException if an entry cannot be resolved
     */
    public List<Strategy> createRoster(List<StrategyConfig> configs, RandomSource random) {
        List<Strategy> roster = new ArrayList<>();
        for (StrategyConfig config : configs) {
            roster.add(createStrategy(config, random));
        }
        return roster;
    }

    /**
     * Creates a Strategy instance based on the configuration.
     *
     * @throws RosterException if the source names neither a catalog strategy nor a loadable class
     */
    public Strategy createStrategy(StrategyConfig config, RandomSource random) {
        if (config.isClasspath()) {
            String className = config.source().substring(StrategyConfig.CLASSPATH_PREFIX.length());
            return createFromClassName(className, config.name(), random);
        }

        Optional<String> catalogName = StrategyCatalog.canonicalName(config.source());
        if (catalogName.isEmpty()) {
            throw new RosterException("Unknown strategy: " + config.source()
                + " (use --list-strategies to see available strategies)");
        }
        return StrategyCatalog.create(catalogName.get(), config.name(), random);
    }

    private Strategy createFromClassName(String className, String name, RandomSource random) {
        if (discoveryService != null) {
            var discovered = discoveryService.findByClassName(className);
            if (discovered.isPresent()) {
                try {
                    return discoveryService.createStrategy(discovered.get(), name, random);
                } catch (ReflectiveOperationException e) {
                    throw new RosterException("Failed to create strategy from " + className, e);
                }
            }
        }
        return createViaReflection(className, name, random);
    }

    private Strategy createViaReflection(String className, String name, RandomSource random) {
        Class<?> strategyClass;
        try {
            strategyClass = Class.forName(className, false, getClass().getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new RosterException("Strategy class not found: " + className, e);
        }
        if (!Strategy.class.isAssignableFrom(strategyClass)) {
            throw new RosterException(className + " does not implement " + Strategy.class.getName());
        }

        try {
            for (Object[] args : List.of(new Object[] {name, random}, new Object[] {name},
                    new Object[] {random}, new Object[] {})) {
                Constructor<?> ctor = findConstructor(strategyClass, args);
                if (ctor != null) {
                    return (Strategy) ctor.newInstance(args);
                }
            }
        } catch (ReflectiveOperationException e) {
            throw new RosterException("Failed to create strategy via reflection: " + className, e);
        }
        throw new RosterException("No suitable constructor found for " + className);
    }

    private static Constructor<?> findConstructor(Class<?> type, Object[] args) {
        Class<?>[] signature = new Class<?>[args.length];
        for (int i = 0; i < args.length; i++) {
            signature[i] = args[i] instanceof String ? String.class : RandomSource.class;
        }
        try {
            return type.getConstructor(signature);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }
}

package edu.brandeis.cosi103a.dilemma.viewer;

import edu.brandeis.cosi103a.dilemma.runner.DiscoveredStrategy;
import edu.brandeis.cosi103a.dilemma.runner.StrategyConfig;
import edu.brandeis.cosi103a.dilemma.runner.StrategyDiscoveryService;
import edu.brandeis.cosi103a.dilemma.strategy.RandomSource;
import edu.brandeis.cosi103a.dilemma.strategy.Strategy;
import edu.brandeis.cosi103a.dilemma.strategy.StrategyCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the strategies a tournament request may name.
 */
@RestController
@RequestMapping("/api/strategies")
public class StrategyController {

    private final StrategyDiscoveryService discoveryService;

    public StrategyController(StrategyDiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    /**
     * Built-in strategies in roster order, then other classpath strategies by display name.
     */
    @GetMapping
    public List<StrategyInfo> listStrategies() {
        List<StrategyInfo> result = new ArrayList<>();
        for (Strategy strategy : StrategyCatalog.defaultRoster(RandomSource.create())) {
            result.add(new StrategyInfo(strategy.getName(), strategy.getName(),
                StrategyCatalog.describe(strategy.getClass()), true));
        }
        String builtinPackage = Strategy.class.getPackageName() + ".";
        for (DiscoveredStrategy discovered : discoveryService.getDiscoveredStrategies()) {
            if (discovered.className().startsWith(builtinPackage)) {
                continue;
            }
            result.add(new StrategyInfo(discovered.displayName(),
                StrategyConfig.CLASSPATH_PREFIX + discovered.className(), discovered.description(), false));
        }
        return result;
    }

    /**
     * @param source value to pass as a roster entry's source
     */
    public record StrategyInfo(String name, String source, String description, boolean builtin) {}
}

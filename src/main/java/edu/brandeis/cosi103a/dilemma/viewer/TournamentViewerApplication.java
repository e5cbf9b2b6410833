package edu.brandeis.cosi103a.dilemma.viewer;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.dilemma.runner.StrategyDiscoveryService;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Main application class for the Tournament Viewer.
 * Serves tournament results and runs new tournaments in the background.
 */
@SpringBootApplication
public class TournamentViewerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TournamentViewerApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    /**
     * Scanned once on startup through its {@code @PostConstruct} hook.
     */
    @Bean
    public StrategyDiscoveryService strategyDiscoveryService() {
        return new StrategyDiscoveryService();
    }
}

package edu.brandeis.cosi103a.dilemma.engine;

/**
 * Thrown when payoff values or match sizing do not describe a valid dilemma.
 */
public class InvalidConfigurationException extends IllegalArgumentException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}

package edu.brandeis.cosi103a.dilemma.strategy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Optional annotation to provide a human-readable description for a Strategy implementation.
 * Used by StrategyDiscoveryService when scanning the classpath.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}StrategyDescription("Cooperates first, then copies the opponent")
 * public class TitForTatStrategy extends NamedStrategy {
 *     // ...
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface StrategyDescription {
    /**
     * A one-line description of the decision rule.
     */
    String value();
}

package edu.brandeis.cosi103a.dilemma.strategy;

/**
 * Base class holding the immutable display name. Holds no decision state.
 */
public abstract class NamedStrategy implements Strategy {

    private final String name;

    protected NamedStrategy(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name must not be blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}

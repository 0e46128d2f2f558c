package dumb.deduce;

import java.util.Iterator;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * A variable symbol. Two variables are the same iff their names are equal.
 */
public record Variable(String name) {
    public static final String DEFAULT_FRESH_PREFIX = "x";

    public Variable {
        requireNonNull(name);
        if (name.isEmpty())
            throw new IllegalArgumentException("Variable name must not be empty");
    }

    public static Variable of(String name) {
        return new Variable(name);
    }

    /**
     * A new, infinite supply of fresh variables {@code x0, x1, x2, ...}. Each call returns an independent iterator.
     */
    public static Iterator<Variable> freshNames() {
        return freshNames(DEFAULT_FRESH_PREFIX);
    }

    public static Iterator<Variable> freshNames(String prefix) {
        requireNonNull(prefix);
        return new Iterator<>() {
            private long next;

            @Override
            public boolean hasNext() {
                return next >= 0;
            }

            @Override
            public Variable next() {
                if (next < 0) throw new NoSuchElementException();
                return new Variable(prefix + next++);
            }
        };
    }

    @Override
    public String toString() {
        return name;
    }
}

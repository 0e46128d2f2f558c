package dumb.deduce;

import static java.util.Objects.requireNonNull;

/**
 * A predicate symbol, the head of an {@link Formula.Atomic} formula. Arity is not enforced.
 */
public record Predicate(int arity, QualifiedName name) {
    public static final Predicate EQUAL = of("=", 2);

    public Predicate {
        requireNonNull(name);
        if (arity < 0) throw new IllegalArgumentException("Negative arity: " + arity);
    }

    public static Predicate of(String name, int arity) {
        return new Predicate(arity, QualifiedName.of(name));
    }

    @Override
    public String toString() {
        return name.displayName() + '/' + arity;
    }
}

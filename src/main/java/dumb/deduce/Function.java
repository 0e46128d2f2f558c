package dumb.deduce;

import static java.util.Objects.requireNonNull;

/**
 * A function symbol. The arity documents the expected argument count; {@link Term.FunTerm} does not enforce it.
 */
public record Function(int arity, QualifiedName name) {
    public Function {
        requireNonNull(name);
        if (arity < 0) throw new IllegalArgumentException("Negative arity: " + arity);
    }

    public static Function of(String name, int arity) {
        return new Function(arity, QualifiedName.of(name));
    }

    @Override
    public String toString() {
        return name.displayName() + '/' + arity;
    }
}

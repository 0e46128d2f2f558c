package dumb.deduce;

import static java.util.Objects.requireNonNull;

public record Constant(QualifiedName name) {
    public Constant {
        requireNonNull(name);
    }

    public static Constant of(String name) {
        return new Constant(QualifiedName.of(name));
    }

    @Override
    public String toString() {
        return name.displayName();
    }
}

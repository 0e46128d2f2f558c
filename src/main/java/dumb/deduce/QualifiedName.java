package dumb.deduce;

import static java.util.Objects.requireNonNull;

/**
 * A dot-separated name, such as {@code logic.doubleNegation}. Only {@link #fullName} takes part in equality.
 */
public record QualifiedName(String fullName) {
    public QualifiedName {
        requireNonNull(fullName);
        if (fullName.isEmpty())
            throw new IllegalArgumentException("Qualified name must not be empty");
    }

    public static QualifiedName of(String fullName) {
        return new QualifiedName(fullName);
    }

    public String displayName() {
        var i = fullName.lastIndexOf('.');
        return i < 0 || i == fullName.length() - 1 ? fullName : fullName.substring(i + 1);
    }

    @Override
    public String toString() {
        return fullName;
    }
}

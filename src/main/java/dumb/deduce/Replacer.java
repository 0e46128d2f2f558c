package dumb.deduce;

/**
 * Builds the replacement formula of a match from its bindings.
 */
@FunctionalInterface
public interface Replacer {

    Formula build(RefFormulaContext refs);

    /**
     * A replacer that instantiates {@code template}, substituting its placeholders with the bound values.
     *
     * @see RefFormulaContext#instantiate(Formula)
     */
    static Replacer of(Formula template) {
        return refs -> refs.instantiate(template);
    }
}

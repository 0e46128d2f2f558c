package dumb.deduce;

import java.util.List;

/**
 * Finds occurrences of a pattern in a formula and substitutes a replacement built by a {@link Replacer}.
 */
public interface FormulaMatcher {

    /**
     * One candidate per matching occurrence, with exactly that occurrence replaced. Non-matching formulas yield an
     * empty list.
     */
    List<Formula> replaceOne(Formula f, Replacer replacer);

    /**
     * Replaces every occurrence in a single pass. Returns a formula identical to {@code f} if nothing matches.
     */
    Formula replaceAll(Formula f, Replacer replacer);
}

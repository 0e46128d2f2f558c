package dumb.deduce;

import dumb.deduce.util.Lists;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A {@link MatcherRule} with a second pattern, typically the other direction of a definition. Candidates of both
 * patterns are collected into one list without structural duplicates.
 */
public class MatcherDefRule extends MatcherRule {

    protected final FormulaMatcher m2;
    protected final Replacer r2;

    public MatcherDefRule(QualifiedName name, String description,
                          FormulaMatcher m1, Replacer r1,
                          FormulaMatcher m2, Replacer r2) {
        super(name, description, m1, r1);
        this.m2 = requireNonNull(m2);
        this.r2 = requireNonNull(r2);
    }

    @Override
    protected List<Formula> applyOne(Formula f) {
        List<Formula> re = new ArrayList<>();
        replaceAndAdd(f, matcher, replacer, re);
        replaceAndAdd(f, m2, r2, re);
        return re;
    }

    /**
     * Note the all-occurrences step always uses the first matcher, also for the second replacer.
     */
    private void replaceAndAdd(Formula f, FormulaMatcher m, Replacer r, List<Formula> re) {
        for (var t : m.replaceOne(f, r))
            Lists.addIfAbsent(re, t, Formula::isIdentityTo);
        // TODO decide whether the second pair should use m2.replaceAll(f, r2)
        var t = matcher.replaceAll(f, r);
        if (!t.isIdentityTo(f)) Lists.addIfAbsent(re, t, Formula::isIdentityTo);
    }
}

package dumb.deduce;

import dumb.deduce.util.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A rule rewriting formulas with a {@link FormulaMatcher} and a {@link Replacer}. Each formula of the context yields
 * every single-occurrence replacement, plus the all-occurrences replacement when it is new.
 */
public class MatcherRule implements Rule {

    private static final Logger logger = LoggerFactory.getLogger(MatcherRule.class);

    protected final QualifiedName name;
    protected final String description;
    protected final FormulaMatcher matcher;
    protected final Replacer replacer;

    public MatcherRule(QualifiedName name, String description, FormulaMatcher matcher, Replacer replacer) {
        this.name = requireNonNull(name);
        this.description = requireNonNull(description);
        this.matcher = requireNonNull(matcher);
        this.replacer = requireNonNull(replacer);
    }

    @Override
    public QualifiedName name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    /**
     * Scans the context from the most recent formula to the oldest and stops at the first candidate identical to
     * {@code desiredResult}.
     */
    @Override
    public TowardResult applyToward(FormulaContext context, List<Formula> formulas, List<Term> terms, Formula desiredResult) {
        List<Deduction> allResults = new ArrayList<>();
        var fs = context.formulas();
        for (var i = fs.size() - 1; i >= 0; i--) {
            var f = fs.get(i);
            for (var r : applyOne(f)) {
                var re = new Deduction(this, desiredResult, List.of(f));
                if (r.isIdentityTo(desiredResult)) {
                    logger.debug("{} reached {} from {}", name, desiredResult, f);
                    return new TowardResult.Reached(re);
                }
                allResults.add(re);
            }
        }
        logger.debug("{} did not reach {}: {} candidates", name, desiredResult, allResults.size());
        return new TowardResult.NotReached(allResults);
    }

    @Override
    public List<Deduction> apply(FormulaContext context, List<Formula> formulas, List<Term> terms) {
        List<Deduction> results = new ArrayList<>();
        for (var f : context.formulas()) {
            var premises = List.of(f);
            var replaced = applyOne(f);
            logger.trace("{} on {}: {}", name, f, replaced);
            for (var r : replaced) results.add(new Deduction(this, r, premises));
        }
        return results;
    }

    /**
     * The distinct one-step rewrites of {@code f}: the single-occurrence replacements in matcher order, then the
     * all-occurrences replacement if it differs from {@code f} and from every earlier candidate.
     */
    protected List<Formula> applyOne(Formula f) {
        var replace1 = matcher.replaceOne(f, replacer);
        List<Formula> results = new ArrayList<>(replace1.size() + 1);
        for (var r : replace1) Lists.addIfAbsent(results, r, Formula::isIdentityTo);
        var r = matcher.replaceAll(f, replacer);
        if (!f.isIdentityTo(r)) Lists.addIfAbsent(results, r, Formula::isIdentityTo);
        return results;
    }

    @Override
    public String toString() {
        return name.fullName();
    }
}

package dumb.deduce;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Structural matcher driven by a pattern formula. In the pattern, a parameterless {@link Formula.Named} binds any
 * sub-formula and a parameterless {@link Term.NamedTerm} binds any sub-term; repeated placeholders must bind
 * identical values. Everything else has to match exactly.
 */
public class PatternMatcher implements FormulaMatcher {

    public final Formula pattern;
    private final Configuration config;

    public PatternMatcher(Formula pattern) {
        this(pattern, Configuration.get());
    }

    public PatternMatcher(Formula pattern, Configuration config) {
        this.pattern = requireNonNull(pattern);
        this.config = requireNonNull(config);
    }

    /**
     * The bindings of {@code f} against the pattern, or null if it does not match at the root.
     */
    @Nullable
    public RefFormulaContext match(Formula f) {
        Map<String, Term> terms = new HashMap<>();
        Map<String, Formula> formulas = new HashMap<>();
        return matchFormula(pattern, f, terms, formulas)
                ? new RefFormulaContext(terms, formulas, config.freshVariablePrefix())
                : null;
    }

    @Override
    public List<Formula> replaceOne(Formula f, Replacer replacer) {
        List<Formula> results = new ArrayList<>();
        replaceOne(f, replacer, results);
        return results;
    }

    private void replaceOne(Formula f, Replacer replacer, List<Formula> results) {
        var refs = match(f);
        if (refs != null) results.add(replacer.build(refs));
        var cs = f.children();
        for (var i = 0; i < cs.size(); i++) {
            List<Formula> sub = new ArrayList<>();
            replaceOne(cs.get(i), replacer, sub);
            for (var r : sub) {
                var ncs = new ArrayList<>(cs);
                ncs.set(i, r);
                results.add(f.copyOf(ncs));
            }
        }
    }

    @Override
    public Formula replaceAll(Formula f, Replacer replacer) {
        return f.recurMap(x -> {
            var refs = match(x);
            return refs == null ? null : replacer.build(refs);
        }, x -> x);
    }

    private static boolean matchFormula(Formula p, Formula f, Map<String, Term> terms, Map<String, Formula> formulas) {
        if (p instanceof Formula.Named n && n.parameters().isEmpty()) {
            var key = n.name().fullName();
            var bound = formulas.get(key);
            if (bound != null) return bound.isIdentityTo(f);
            formulas.put(key, f);
            return true;
        }
        if (p instanceof Formula.Atomic pa) {
            if (!(f instanceof Formula.Atomic fa) || !pa.predicate().equals(fa.predicate())) return false;
            return matchTerms(pa.args(), fa.args(), terms);
        }
        if (p instanceof Formula.Compound pc) {
            if (!(f instanceof Formula.Compound fc) || pc.op() != fc.op()) return false;
            var s = pc.children().size();
            if (s != fc.children().size()) return false;
            for (var i = 0; i < s; i++)
                if (!matchFormula(pc.children().get(i), fc.children().get(i), terms, formulas)) return false;
            return true;
        }
        if (p instanceof Formula.Quantified pq) {
            return f instanceof Formula.Quantified fq && pq.quantifier() == fq.quantifier() && pq.v().equals(fq.v())
                    && matchFormula(pq.body(), fq.body(), terms, formulas);
        }
        return p.isIdentityTo(f);
    }

    private static boolean matchTerms(List<Term> ps, List<Term> ts, Map<String, Term> terms) {
        var s = ps.size();
        if (s != ts.size()) return false;
        for (var i = 0; i < s; i++)
            if (!matchTerm(ps.get(i), ts.get(i), terms)) return false;
        return true;
    }

    private static boolean matchTerm(Term p, Term t, Map<String, Term> terms) {
        if (p instanceof Term.NamedTerm n && n.parameters().isEmpty()) {
            var key = n.name().fullName();
            var bound = terms.get(key);
            if (bound != null) return bound.isIdentityTo(t);
            terms.put(key, t);
            return true;
        }
        if (p instanceof Term.FunTerm pf)
            return t instanceof Term.FunTerm tf && pf.f.equals(tf.f) && matchTerms(pf.children(), tf.children(), terms);
        return p.isIdentityTo(t);
    }

    @Override
    public String toString() {
        return "PatternMatcher[" + pattern + ']';
    }
}

package dumb.deduce;

import java.util.HashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The bindings of one match: named terms and named formulas resolved from a pattern, handed to a {@link Replacer}.
 */
public record RefFormulaContext(Map<String, Term> terms, Map<String, Formula> formulas, String freshVariablePrefix) {
    public RefFormulaContext {
        terms = Map.copyOf(requireNonNull(terms));
        formulas = Map.copyOf(requireNonNull(formulas));
        requireNonNull(freshVariablePrefix);
    }

    public RefFormulaContext(Map<String, Term> terms, Map<String, Formula> formulas) {
        this(terms, formulas, Configuration.get().freshVariablePrefix());
    }

    public Term term(String name) {
        var t = terms.get(name);
        if (t == null) throw new NoSuchElementException("No term named `" + name + "`");
        return t;
    }

    public Formula formula(String name) {
        var f = formulas.get(name);
        if (f == null) throw new NoSuchElementException("No formula named `" + name + "`");
        return f;
    }

    /**
     * Every variable occurring in a bound term or formula.
     */
    public Set<Variable> usedVariables() {
        Set<Variable> used = new HashSet<>();
        terms.values().forEach(t -> used.addAll(t.variables()));
        formulas.values().forEach(f -> used.addAll(f.variables()));
        return used;
    }

    /**
     * The first fresh variable not used by any binding.
     */
    public Term unusedVar() {
        var used = usedVariables();
        var names = Variable.freshNames(freshVariablePrefix);
        var v = names.next();
        while (used.contains(v)) v = names.next();
        return new Term.VarTerm(v);
    }

    /**
     * Substitutes the placeholders of {@code template}: parameterless named formulas by the bound formulas and
     * parameterless named terms by the bound terms.
     *
     * @throws NoSuchElementException if a placeholder is not bound
     */
    public Formula instantiate(Formula template) {
        return template.recurMap(
                f -> f instanceof Formula.Named n && n.parameters().isEmpty() ? formula(n.name().fullName()) : null,
                f -> f instanceof Formula.Atomic ? f.mapTerms(t -> instantiate(t)) : f);
    }

    public Term instantiate(Term template) {
        return template.recurMap(
                t -> t instanceof Term.NamedTerm n && n.parameters().isEmpty() ? term(n.name().fullName()) : null,
                t -> t);
    }
}

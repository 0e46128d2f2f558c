package dumb.deduce;

import java.util.List;

final class Fixtures {

    private Fixtures() {
    }

    static Term v(String name) {
        return new Term.VarTerm(Variable.of(name));
    }

    static Term c(String name) {
        return new Term.ConstTerm(Constant.of(name));
    }

    static Term f(String name, Term... args) {
        return new Term.FunTerm(Function.of(name, args.length), List.of(args));
    }

    /**
     * A term placeholder in a pattern.
     */
    static Term ref(String name) {
        return new Term.NamedTerm(QualifiedName.of(name), List.of());
    }

    static Formula p(String name, Term... args) {
        return new Formula.Atomic(Predicate.of(name, args.length), List.of(args));
    }

    static Formula named(String name) {
        return Formula.Named.of(name);
    }

    static Formula forall(String v, Formula body) {
        return new Formula.Quantified(Formula.Quantifier.FORALL, Variable.of(v), body);
    }
}

package dumb.deduce;

import java.util.List;

import static dumb.deduce.Formula.*;

/**
 * Standard propositional rewrites. {@code A} and {@code B} are formula placeholders.
 */
public enum LogicRules {
    ;

    public static final String NAMESPACE = "logic.";

    private static final Formula A = Named.of("A"), B = Named.of("B");

    /**
     * {@code ¬¬A ⇒ A}
     */
    public static Rule doubleNegation() {
        return rewrite("doubleNegation", "Removes a double negation", not(not(A)), A);
    }

    /**
     * {@code A ∧ B ⇒ B ∧ A}
     */
    public static Rule andCommutative() {
        return rewrite("andCommutative", "Swaps the operands of a conjunction", and(A, B), and(B, A));
    }

    /**
     * {@code A ∨ B ⇒ B ∨ A}
     */
    public static Rule orCommutative() {
        return rewrite("orCommutative", "Swaps the operands of a disjunction", or(A, B), or(B, A));
    }

    /**
     * {@code A → B ⇔ ¬A ∨ B}
     */
    public static Rule implicationDef() {
        return definition("implicationDef", "Implication as disjunction", implies(A, B), or(not(A), B));
    }

    /**
     * {@code ¬(A ∧ B) ⇔ ¬A ∨ ¬B}
     */
    public static Rule deMorganAnd() {
        return definition("deMorganAnd", "De Morgan's law for conjunction", not(and(A, B)), or(not(A), not(B)));
    }

    public static List<Rule> all() {
        return List.of(doubleNegation(), andCommutative(), orCommutative(), implicationDef(), deMorganAnd());
    }

    /**
     * A one-way rule rewriting {@code from} into {@code to}.
     */
    public static MatcherRule rewrite(String name, String description, Formula from, Formula to) {
        return new MatcherRule(QualifiedName.of(NAMESPACE + name), description, new PatternMatcher(from), Replacer.of(to));
    }

    /**
     * A rule usable in both directions between {@code left} and {@code right}.
     */
    public static MatcherDefRule definition(String name, String description, Formula left, Formula right) {
        return new MatcherDefRule(QualifiedName.of(NAMESPACE + name), description,
                new PatternMatcher(left), Replacer.of(right),
                new PatternMatcher(right), Replacer.of(left));
    }
}

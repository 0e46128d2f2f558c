package dumb.deduce;

import java.util.List;

/**
 * A named transformation producing new formulas from the formulas already obtained.
 */
public interface Rule {

    QualifiedName name();

    String description();

    /**
     * Searches for a one-step result of this rule that is identical to {@code desiredResult}.
     *
     * @param context       formulas that are obtained
     * @param formulas      optional formula parameters, which may or may not be obtained
     * @param terms         optional term parameters
     * @param desiredResult the desired result; it may not be reachable with this rule alone
     * @return {@link TowardResult.Reached} on the first hit, otherwise {@link TowardResult.NotReached} with every
     * candidate tried
     */
    TowardResult applyToward(FormulaContext context, List<Formula> formulas, List<Term> terms, Formula desiredResult);

    /**
     * All one-step results of this rule, each with the formula it came from as sole premise. An empty list means
     * the rule is not applicable.
     *
     * @param context  formulas that are obtained
     * @param formulas optional formula parameters, which may or may not be obtained
     * @param terms    optional term parameters
     */
    List<Deduction> apply(FormulaContext context, List<Formula> formulas, List<Term> terms);

    default TowardResult applyToward(FormulaContext context, Formula desiredResult) {
        return applyToward(context, List.of(), List.of(), desiredResult);
    }

    default List<Deduction> apply(FormulaContext context) {
        return apply(context, List.of(), List.of());
    }
}

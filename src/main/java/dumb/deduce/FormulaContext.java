package dumb.deduce;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An immutable, ordered snapshot of known formulas. The most recently added formula is last.
 */
public record FormulaContext(List<Formula> formulas) {
    public static final FormulaContext EMPTY = new FormulaContext(List.of());

    public FormulaContext {
        formulas = List.copyOf(requireNonNull(formulas));
    }

    public static FormulaContext of(Formula... formulas) {
        return new FormulaContext(List.of(formulas));
    }

    public FormulaContext with(Formula f) {
        var fs = new ArrayList<Formula>(formulas.size() + 1);
        fs.addAll(formulas);
        fs.add(requireNonNull(f));
        return new FormulaContext(fs);
    }

    public boolean contains(Formula f) {
        return formulas.stream().anyMatch(f::isIdentityTo);
    }

    public int size() {
        return formulas.size();
    }
}

package dumb.deduce;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of applying a rule toward a desired formula.
 *
 * @see MatcherRule#applyToward
 */
sealed public interface TowardResult permits TowardResult.Reached, TowardResult.NotReached {

    boolean reached();

    /**
     * The desired formula was produced.
     */
    record Reached(Deduction result) implements TowardResult {
        public Reached {
            requireNonNull(result);
        }

        public Reached(Rule r, Formula f, List<Formula> dependencies, Map<String, Object> moreInfo) {
            this(new Deduction(r, f, dependencies, moreInfo));
        }

        public Reached(Rule r, Formula f, List<Formula> dependencies) {
            this(r, f, dependencies, Map.of());
        }

        @Override
        public boolean reached() {
            return true;
        }
    }

    /**
     * Every candidate tried; none was identical to the desired formula. The nominal conclusion of each deduction is
     * the desired formula, not the candidate actually produced.
     */
    record NotReached(List<Deduction> results) implements TowardResult {
        public NotReached {
            results = List.copyOf(requireNonNull(results));
        }

        @Override
        public boolean reached() {
            return false;
        }
    }
}

package dumb.deduce;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.deduce.util.Json;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * {@code rule}, applied to {@code premises}, yields {@code conclusion}.
 */
public record Deduction(Rule rule, Formula conclusion, List<Formula> premises, Map<String, Object> moreInfo) {
    public Deduction {
        requireNonNull(rule);
        requireNonNull(conclusion);
        premises = List.copyOf(requireNonNull(premises));
        moreInfo = Map.copyOf(requireNonNull(moreInfo));
    }

    public Deduction(Rule rule, Formula conclusion, List<Formula> premises) {
        this(rule, conclusion, premises, Map.of());
    }

    public JsonNode toJson() {
        var ps = Json.array();
        premises.forEach(p -> ps.add(p.toJson()));
        var n = Json.node()
                .put("rule", rule.name().fullName());
        n.set("conclusion", conclusion.toJson());
        n.set("premises", ps);
        n.set("moreInfo", Json.node(moreInfo));
        return n;
    }

    @Override
    public String toString() {
        return premises + " ⊢ " + conclusion + " [" + rule.name() + ']';
    }
}

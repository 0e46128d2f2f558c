package dumb.deduce;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static dumb.deduce.Fixtures.*;
import static dumb.deduce.Formula.*;
import static org.junit.jupiter.api.Assertions.*;

class MatcherRuleTest {

    private final Formula P = p("P"), Q = p("Q"), R = p("R");
    private final Formula A = named("A"), B = named("B");

    private static MatcherRule rule(String name, Formula from, Formula to) {
        return new MatcherRule(QualifiedName.of(name), name, new PatternMatcher(from), Replacer.of(to));
    }

    @Test
    void identityRuleReachesTheFormulaItself() {
        var rule = rule("id", named("X"), named("X"));

        var candidates = rule.applyOne(P);
        assertEquals(1, candidates.size());
        assertTrue(candidates.get(0).isIdentityTo(P));

        var result = rule.applyToward(FormulaContext.of(P), List.of(), List.of(), P);
        var reached = assertInstanceOf(TowardResult.Reached.class, result);
        assertEquals(new Deduction(rule, P, List.of(P)), reached.result());
        assertTrue(result.reached());
    }

    @Test
    void swapRoundTrip() {
        var swap = rule("swap", p("f", ref("X"), ref("Y")), p("f", ref("Y"), ref("X")));
        var fab = p("f", c("a"), c("b"));

        var once = swap.applyOne(fab);
        assertEquals(1, once.size());
        assertTrue(once.get(0).isIdentityTo(p("f", c("b"), c("a"))));

        var twice = swap.applyOne(once.get(0));
        assertEquals(1, twice.size());
        assertTrue(twice.get(0).isIdentityTo(fab));
    }

    @Test
    void applyOneNeverReturnsDuplicates() {
        var stripNot = rule("stripNot", not(A), A);
        var candidates = stripNot.applyOne(not(not(P)));
        assertEquals(1, candidates.size());
        assertTrue(candidates.get(0).isIdentityTo(not(P)));

        var f = and(not(P), not(Q));
        candidates = stripNot.applyOne(f);
        assertEquals(3, candidates.size());
        for (var i = 0; i < candidates.size(); i++)
            for (var j = i + 1; j < candidates.size(); j++)
                assertFalse(candidates.get(i).isIdentityTo(candidates.get(j)));
        assertTrue(candidates.get(2).isIdentityTo(and(P, Q)));
    }

    @Test
    void applyTowardScansFromTheMostRecentFormulaAndStopsEarly() {
        var seen = new ArrayList<Formula>();
        var inner = new PatternMatcher(p("P1"));
        FormulaMatcher recording = new FormulaMatcher() {
            @Override
            public List<Formula> replaceOne(Formula f, Replacer replacer) {
                seen.add(f);
                return inner.replaceOne(f, replacer);
            }

            @Override
            public Formula replaceAll(Formula f, Replacer replacer) {
                return inner.replaceAll(f, replacer);
            }
        };
        var rule = new MatcherRule(QualifiedName.of("p1ToGoal"), "", recording, Replacer.of(p("Goal")));
        var f0 = p("P0");
        var f1 = p("P1");
        var f2 = p("P2");

        var result = rule.applyToward(FormulaContext.of(f0, f1, f2), p("Goal"));

        var reached = assertInstanceOf(TowardResult.Reached.class, result);
        assertEquals(List.of(f2, f1), seen);
        assertEquals(List.of(f1), reached.result().premises());
        assertTrue(reached.result().conclusion().isIdentityTo(p("Goal")));
    }

    @Test
    void applyTowardCollectsEveryCandidateWhenNotReached() {
        var comm = rule("comm", and(A, B), and(B, A));
        var ctx = FormulaContext.of(and(and(P, Q), R), p("S"), and(Q, R));
        var goal = p("T");

        var result = comm.applyToward(ctx, goal);

        var notReached = assertInstanceOf(TowardResult.NotReached.class, result);
        var expected = ctx.formulas().stream().mapToInt(f -> comm.applyOne(f).size()).sum();
        assertEquals(3, expected);
        assertEquals(expected, notReached.results().size());
        assertFalse(result.reached());
        for (var d : notReached.results()) {
            assertSame(goal, d.conclusion());
            assertEquals(1, d.premises().size());
        }
        // most recent first
        assertTrue(notReached.results().get(0).premises().get(0).isIdentityTo(and(Q, R)));
    }

    @Test
    void applyFollowsContextOrder() {
        var comm = rule("comm", and(A, B), and(B, A));
        var ctx = FormulaContext.of(and(P, Q), R, and(Q, R));

        var results = comm.apply(ctx);

        assertEquals(2, results.size());
        assertTrue(results.get(0).conclusion().isIdentityTo(and(Q, P)));
        assertEquals(List.of(and(P, Q)), results.get(0).premises());
        assertTrue(results.get(1).conclusion().isIdentityTo(and(R, Q)));
        assertSame(comm, results.get(1).rule());
    }

    @Test
    void nothingApplicableIsNotAnError() {
        var comm = rule("comm", and(A, B), and(B, A));
        assertEquals(List.of(), comm.apply(FormulaContext.EMPTY));
        assertEquals(List.of(), comm.apply(FormulaContext.of(P, or(P, Q))));
        var result = comm.applyToward(FormulaContext.of(P), Q);
        assertEquals(new TowardResult.NotReached(List.of()), result);
    }

    @Test
    void extraParametersAreIgnored() {
        var comm = rule("comm", and(A, B), and(B, A));
        var ctx = FormulaContext.of(and(P, Q));
        assertEquals(comm.apply(ctx), comm.apply(ctx, List.of(R), List.of(c("a"))));
        assertTrue(comm.applyToward(ctx, List.of(R), List.of(c("a")), and(Q, P)).reached());
    }

    @Test
    void deductionJson() {
        var comm = rule("logic.comm", and(A, B), and(B, A));
        var d = comm.apply(FormulaContext.of(and(P, Q))).get(0);
        var json = d.toJson();
        assertEquals("logic.comm", json.get("rule").asText());
        assertEquals("AND", json.get("conclusion").get("op").asText());
        assertEquals(1, json.get("premises").size());
        assertTrue(json.get("moreInfo").isEmpty());
    }
}

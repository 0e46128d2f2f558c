package dumb.deduce;

import org.junit.jupiter.api.Test;

import java.util.*;

import static dumb.deduce.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TermTest {

    private static final Variable X = Variable.of("x"), Y = Variable.of("y"), Z = Variable.of("z");

    private final Term a = c("a"), b = c("b");
    private final Term x = v("x"), y = v("y");

    @Test
    void identityIsReflexiveAndSymmetric() {
        var t1 = f("f", a, b);
        var t2 = f("f", c("a"), c("b"));
        assertTrue(t1.isIdentityTo(t1));
        assertTrue(t1.isIdentityTo(t2));
        assertTrue(t2.isIdentityTo(t1));
    }

    @Test
    void identityIsOrderSensitive() {
        assertFalse(f("f", a, b).isIdentityTo(f("f", b, a)));
        assertFalse(f("f", b, a).isIdentityTo(f("f", a, b)));
    }

    @Test
    void identityDistinguishesVariants() {
        assertFalse(v("a").isIdentityTo(c("a")));
        assertFalse(c("a").isIdentityTo(ref("a")));
        assertFalse(ref("a").isIdentityTo(v("a")));
        assertFalse(new Term.FunTerm(Function.of("f", 1), List.of(a))
                .isIdentityTo(new Term.FunTerm(Function.of("f", 2), List.of(a))));
    }

    @Test
    void variablesAreTheUnionOfChildren() {
        assertEquals(Set.of(X, Y), f("f", x, f("g", y, a), x).variables());
        assertEquals(Set.of(), f("f", a, b).variables());
        assertEquals(Set.of(X, Y), new Term.NamedTerm(QualifiedName.of("F"), List.of(X, Y)).variables());
    }

    @Test
    void renameVarSharesUnaffectedTerms() {
        var t = f("f", x, f("g", a));
        assertSame(t, t.renameVar(Map.of(Y, Z)));
        assertSame(a, a.renameVar(Map.of(X, Z)));

        var renamed = t.renameVar(Map.of(X, Z));
        assertTrue(renamed.isIdentityTo(f("f", v("z"), f("g", a))));
        assertSame(t.children().get(1), renamed.children().get(1));
    }

    @Test
    void renameVarOnNamedTermParameters() {
        var t = new Term.NamedTerm(QualifiedName.of("F"), List.of(X, Y));
        assertSame(t, t.renameVar(Map.of(Z, X)));
        assertTrue(t.renameVar(Map.of(Y, X)).isIdentityTo(new Term.NamedTerm(QualifiedName.of("F"), List.of(X, X))));
    }

    @Test
    void regularizeThreadsTheNameMap() {
        Map<Variable, Variable> nameMap = new HashMap<>();
        var names = Variable.freshNames();
        var r1 = f("f", x, y).regularizeVarName(nameMap, names);
        var r2 = f("g", y, v("z")).regularizeVarName(nameMap, names);

        assertTrue(r1.isIdentityTo(f("f", v("x0"), v("x1"))));
        assertTrue(r2.isIdentityTo(f("g", v("x1"), v("x2"))));
        assertEquals(Variable.of("x0"), nameMap.get(X));
        assertEquals(Variable.of("x2"), nameMap.get(Z));
    }

    @Test
    void regularizeIsIdempotent() {
        var t = f("f", v("p"), f("g", v("q"), v("p")), new Term.NamedTerm(QualifiedName.of("N"), List.of(Variable.of("r"))));
        var canonical = t.regularize();
        assertTrue(canonical.regularize().isIdentityTo(canonical));
        assertFalse(canonical.isIdentityTo(t));
    }

    @Test
    void alphaEquivalenceViaCanonicalForm() {
        assertTrue(f("f", x, y).isAlphaEquivalentTo(f("f", v("p"), v("q"))));
        assertTrue(f("f", x, y).isAlphaEquivalentTo(f("f", y, x)));
        assertFalse(f("f", x, x).isAlphaEquivalentTo(f("f", x, y)));
        assertFalse(f("f", x, a).isAlphaEquivalentTo(f("f", x, b)));
    }

    @Test
    void freshNameSuppliesAreIndependent() {
        var n1 = Variable.freshNames();
        var n2 = Variable.freshNames();
        assertEquals(Variable.of("x0"), n1.next());
        assertEquals(Variable.of("x1"), n1.next());
        assertEquals(Variable.of("x0"), n2.next());
        assertEquals(Variable.of("v0"), Variable.freshNames("v").next());
    }

    @Test
    void recurApplyVisitsInPreOrder() {
        List<String> visited = new ArrayList<>();
        f("f", f("g", a), x).recurApply(t -> visited.add(t.toString()));
        assertEquals(List.of("f(g(a),x)", "g(a)", "a", "x"), visited);
    }

    @Test
    void recurMapWithIdentityCombinerKeepsTheTerm() {
        var t = f("f", x);
        assertTrue(t.recurMap((origin, mapped) -> mapped).isIdentityTo(t));
    }

    @Test
    void recurMapPassesTheSameNodeTwiceForLeaves() {
        var t = f("f", f("g", a), x);
        t.recurMap((origin, mapped) -> {
            if (origin.isLeaf()) assertSame(origin, mapped);
            return mapped;
        });
        var replaced = t.recurMap((origin, mapped) -> origin.isIdentityTo(a) ? b : mapped);
        assertTrue(replaced.isIdentityTo(f("f", f("g", b), x)));
    }

    @Test
    void recurMapShortCircuitsOnBefore() {
        var t = f("f", f("g", x), a);
        List<String> visited = new ArrayList<>();
        var result = t.recurMap(n -> {
            visited.add(n.toString());
            return n instanceof Term.FunTerm ft && ft.function().name().fullName().equals("g") ? b : null;
        }, n -> n);

        assertTrue(result.isIdentityTo(f("f", b, a)));
        assertEquals(List.of("f(g(x),a)", "g(x)", "a"), visited);
    }

    @Test
    void recurMapAppliesAfterToRebuiltNodes() {
        var t = f("f", f("g", x), x);
        List<String> after = new ArrayList<>();
        var result = t.recurMap(n -> null, n -> {
            after.add(n.toString());
            return n instanceof Term.VarTerm ? a : n;
        });
        assertTrue(result.isIdentityTo(f("f", f("g", a), a)));
        assertEquals(List.of("x", "g(a)", "x", "f(g(a),a)"), after);
    }

    @Test
    void display() {
        assertEquals("f(a,g(x))", f("f", a, f("g", x)).toString());
        assertEquals("F(x,y)", new Term.NamedTerm(QualifiedName.of("F"), List.of(X, Y)).toString());
        assertEquals("pi", new Term.ConstTerm(Constant.of("math.pi")).toString());
    }

    @Test
    void json() {
        var json = f("f", a, x).toJson();
        assertEquals("fun", json.get("type").asText());
        assertEquals(2, json.get("arity").asInt());
        assertEquals("const", json.get("args").get(0).get("type").asText());
        assertEquals("x", json.get("args").get(1).get("name").asText());
    }
}

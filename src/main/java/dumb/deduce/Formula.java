package dumb.deduce;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.deduce.util.Json;
import dumb.deduce.util.Lists;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An immutable logical formula over {@link Term}s. Follows the same structural-identity discipline as terms.
 */
sealed public interface Formula extends Node<Formula> permits Formula.Atomic, Formula.Named, Formula.Compound, Formula.Quantified {

    /**
     * Free variables: a quantifier removes its bound variable from the variables of its body.
     */
    Set<Variable> variables();

    boolean isIdentityTo(Formula f);

    @Override
    default List<Formula> children() {
        return List.of();
    }

    /**
     * A formula of the same kind and symbol with the given children. Leaves return themselves.
     */
    default Formula copyOf(List<Formula> newChildren) {
        return this;
    }

    default void recurApply(Consumer<Formula> f) {
        f.accept(this);
        children().forEach(c -> c.recurApply(f));
    }

    /**
     * Top-down rebuild with the same contract as {@link Term#recurMap(UnaryOperator, UnaryOperator)}: a non-null
     * result of {@code before} replaces the whole sub-formula, otherwise the children are mapped and {@code after}
     * is applied to the rebuilt formula.
     */
    default Formula recurMap(UnaryOperator<Formula> before, UnaryOperator<Formula> after) {
        var f = before.apply(this);
        if (f != null) return f;
        var cs = children();
        if (cs.isEmpty()) return after.apply(this);
        return after.apply(copyOf(cs.stream().map(c -> c.recurMap(before, after)).toList()));
    }

    /**
     * Maps every term argument of every atomic sub-formula. Quantifier bindings are not taken into account.
     */
    default Formula mapTerms(UnaryOperator<Term> f) {
        var cs = children();
        if (cs.isEmpty()) return this;
        var mapped = Lists.mapShared(cs, c -> c.mapTerms(f));
        return mapped == cs ? this : copyOf(mapped);
    }

    /**
     * Capture-avoiding renaming of free variables. Returns this instance when no free variable is a key of the map.
     */
    Formula renameVar(Map<Variable, Variable> nameMap);

    /**
     * Canonical renaming of variables in pre-order; quantifier-bound variables are renamed within their scope only.
     */
    Formula regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider);

    default Formula regularize() {
        return regularizeVarName(new HashMap<>(), Variable.freshNames());
    }

    default boolean isAlphaEquivalentTo(Formula f) {
        return regularize().isIdentityTo(f.regularize());
    }

    JsonNode toJson();

    static Formula not(Formula f) {
        return new Compound(Connective.NOT, List.of(f));
    }

    static Formula and(Formula a, Formula b) {
        return new Compound(Connective.AND, List.of(a, b));
    }

    static Formula or(Formula a, Formula b) {
        return new Compound(Connective.OR, List.of(a, b));
    }

    static Formula implies(Formula a, Formula b) {
        return new Compound(Connective.IMPLIES, List.of(a, b));
    }

    enum Connective {
        NOT("¬", 1, 1), AND("∧", 2, Integer.MAX_VALUE), OR("∨", 2, Integer.MAX_VALUE),
        IMPLIES("→", 2, 2), EQUIV("↔", 2, 2);

        public final String symbol;
        final int minArity, maxArity;

        Connective(String symbol, int minArity, int maxArity) {
            this.symbol = symbol;
            this.minArity = minArity;
            this.maxArity = maxArity;
        }
    }

    enum Quantifier {
        FORALL("∀"), EXISTS("∃");

        public final String symbol;

        Quantifier(String symbol) {
            this.symbol = symbol;
        }
    }

    /**
     * A predicate applied to terms, such as {@code P(x)} or {@code a = b}.
     */
    record Atomic(Predicate predicate, List<Term> args) implements Formula {
        public Atomic {
            requireNonNull(predicate);
            args = List.copyOf(requireNonNull(args));
        }

        @Override
        public Set<Variable> variables() {
            Set<Variable> vs = new HashSet<>();
            args.forEach(a -> vs.addAll(a.variables()));
            return Collections.unmodifiableSet(vs);
        }

        @Override
        public boolean isIdentityTo(Formula f) {
            return this == f || (f instanceof Atomic x && predicate.equals(x.predicate) && Lists.equals(args, x.args, Term::isIdentityTo));
        }

        @Override
        public Formula mapTerms(UnaryOperator<Term> f) {
            var mapped = Lists.mapShared(args, f);
            return mapped == args ? this : new Atomic(predicate, mapped);
        }

        @Override
        public Formula renameVar(Map<Variable, Variable> nameMap) {
            return mapTerms(t -> t.renameVar(nameMap));
        }

        @Override
        public Formula regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider) {
            var nArgs = new ArrayList<Term>(args.size());
            for (var a : args) nArgs.add(a.regularizeVarName(nameMap, nameProvider));
            return new Atomic(predicate, nArgs);
        }

        @Override
        public JsonNode toJson() {
            var as = Json.array();
            args.forEach(a -> as.add(a.toJson()));
            var n = Json.node()
                    .put("type", "atomic")
                    .put("predicate", predicate.name().fullName());
            n.set("args", as);
            return n;
        }

        @Override
        public String toString() {
            if (predicate.equals(Predicate.EQUAL) && args.size() == 2)
                return args.get(0) + " = " + args.get(1);
            var name = predicate.name().displayName();
            if (args.isEmpty()) return name;
            return name + args.stream().map(Term::toString).collect(Collectors.joining(",", "(", ")"));
        }
    }

    /**
     * A named formula with parameter variables, such as {@code A} or {@code F(x)}. In a pattern a parameterless
     * named formula stands for any sub-formula.
     */
    record Named(QualifiedName name, List<Variable> parameters) implements Formula {
        public Named {
            requireNonNull(name);
            parameters = List.copyOf(requireNonNull(parameters));
        }

        public static Named of(String name) {
            return new Named(QualifiedName.of(name), List.of());
        }

        @Override
        public Set<Variable> variables() {
            return Set.copyOf(parameters);
        }

        @Override
        public boolean isIdentityTo(Formula f) {
            return f instanceof Named x && name.equals(x.name) && parameters.equals(x.parameters);
        }

        @Override
        public Formula renameVar(Map<Variable, Variable> nameMap) {
            if (parameters.stream().noneMatch(nameMap::containsKey)) return this;
            return new Named(name, parameters.stream().map(p -> nameMap.getOrDefault(p, p)).toList());
        }

        @Override
        public Formula regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider) {
            var ps = new ArrayList<Variable>(parameters.size());
            for (var p : parameters) {
                var nv = nameMap.get(p);
                if (nv == null) {
                    nv = nameProvider.next();
                    nameMap.put(p, nv);
                }
                ps.add(nv);
            }
            return new Named(name, ps);
        }

        @Override
        public JsonNode toJson() {
            var ps = Json.array();
            parameters.forEach(p -> ps.add(p.name()));
            var n = Json.node()
                    .put("type", "named")
                    .put("name", name.fullName());
            n.set("parameters", ps);
            return n;
        }

        @Override
        public String toString() {
            if (parameters.isEmpty()) return name.displayName();
            return name.displayName() + parameters.stream().map(Variable::name).collect(Collectors.joining(",", "(", ")"));
        }
    }

    record Compound(Connective op, List<Formula> children) implements Formula {
        public Compound {
            requireNonNull(op);
            children = List.copyOf(requireNonNull(children));
            var s = children.size();
            if (s < op.minArity || s > op.maxArity)
                throw new IllegalArgumentException(op + " does not accept " + s + " operand(s)");
        }

        @Override
        public Set<Variable> variables() {
            Set<Variable> vs = new HashSet<>();
            children.forEach(c -> vs.addAll(c.variables()));
            return Collections.unmodifiableSet(vs);
        }

        @Override
        public boolean isIdentityTo(Formula f) {
            return this == f || (f instanceof Compound x && op == x.op && Lists.equals(children, x.children, Formula::isIdentityTo));
        }

        @Override
        public Formula copyOf(List<Formula> newChildren) {
            return new Compound(op, newChildren);
        }

        @Override
        public Formula renameVar(Map<Variable, Variable> nameMap) {
            if (variables().stream().noneMatch(nameMap::containsKey)) return this;
            return new Compound(op, Lists.mapShared(children, c -> c.renameVar(nameMap)));
        }

        @Override
        public Formula regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider) {
            var cs = new ArrayList<Formula>(children.size());
            for (var c : children) cs.add(c.regularizeVarName(nameMap, nameProvider));
            return new Compound(op, cs);
        }

        @Override
        public JsonNode toJson() {
            var cs = Json.array();
            children.forEach(c -> cs.add(c.toJson()));
            var n = Json.node()
                    .put("type", "compound")
                    .put("op", op.name());
            n.set("children", cs);
            return n;
        }

        @Override
        public String toString() {
            if (op == Connective.NOT) return op.symbol + wrap(children.get(0));
            return children.stream().map(Compound::wrap).collect(Collectors.joining(" " + op.symbol + " "));
        }

        private static String wrap(Formula f) {
            return f instanceof Compound c && c.op != Connective.NOT ? "(" + f + ")" : f.toString();
        }
    }

    record Quantified(Quantifier quantifier, Variable v, Formula body) implements Formula {
        public Quantified {
            requireNonNull(quantifier);
            requireNonNull(v);
            requireNonNull(body);
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        public Formula copyOf(List<Formula> newChildren) {
            return new Quantified(quantifier, v, newChildren.get(0));
        }

        @Override
        public Set<Variable> variables() {
            var vs = body.variables();
            if (!vs.contains(v)) return vs;
            Set<Variable> free = new HashSet<>(vs);
            free.remove(v);
            return Collections.unmodifiableSet(free);
        }

        @Override
        public boolean isIdentityTo(Formula f) {
            return this == f || (f instanceof Quantified x && quantifier == x.quantifier && v.equals(x.v) && body.isIdentityTo(x.body));
        }

        @Override
        public Formula renameVar(Map<Variable, Variable> nameMap) {
            var free = variables();
            if (free.stream().noneMatch(nameMap::containsKey)) return this;
            Map<Variable, Variable> inner = new HashMap<>(nameMap);
            inner.remove(v);
            var captures = free.stream().anyMatch(u -> v.equals(inner.get(u)));
            if (!captures) {
                var nb = body.renameVar(inner);
                return nb == body ? this : new Quantified(quantifier, v, nb);
            }
            // the bound variable would capture a substituted one: rename it first
            var names = Variable.freshNames(v.name() + "_");
            Variable fresh;
            do {
                fresh = names.next();
            } while (body.variables().contains(fresh) || inner.containsValue(fresh));
            inner.put(v, fresh);
            return new Quantified(quantifier, fresh, body.renameVar(inner));
        }

        @Override
        public Formula regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider) {
            var outer = nameMap.get(v);
            var nv = nameProvider.next();
            nameMap.put(v, nv);
            var nb = body.regularizeVarName(nameMap, nameProvider);
            if (outer == null) nameMap.remove(v);
            else nameMap.put(v, outer);
            return new Quantified(quantifier, nv, nb);
        }

        @Override
        public JsonNode toJson() {
            var n = Json.node()
                    .put("type", "quantified")
                    .put("quantifier", quantifier.name())
                    .put("variable", v.name());
            n.set("body", body.toJson());
            return n;
        }

        @Override
        public String toString() {
            return quantifier.symbol + v.name() + ". " + body;
        }
    }
}

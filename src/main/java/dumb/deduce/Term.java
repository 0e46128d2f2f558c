package dumb.deduce;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.deduce.util.Json;
import dumb.deduce.util.Lists;

import java.util.*;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An immutable term: a variable, a constant, a named placeholder or a function application.
 * Every transformation returns a new term; unaffected sub-terms are shared.
 */
sealed public interface Term extends Node<Term> permits Term.VarTerm, Term.ConstTerm, Term.NamedTerm, Term.FunTerm {

    /**
     * The variables reachable from this term through children or parameters.
     */
    Set<Variable> variables();

    /**
     * Structural equality: same variant, same symbol, pairwise identical children in the same order.
     */
    boolean isIdentityTo(Term t);

    @Override
    default List<Term> children() {
        return List.of();
    }

    /**
     * Applies {@code f} to this term and all of its sub-terms, in pre-order.
     */
    default void recurApply(Consumer<Term> f) {
        f.accept(this);
    }

    /**
     * Rebuilds this term bottom-up. {@code m} receives the original node and the node rebuilt from mapped children;
     * for a leaf both arguments are the same node.
     */
    default Term recurMap(BinaryOperator<Term> m) {
        return m.apply(this, this);
    }

    /**
     * Rebuilds this term top-down. If {@code before} returns non-null for a node, that value is used as-is and the
     * node's children are not visited. Otherwise the children are mapped, the node rebuilt, and {@code after}
     * applied to the rebuilt node.
     */
    default Term recurMap(UnaryOperator<Term> before, UnaryOperator<Term> after) {
        var t = before.apply(this);
        return t != null ? t : after.apply(this);
    }

    /**
     * Substitutes variables according to {@code nameMap}. Returns this very instance when none of its variables is
     * a key of the map.
     */
    Term renameVar(Map<Variable, Variable> nameMap);

    /**
     * Renames every distinct variable, in pre-order, to the next name drawn from {@code nameProvider}, recording the
     * renaming in {@code nameMap} so repeated occurrences get the same name.
     */
    Term regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider);

    default Term regularize() {
        return regularizeVarName(new HashMap<>(), Variable.freshNames());
    }

    /**
     * Equality up to a consistent renaming of variables.
     */
    default boolean isAlphaEquivalentTo(Term t) {
        return regularize().isIdentityTo(t.regularize());
    }

    JsonNode toJson();

    private static Variable lookup(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider, Variable v) {
        var nv = nameMap.get(v);
        if (nv == null) {
            nv = nameProvider.next();
            nameMap.put(v, nv);
        }
        return nv;
    }

    record VarTerm(Variable v) implements Term {
        public VarTerm {
            requireNonNull(v);
        }

        @Override
        public Set<Variable> variables() {
            return Set.of(v);
        }

        @Override
        public boolean isIdentityTo(Term t) {
            return t instanceof VarTerm x && v.equals(x.v);
        }

        @Override
        public Term renameVar(Map<Variable, Variable> nameMap) {
            var nv = nameMap.get(v);
            return nv == null ? this : new VarTerm(nv);
        }

        @Override
        public Term regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider) {
            return new VarTerm(lookup(nameMap, nameProvider, v));
        }

        @Override
        public JsonNode toJson() {
            return Json.node()
                    .put("type", "var")
                    .put("name", v.name());
        }

        @Override
        public String toString() {
            return v.name();
        }
    }

    record ConstTerm(Constant c) implements Term {
        public ConstTerm {
            requireNonNull(c);
        }

        @Override
        public Set<Variable> variables() {
            return Set.of();
        }

        @Override
        public boolean isIdentityTo(Term t) {
            return t instanceof ConstTerm x && c.equals(x.c);
        }

        @Override
        public Term renameVar(Map<Variable, Variable> nameMap) {
            return this;
        }

        @Override
        public Term regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider) {
            return this;
        }

        @Override
        public JsonNode toJson() {
            return Json.node()
                    .put("type", "const")
                    .put("name", c.name().fullName());
        }

        @Override
        public String toString() {
            return c.name().displayName();
        }
    }

    /**
     * A named term with a list of parameter variables, such as {@code F(x,y)}. The parameters are not sub-terms.
     */
    record NamedTerm(QualifiedName name, List<Variable> parameters) implements Term {
        public NamedTerm {
            requireNonNull(name);
            parameters = List.copyOf(requireNonNull(parameters));
        }

        @Override
        public Set<Variable> variables() {
            return Set.copyOf(parameters);
        }

        @Override
        public boolean isIdentityTo(Term t) {
            return t instanceof NamedTerm x && name.equals(x.name) && parameters.equals(x.parameters);
        }

        @Override
        public Term renameVar(Map<Variable, Variable> nameMap) {
            if (parameters.stream().noneMatch(nameMap::containsKey)) return this;
            return new NamedTerm(name, parameters.stream().map(p -> nameMap.getOrDefault(p, p)).toList());
        }

        @Override
        public Term regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider) {
            var ps = new ArrayList<Variable>(parameters.size());
            for (var p : parameters) ps.add(lookup(nameMap, nameProvider, p));
            return new NamedTerm(name, ps);
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

    /**
     * A function application, such as {@code f(a,b)} or {@code a+b}.
     */
    final class FunTerm implements Term {
        public final Function f;
        private final List<Term> args;
        private volatile Set<Variable> variablesCache;
        private volatile int hashCodeCache;

        public FunTerm(Function f, List<Term> args) {
            this.f = requireNonNull(f);
            this.args = List.copyOf(args);
        }

        public Function function() {
            return f;
        }

        @Override
        public List<Term> children() {
            return args;
        }

        @Override
        public Set<Variable> variables() {
            if (variablesCache == null) {
                Set<Variable> vs = new HashSet<>();
                args.forEach(a -> vs.addAll(a.variables()));
                variablesCache = Collections.unmodifiableSet(vs);
            }
            return variablesCache;
        }

        @Override
        public boolean isIdentityTo(Term t) {
            return this == t || (t instanceof FunTerm x && f.equals(x.f) && Lists.equals(args, x.args, Term::isIdentityTo));
        }

        @Override
        public void recurApply(Consumer<Term> g) {
            g.accept(this);
            args.forEach(a -> a.recurApply(g));
        }

        @Override
        public Term recurMap(BinaryOperator<Term> m) {
            var nArgs = args.stream().map(a -> a.recurMap(m)).toList();
            return m.apply(this, new FunTerm(f, nArgs));
        }

        @Override
        public Term recurMap(UnaryOperator<Term> before, UnaryOperator<Term> after) {
            var t = before.apply(this);
            if (t != null) return t;
            var nArgs = args.stream().map(a -> a.recurMap(before, after)).toList();
            return after.apply(new FunTerm(f, nArgs));
        }

        @Override
        public Term renameVar(Map<Variable, Variable> nameMap) {
            if (variables().stream().noneMatch(nameMap::containsKey)) return this;
            return new FunTerm(f, Lists.mapShared(args, a -> a.renameVar(nameMap)));
        }

        @Override
        public Term regularizeVarName(Map<Variable, Variable> nameMap, Iterator<Variable> nameProvider) {
            var nArgs = new ArrayList<Term>(args.size());
            for (var a : args) nArgs.add(a.regularizeVarName(nameMap, nameProvider));
            return new FunTerm(f, nArgs);
        }

        @Override
        public JsonNode toJson() {
            var as = Json.array();
            args.forEach(a -> as.add(a.toJson()));
            var n = Json.node()
                    .put("type", "fun")
                    .put("name", f.name().fullName())
                    .put("arity", f.arity());
            n.set("args", as);
            return n;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof FunTerm that && this.hashCode() == that.hashCode() && f.equals(that.f) && args.equals(that.args));
        }

        @Override
        public int hashCode() {
            if (hashCodeCache == 0) hashCodeCache = 31 * f.hashCode() + args.hashCode();
            return hashCodeCache;
        }

        @Override
        public String toString() {
            if (args.isEmpty()) return f.name().displayName();
            return f.name().displayName() + args.stream().map(Term::toString).collect(Collectors.joining(",", "(", ")"));
        }
    }
}

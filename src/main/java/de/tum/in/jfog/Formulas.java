/*
 * This file is part of JFOG.
 * Copyright (c) 2026 The JFOG contributors.
 *
 * JFOG is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JFOG is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JFOG. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jfog;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * Generic algorithms on formulas.
 *
 * <p>All traversals work iteratively on the shared DAG, each distinct node is processed once. The
 * algorithms only rely on {@link TermLanguage} and thus apply to every formula language.
 */
public final class Formulas {
    private Formulas() {}

    public enum PrintFormat {
        /** One line per distinct node. */
        TEXT,
        /** A Graphviz digraph of the node DAG. */
        DOT
    }

    /**
     * Computes a value for every node reachable from {@code root} in post-order, i.e. children
     * before parents, and returns the value of the root.
     *
     * @param root
     *     The formula to fold.
     * @param descend
     *     Whether the children of a node are visited. If not, the combiner receives an empty list.
     * @param combine
     *     Computes the value of a node from the values of its children.
     */
    public static <F extends Formula<F>, R> R fold(
            F root, Predicate<F> descend, BiFunction<F, List<R>, R> combine) {
        TermLanguage<F> language = root.language();
        Map<F, R> results = new HashMap<>();
        Deque<F> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            F current = stack.peek();
            if (results.containsKey(current)) {
                stack.pop();
                continue;
            }
            List<F> children = descend.test(current) ? language.children(current) : ImmutableList.of();
            boolean ready = true;
            for (int i = children.size() - 1; i >= 0; i--) {
                F child = children.get(i);
                if (!results.containsKey(child)) {
                    stack.push(child);
                    ready = false;
                }
            }
            if (ready) {
                stack.pop();
                List<R> values = new ArrayList<>(children.size());
                for (F child : children) {
                    values.add(results.get(child));
                }
                R result = combine.apply(current, values);
                assert result != null;
                results.put(current, result);
            }
        }
        return results.get(root);
    }

    /** Number of distinct nodes of the formula. */
    public static <F extends Formula<F>> int size(F formula) {
        Set<F> seen = new LinkedHashSet<>();
        Deque<F> stack = new ArrayDeque<>();
        stack.push(formula);
        while (!stack.isEmpty()) {
            F current = stack.pop();
            if (seen.add(current)) {
                current.children().forEach(stack::push);
            }
        }
        return seen.size();
    }

    /**
     * Converts the formula into negation normal form. Implications and equivalences are expanded,
     * {@code f -> g} to {@code ~f | g} and {@code f <-> g} to {@code (~f | g) & (~g | f)}; a negated
     * equivalence becomes {@code (f & ~g) | (g & ~f)}. Negations are pushed through conjunctions,
     * disjunctions and quantifiers until they only apply to leaves, double negations vanish.
     */
    public static <F extends Formula<F>> F negationNormalForm(F formula) {
        TermLanguage<F> language = formula.language();
        // Keys combine node and polarity
        Map<Long, F> results = new HashMap<>();
        Deque<Long> stack = new ArrayDeque<>();
        long rootKey = key(formula.node(), false);
        stack.push(rootKey);
        while (!stack.isEmpty()) {
            long current = stack.peek();
            if (results.containsKey(current)) {
                stack.pop();
                continue;
            }
            F node = language.formula(nodeOfKey(current));
            boolean negated = isNegatedKey(current);
            long[] dependencies = nnfDependencies(node, negated);
            boolean ready = true;
            for (long dependency : dependencies) {
                if (!results.containsKey(dependency)) {
                    stack.push(dependency);
                    ready = false;
                }
            }
            if (ready) {
                stack.pop();
                List<F> values = new ArrayList<>(dependencies.length);
                for (long dependency : dependencies) {
                    values.add(results.get(dependency));
                }
                results.put(current, nnfCombine(language, node, negated, values));
            }
        }
        return results.get(rootKey);
    }

    private static long key(int node, boolean negated) {
        return ((long) node << 1) | (negated ? 1L : 0L);
    }

    private static int nodeOfKey(long key) {
        return (int) (key >>> 1);
    }

    private static boolean isNegatedKey(long key) {
        return (key & 1L) != 0L;
    }

    private static <F extends Formula<F>> long[] nnfDependencies(F formula, boolean negated) {
        switch (formula.tag()) {
            case NOT:
                return new long[] {key(formula.operand().node(), !negated)};
            case AND:
            case OR:
                return new long[] {key(formula.left().node(), negated), key(formula.right().node(), negated)};
            case IMPLIES:
                return new long[] {key(formula.left().node(), !negated), key(formula.right().node(), negated)};
            case IFF: {
                int left = formula.left().node();
                int right = formula.right().node();
                return new long[] {key(left, false), key(left, true), key(right, false), key(right, true)};
            }
            case FORALL:
            case EXISTS:
                return new long[] {key(formula.operand().node(), negated)};
            default:
                assert formula.isLeaf();
                return new long[0];
        }
    }

    private static <F extends Formula<F>> F nnfCombine(
            TermLanguage<F> language, F formula, boolean negated, List<F> values) {
        Tag tag = formula.tag();
        switch (tag) {
            case NOT:
                return values.get(0);
            case AND:
            case OR:
                return language.binary(negated ? tag.dual() : tag, values.get(0), values.get(1));
            case IMPLIES:
                // f -> g is ~f | g, its negation f & ~g
                return language.binary(negated ? Tag.AND : Tag.OR, values.get(0), values.get(1));
            case IFF: {
                F left = values.get(0);
                F notLeft = values.get(1);
                F right = values.get(2);
                F notRight = values.get(3);
                if (negated) {
                    return language.or(language.and(left, notRight), language.and(right, notLeft));
                }
                return language.and(language.or(notLeft, right), language.or(notRight, left));
            }
            case FORALL:
            case EXISTS:
                return language.rebuild(negated ? tag.dual() : tag, formula, values);
            default:
                assert formula.isLeaf();
                return negated ? language.not(formula) : formula;
        }
    }

    /**
     * Simplifies the formula without evaluating atoms over constants.
     *
     * @see #reduce(Formula, DomainEncoding)
     */
    public static <F extends Formula<F>> F reduce(F formula) {
        return reduce(formula, null);
    }

    /**
     * Simplifies the formula by a fixed set of local rules. The formula is first brought into
     * {@link #negationNormalForm(Formula) negation normal form}, then a single bottom-up pass
     * applies
     *
     * <ul>
     *   <li>{@code ~T = F}, {@code ~F = T}, {@code ~~f = f},
     *   <li>{@code f & T = f}, {@code f & F = F}, {@code f | T = T}, {@code f | F = f} on either side,
     *   <li>{@code f & f = f}, {@code f | f = f},
     *   <li>{@code x = x} is {@code T}, {@code edg(x, x)} and {@code x < x} are {@code F},
     *   <li>{@code ! [x] : T = T}, {@code ? [x] : F = F}.
     * </ul>
     *
     * If a structure is given, atoms over two of its constants are evaluated and, as the domain is
     * non-empty, {@code ! [x] : F = F} and {@code ? [x] : T = T}. The result is not necessarily
     * irreducible, valid formulas may remain non-constant.
     *
     * @param formula
     *     The formula to simplify.
     * @param structure
     *     The structure to evaluate constants in, may be {@code null}.
     */
    public static <F extends Formula<F>> F reduce(F formula, @Nullable DomainEncoding structure) {
        TermLanguage<F> language = formula.language();
        boolean nonEmptyDomain = structure != null && !structure.vertices().isEmpty();
        return fold(
                negationNormalForm(formula),
                f -> true,
                (node, children) -> reduceStep(language, node, children, structure, nonEmptyDomain));
    }

    private static <F extends Formula<F>> F reduceStep(
            TermLanguage<F> language,
            F node,
            List<F> children,
            @Nullable DomainEncoding structure,
            boolean nonEmptyDomain) {
        Tag tag = node.tag();
        if (node.isLeaf()) {
            return language.simplifyLeaf(node, structure);
        }
        if (tag == Tag.NOT) {
            F operand = children.get(0);
            if (operand.isLeaf() && operand.tag().isConstant()) {
                return language.constant(operand.isFalse());
            }
            if (operand.isNegation()) {
                return operand.operand();
            }
            return language.not(operand);
        }
        if (tag == Tag.AND || tag == Tag.OR) {
            F left = children.get(0);
            F right = children.get(1);
            // The absorbing element is F for conjunctions and T for disjunctions
            Tag absorbing = tag == Tag.AND ? Tag.FALSE : Tag.TRUE;
            if (left.tag() == absorbing || right.tag() == absorbing) {
                return language.constant(absorbing == Tag.TRUE);
            }
            Tag neutral = absorbing.dual();
            if (left.tag() == neutral) {
                return right;
            }
            if (right.tag() == neutral || left == right) {
                return left;
            }
            return language.binary(tag, left, right);
        }
        if (tag.isQuantifier()) {
            F body = children.get(0);
            if (body.tag().isConstant()) {
                boolean value = body.isTrue();
                // forall over T and exists over F hold on every domain, the others need a witness
                if (value == (tag == Tag.FORALL) || nonEmptyDomain) {
                    return body;
                }
            }
        }
        return language.rebuild(node, children);
    }

    /**
     * Returns the free variables and the constants of the formula in order of their first
     * occurrence.
     */
    public static List<Integer> freeVariablesAndConstants(Fog formula) {
        SymbolTable symbols = formula.context().symbols();
        Set<Integer> result = fold(formula, f -> true, (node, children) -> {
            Set<Integer> terms = new LinkedHashSet<>();
            if (node.isRelation()) {
                terms.add(node.firstTerm());
                terms.add(node.secondTerm());
            } else if (node.isQuantifier()) {
                terms.addAll(children.get(0));
                terms.remove(node.boundVariable());
            } else {
                children.forEach(terms::addAll);
            }
            return terms;
        });
        assert result.stream().allMatch(term -> symbols.isVariable(term) || symbols.isConstant(term));
        return ImmutableList.copyOf(result);
    }

    /** Returns the free variables of the formula in order of their first occurrence. */
    public static List<Integer> freeVariables(Fog formula) {
        SymbolTable symbols = formula.context().symbols();
        return freeVariablesAndConstants(formula).stream()
                .filter(symbols::isVariable)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Replaces every free occurrence of the variable {@code variable} by {@code term}. Occurrences
     * below a quantifier binding {@code variable} are not free and remain. No renaming takes place,
     * hence {@code term} should not be bound within the formula.
     *
     * @throws NameException
     *     If {@code variable} is not a variable.
     */
    public static Fog substitute(Fog formula, int term, int variable) {
        FogLanguage language = formula.context().fog();
        SymbolTable symbols = formula.context().symbols();
        if (!symbols.hasIndex(variable) || !symbols.isVariable(variable)) {
            throw new NameException(String.format("Symbol %d is not a variable", variable));
        }
        Predicate<Fog> descend = node -> !(node.isQuantifier() && node.boundVariable() == variable);
        return fold(formula, descend, (node, children) -> {
            if (node.isRelation()) {
                int first = node.firstTerm() == variable ? term : node.firstTerm();
                int second = node.secondTerm() == variable ? term : node.secondTerm();
                return language.relation(node.tag(), first, second);
            }
            if (!descend.test(node) || node.isLeaf()) {
                return node;
            }
            return language.rebuild(node, children);
        });
    }

    static String toString(Formula<?> formula) {
        TermTable table = formula.context().table();
        SymbolTable symbols = formula.context().symbols();
        Map<Integer, String> strings = new HashMap<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(formula.node());
        while (!stack.isEmpty()) {
            int node = stack.peek();
            if (strings.containsKey(node)) {
                stack.pop();
                continue;
            }
            Tag tag = table.tag(node);
            int[] children = childNodes(table, node);
            boolean ready = true;
            for (int child : children) {
                if (!strings.containsKey(child)) {
                    stack.push(child);
                    ready = false;
                }
            }
            if (!ready) {
                continue;
            }
            stack.pop();
            String string;
            if (tag.isLeaf()) {
                string = leafString(table, symbols, node);
            } else if (tag == Tag.NOT) {
                string = "(~ " + strings.get(children[0]) + ")";
            } else if (tag.isBinary()) {
                string = "(" + strings.get(children[0]) + " " + tag.symbol() + " " + strings.get(children[1]) + ")";
            } else {
                assert tag.isQuantifier();
                string = "(" + tag.symbol() + " [" + symbols.lookupName(table.first(node)) + "] : "
                        + strings.get(children[0]) + ")";
            }
            strings.put(node, string);
        }
        return strings.get(formula.node());
    }

    private static int[] childNodes(TermTable table, int node) {
        Tag tag = table.tag(node);
        if (tag.isLeaf()) {
            return new int[0];
        }
        if (tag == Tag.NOT) {
            return new int[] {table.first(node)};
        }
        if (tag.isBinary()) {
            return new int[] {table.first(node), table.second(node)};
        }
        return new int[] {table.second(node)};
    }

    private static String leafString(TermTable table, SymbolTable symbols, int node) {
        Tag tag = table.tag(node);
        switch (tag) {
            case TRUE:
            case FALSE:
                return tag.symbol();
            case VARIABLE:
                return symbols.lookupName(table.first(node));
            case ADJACENT:
                return "edg(" + symbols.lookupName(table.first(node)) + ", "
                        + symbols.lookupName(table.second(node)) + ")";
            case EQUAL:
            case LESS:
                return symbols.lookupName(table.first(node)) + " " + tag.symbol() + " "
                        + symbols.lookupName(table.second(node));
            default:
                throw new AssertionError("Not a leaf: " + tag);
        }
    }

    /**
     * Writes the node DAG of the formula.
     *
     * @param formula
     *     The formula to print.
     * @param out
     *     The target.
     * @param format
     *     Either a plain node listing or a Graphviz digraph.
     */
    public static <F extends Formula<F>> void print(F formula, Appendable out, PrintFormat format)
            throws IOException {
        TermTable table = formula.context().table();
        SymbolTable symbols = formula.context().symbols();
        // Post-order, children are listed before their parents
        List<Integer> order = new ArrayList<>();
        fold(formula, f -> true, (node, children) -> order.add(node.node()));

        if (format == PrintFormat.DOT) {
            out.append("digraph formula {\n");
        }
        for (int node : order) {
            Tag tag = table.tag(node);
            String label = tag.isLeaf()
                    ? leafString(table, symbols, node)
                    : tag.isQuantifier() ? tag.symbol() + " [" + symbols.lookupName(table.first(node)) + "]" : tag.symbol();
            int[] children = childNodes(table, node);
            if (format == PrintFormat.DOT) {
                out.append("  n").append(Integer.toString(node))
                        .append(" [label=\"").append(label).append("\"];\n");
                for (int child : children) {
                    out.append("  n").append(Integer.toString(node))
                            .append(" -> n").append(Integer.toString(child)).append(";\n");
                }
            } else {
                out.append(Integer.toString(node)).append(": ").append(label);
                for (int child : children) {
                    out.append(' ').append(Integer.toString(child));
                }
                out.append('\n');
            }
        }
        if (format == PrintFormat.DOT) {
            out.append("}\n");
        }
    }
}

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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.jfog.DomainEncoding.Scheme;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

public class DomainEncodingTest {
    private static final List<Integer> CLIQUE_VERTICES = List.of(5, 3, 1, 4, 2);
    private static final List<List<Integer>> CLIQUE_EDGES = List.of(
            List.of(1, 2), List.of(1, 3), List.of(1, 4), List.of(2, 3), List.of(2, 4), List.of(3, 4), List.of(4, 5));
    private static final List<List<Integer>> PATH = List.of(List.of(1, 2), List.of(2, 3));

    static Stream<Arguments> graphs() {
        List<Arguments> arguments = new ArrayList<>();
        for (Scheme scheme : Scheme.values()) {
            arguments.add(Arguments.of(scheme, EdgeCliqueCoverTest.TREE_VERTICES, EdgeCliqueCoverTest.TREE_EDGES));
            arguments.add(Arguments.of(scheme, CLIQUE_VERTICES, CLIQUE_EDGES));
            arguments.add(Arguments.of(scheme, List.of(2, 1, 3, 4), List.of(List.of(1, 2), List.of(2, 3))));
        }
        return arguments.stream();
    }

    private static Set<Integer> assign(DomainEncoding encoding, int variable, BitSet bits, Set<Integer> target) {
        for (int bit = 1; bit <= encoding.codeLength(); bit++) {
            if (bits.get(bit - 1)) {
                target.add(encoding.bitVariable(variable, bit).variable());
            }
        }
        return target;
    }

    @Test
    public void testCodes() {
        FormulaContext context = FormulaFactory.createContext();
        List<Integer> vertices = List.of(1, 2, 3);
        DomainEncoding edge = DomainEncoding.create(context, vertices, PATH, Scheme.EDGE, "V");
        assertThat(edge.codeLength(), is(2));
        assertThat(edge.code(1), is(BitSet.valueOf(new long[] {0b01})));
        assertThat(edge.code(2), is(BitSet.valueOf(new long[] {0b11})));
        assertThat(edge.code(3), is(BitSet.valueOf(new long[] {0b10})));

        DomainEncoding log = DomainEncoding.create(context, vertices, PATH, Scheme.LOG, "W");
        assertThat(log.codeLength(), is(2));
        assertThat(log.code(3), is(BitSet.valueOf(new long[] {0b11})));

        DomainEncoding direct = DomainEncoding.create(context, vertices, PATH, Scheme.DIRECT, "D");
        assertThat(direct.codeLength(), is(3));
        assertThat(direct.code(2), is(BitSet.valueOf(new long[] {0b010})));

        DomainEncoding clique = DomainEncoding.create(context, List.of(1, 2, 3), List.of(), Scheme.CLIQUE, "C");
        assertThat(clique.codeLength(), is(2));
        assertThat(clique.code(1).isEmpty(), is(true));

        // Codes are copies
        edge.code(1).clear();
        assertThat(edge.code(1).isEmpty(), is(false));
    }

    @Test
    public void testConstants() {
        FormulaContext context = FormulaFactory.createContext();
        DomainEncoding encoding = DomainEncoding.create(context, List.of(1, 2, 3), PATH, Scheme.EDGE, "V_");
        SymbolTable symbols = context.symbols();
        int constant = encoding.vertexToConstant(2);
        assertThat(symbols.lookupName(constant), is("V_2"));
        assertThat(encoding.constantToVertex(constant), is(2));
        assertThat(encoding.hasConstant(constant), is(true));
        assertThat(encoding.hasConstant(symbols.lookupIndex("x")), is(false));
        assertThrows(NoSuchElementException.class, () -> encoding.constantToVertex(symbols.lookupIndex("W1")));
        assertThrows(NoSuchElementException.class, () -> encoding.vertexToConstant(4));
        assertThat(encoding.prefix(), is("V_"));
        assertThat(encoding.scheme(), is(Scheme.EDGE));
        assertThat(encoding.vertices(), is(List.of(1, 2, 3)));
        assertThat(encoding.edges(), is(PATH));
    }

    @Test
    public void testInvalidInput() {
        FormulaContext context = FormulaFactory.createContext();
        List<Integer> vertices = List.of(1, 2, 3, 4);
        assertThrows(GraphException.class, () -> DomainEncoding.create(context, vertices, PATH, Scheme.EDGE, "v"));
        assertThrows(GraphException.class, () -> DomainEncoding.create(context, vertices, PATH, Scheme.EDGE, "1V"));
        assertThrows(GraphException.class, () -> DomainEncoding.create(context, vertices, PATH, Scheme.EDGE, ""));
        // Two isolated vertices
        assertThrows(GraphException.class,
                () -> DomainEncoding.create(context, List.of(1, 2, 3, 4, 5), PATH, Scheme.LOG, "V"));
        // An isolated edge
        assertThrows(GraphException.class, () -> DomainEncoding.create(
                context, vertices, List.of(List.of(1, 2), List.of(3, 4)), Scheme.DIRECT, "V"));
        assertThrows(GraphException.class, () -> DomainEncoding.create(
                context, vertices, List.of(List.of(1, 2), List.of(2, 1)), Scheme.EDGE, "V"));
        // Clique encoding separates isolated vertices and edges
        DomainEncoding encoding = DomainEncoding.create(
                context, List.of(1, 2, 3, 4, 5, 6), List.of(List.of(1, 2), List.of(3, 4)), Scheme.CLIQUE, "V");
        assertThat(encoding.codeLength(), is(2 + 1 + 1 + 1));
    }

    @Test
    public void testTermErrors() {
        FormulaContext context = FormulaFactory.createContext();
        DomainEncoding encoding = DomainEncoding.create(context, List.of(1, 2, 3), PATH, Scheme.EDGE, "V");
        SymbolTable symbols = context.symbols();
        int x = symbols.lookupIndex("x");
        int constant = encoding.vertexToConstant(1);
        int foreign = symbols.lookupIndex("W1");
        assertThrows(NameException.class, () -> encoding.bitVariable(constant, 1));
        assertThrows(NameException.class, () -> encoding.domainConstraint(constant));
        assertThrows(NameException.class, () -> encoding.equalityGate(x, foreign));
        assertThrows(IllegalArgumentException.class, () -> encoding.bitVariable(x, 3));
        assertThat(encoding.bitVariable(x, 2).toString(), is("x@2"));
        assertThat(encoding.codeLiterals(constant).toString(), is("[T, F]"));
    }

    @ParameterizedTest
    @MethodSource("graphs")
    public void testGates(Scheme scheme, List<Integer> vertices, List<List<Integer>> edges) {
        FormulaContext context = FormulaFactory.createContext();
        DomainEncoding encoding = DomainEncoding.create(context, vertices, edges, scheme, "V");
        SymbolTable symbols = context.symbols();
        int x = symbols.lookupIndex("x");
        int y = symbols.lookupIndex("y");
        Prop equal = encoding.equalityGate(x, y);
        Prop adjacent = encoding.adjacencyGate(x, y);
        Prop less = encoding.orderGate(x, y);

        for (int u : vertices) {
            for (int v : vertices) {
                Set<Integer> model = assign(encoding, x, encoding.code(u), new HashSet<>());
                assign(encoding, y, encoding.code(v), model);
                String pair = scheme + " " + u + " " + v;
                assertThat(pair, Evaluator.evaluate(equal, model), is(u == v));
                assertThat(pair, Evaluator.evaluate(adjacent, model), is(encoding.isAdjacent(u, v)));
                assertThat(pair, Evaluator.evaluate(less, model), is(vertices.indexOf(u) < vertices.indexOf(v)));

                // Constants contribute their codes
                int first = encoding.vertexToConstant(u);
                int second = encoding.vertexToConstant(v);
                assertThat(pair, Formulas.reduce(encoding.adjacencyGate(first, second)).isTrue(),
                        is(encoding.isAdjacent(u, v)));
                Set<Integer> xOnly = assign(encoding, x, encoding.code(u), new HashSet<>());
                assertThat(pair, Evaluator.evaluate(encoding.orderGate(x, second), xOnly),
                        is(vertices.indexOf(u) < vertices.indexOf(v)));
            }
        }
    }

    @ParameterizedTest
    @MethodSource("graphs")
    public void testDomainConstraint(Scheme scheme, List<Integer> vertices, List<List<Integer>> edges) {
        FormulaContext context = FormulaFactory.createContext();
        DomainEncoding encoding = DomainEncoding.create(context, vertices, edges, scheme, "V");
        int x = context.symbols().lookupIndex("x");
        Prop constraint = encoding.domainConstraint(x);

        Set<BitSet> codes = new HashSet<>();
        for (int vertex : vertices) {
            codes.add(encoding.code(vertex));
        }
        assertThat(codes.size(), is(vertices.size()));
        for (long value = 0; value < (1L << encoding.codeLength()); value++) {
            BitSet bits = BitSet.valueOf(new long[] {value});
            Set<Integer> model = assign(encoding, x, bits, new HashSet<>());
            assertThat(scheme + " " + bits, Evaluator.evaluate(constraint, model), is(codes.contains(bits)));
        }
    }

    @ParameterizedTest
    @EnumSource(Scheme.class)
    public void testDecodeAssignment(Scheme scheme) {
        FormulaContext context = FormulaFactory.createContext();
        DomainEncoding encoding =
                DomainEncoding.create(context, CLIQUE_VERTICES, CLIQUE_EDGES, scheme, "V");
        SymbolTable symbols = context.symbols();
        int x = symbols.lookupIndex("x");
        int y = symbols.lookupIndex("y");
        int length = encoding.codeLength();

        List<Integer> literals = new ArrayList<>();
        BitSet xCode = encoding.code(3);
        BitSet yCode = encoding.code(5);
        for (int bit = 1; bit <= length; bit++) {
            int xBit = encoding.bitVariable(x, bit).variable();
            int yBit = encoding.bitVariable(y, bit).variable();
            literals.add(yCode.get(bit - 1) ? yBit : -yBit);
            literals.add(xCode.get(bit - 1) ? xBit : -xBit);
        }
        // Unrelated propositional variables are ignored
        literals.add(symbols.newAuxiliaryIndex());
        // Bit numbers have no leading zeros
        literals.add(context.prop().variable("x@01").variable());
        literals.add(-context.prop().variable("x@0").variable());
        int[] assignment = literals.stream().mapToInt(Integer::intValue).toArray();
        Map<Integer, Integer> decoded = encoding.decodeAssignment(assignment);
        assertThat(decoded, is(Map.of(x, encoding.vertexToConstant(3), y, encoding.vertexToConstant(5))));
        assertThat(decoded.keySet().iterator().next(), is(y));

        int xFirst = encoding.bitVariable(x, 1).variable();
        // Incomplete
        assertThrows(DecodeException.class, () -> encoding.decodeAssignment(new int[] {xFirst}));
        // Conflicting
        int[] conflicting = Arrays.copyOf(assignment, assignment.length + 1);
        conflicting[assignment.length] = xCode.get(0) ? -xFirst : xFirst;
        assertThrows(DecodeException.class, () -> encoding.decodeAssignment(conflicting));
        // Unknown symbol
        assertThrows(DecodeException.class, () -> encoding.decodeAssignment(new int[] {symbols.size() + 1}));
        // Bit beyond the code length
        int beyond = context.prop().variable("x@" + (length + 1)).variable();
        assertThrows(DecodeException.class, () -> encoding.decodeAssignment(new int[] {beyond}));
        // All bits false is no code of these graphs
        int[] zero = new int[length];
        for (int bit = 1; bit <= length; bit++) {
            zero[bit - 1] = -encoding.bitVariable(x, bit).variable();
        }
        assertThrows(DecodeException.class, () -> encoding.decodeAssignment(zero));
    }
}

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

import static de.tum.in.jfog.Util.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Encodes the vertices of a graph as bit vectors, so that first-order variables ranging over the
 * vertices can be represented by propositional variables, one per bit.
 *
 * <p>The bits of variable {@code x} are the propositional variables {@code x@1}, ..., {@code x@L}
 * where {@code L} is the {@link #codeLength() code length}. Each vertex {@code v} is represented by
 * the constant {@code <prefix>v}, whose bits are the truth values of its code.
 *
 * <p>Besides the codes, an encoding provides the gates which express equality, adjacency and order
 * on codes, and the domain constraint which restricts the bits of a variable to valid codes. It
 * also serves as structure in which {@link Formulas#reduce(Formula, DomainEncoding)} evaluates
 * atoms over constants.
 */
public final class DomainEncoding {
    private static final Logger logger = Logger.getLogger(DomainEncoding.class.getName());
    private static final Pattern CONSTANT_PREFIX = Pattern.compile("[A-Z][A-Z0-9_]*");
    private static final Pattern BIT_NUMBER = Pattern.compile("[1-9][0-9]{0,8}");
    public static final char BIT_SEPARATOR = '@';

    public enum Scheme {
        /** Bit {@code i} is set iff the vertex is incident to the {@code i}-th edge. */
        EDGE,
        /** Bit {@code i} is set iff the vertex belongs to the {@code i}-th clique of a separating cover. */
        CLIQUE,
        /** One bit per vertex, exactly one of them set. */
        DIRECT,
        /** Binary representation of the 1-based vertex position, bit 1 being the least significant. */
        LOG
    }

    private final FormulaContext context;
    private final int generation;
    private final Scheme scheme;
    private final String prefix;
    private final Graph graph;
    private final int codeLength;
    private final Map<Integer, Integer> positionOfVertex;
    /* Indexed by vertex position */
    private final List<BitSet> codes;
    private final int[] constants;
    private final Map<Integer, Integer> vertexOfConstant;
    private final Map<BitSet, Integer> vertexOfCode;

    private DomainEncoding(FormulaContext context, Scheme scheme, String prefix, Graph graph,
            int codeLength, List<BitSet> codes) {
        this.context = context;
        this.generation = context.generation();
        this.scheme = scheme;
        this.prefix = prefix;
        this.graph = graph;
        this.codeLength = codeLength;
        this.codes = codes;

        List<Integer> vertices = graph.vertices();
        ImmutableMap.Builder<Integer, Integer> positions = ImmutableMap.builder();
        Map<BitSet, Integer> byCode = new HashMap<>();
        this.constants = new int[vertices.size()];
        Map<Integer, Integer> byConstant = new HashMap<>();
        SymbolTable symbols = context.symbols();
        for (int position = 0; position < vertices.size(); position++) {
            int vertex = vertices.get(position);
            positions.put(vertex, position);
            if (byCode.put(codes.get(position), vertex) != null) {
                throw new GraphException(String.format("Vertex %d does not have a unique code", vertex));
            }
            constants[position] = symbols.lookupIndex(prefix + vertex);
            byConstant.put(constants[position], vertex);
        }
        this.positionOfVertex = positions.build();
        this.vertexOfCode = byCode;
        this.vertexOfConstant = byConstant;
    }

    /**
     * Encodes the given graph.
     *
     * @param context
     *     The context in which constants and formulas are created.
     * @param vertices
     *     Distinct positive vertex ids. The order of this list defines the order relation.
     * @param edges
     *     Undirected edges given as pairs of distinct vertices.
     * @param scheme
     *     The encoding scheme.
     * @param prefix
     *     The prefix of the constant names, an uppercase letter followed by uppercase letters, digits
     *     or underscores.
     * @throws GraphException
     *     If the graph is malformed or violates the preconditions of the scheme: except for {@link
     *     Scheme#CLIQUE}, at most one vertex may be isolated and no edge may be isolated.
     */
    public static DomainEncoding create(FormulaContext context, List<Integer> vertices,
            List<? extends List<Integer>> edges, Scheme scheme, String prefix) {
        if (!CONSTANT_PREFIX.matcher(prefix).matches()) {
            throw new GraphException(String.format("Invalid constant prefix '%s'", prefix));
        }
        Graph graph = Graph.of(vertices, edges);
        if (scheme != Scheme.CLIQUE) {
            if (graph.isolatedVertexCount() > 1) {
                throw new GraphException("At most one isolated vertex is allowed");
            }
            if (graph.isolatedEdgeCount() > 0) {
                throw new GraphException("Isolated edges are not allowed");
            }
        }

        int vertexCount = graph.vertices().size();
        List<BitSet> codes = new ArrayList<>(vertexCount);
        int codeLength;
        switch (scheme) {
            case EDGE: {
                List<List<Integer>> graphEdges = graph.edges();
                codeLength = graphEdges.size();
                for (int vertex : graph.vertices()) {
                    codes.add(EdgeCliqueCover.incidence(graphEdges, vertex));
                }
                break;
            }
            case CLIQUE: {
                List<List<Integer>> cover = new EdgeCliqueCover(graph).computeSeparating();
                codeLength = cover.size();
                for (int vertex : graph.vertices()) {
                    codes.add(EdgeCliqueCover.incidence(cover, vertex));
                }
                break;
            }
            case DIRECT:
                codeLength = vertexCount;
                for (int position = 0; position < vertexCount; position++) {
                    BitSet code = new BitSet(codeLength);
                    code.set(position);
                    codes.add(code);
                }
                break;
            case LOG:
                codeLength = Integer.SIZE - Integer.numberOfLeadingZeros(vertexCount);
                for (int position = 0; position < vertexCount; position++) {
                    codes.add(BitSet.valueOf(new long[] {position + 1L}));
                }
                break;
            default:
                throw new AssertionError();
        }
        logger.log(Level.FINE, "Encoded {0} vertices with {1} bits using {2} encoding", new Object[] {
            vertexCount, codeLength, scheme
        });
        return new DomainEncoding(context, scheme, prefix, graph, codeLength, ImmutableList.copyOf(codes));
    }

    public FormulaContext context() {
        return context;
    }

    public Scheme scheme() {
        return scheme;
    }

    public String prefix() {
        return prefix;
    }

    public int codeLength() {
        return codeLength;
    }

    public List<Integer> vertices() {
        return graph.vertices();
    }

    /** The edges of the graph, each as a pair (smaller, larger), in input order. */
    public List<List<Integer>> edges() {
        return graph.edges();
    }

    public boolean isAdjacent(int first, int second) {
        return graph.isAdjacent(first, second);
    }

    /** The position of the vertex in the vertex list. */
    public int position(int vertex) {
        Integer position = positionOfVertex.get(vertex);
        if (position == null) {
            throw new NoSuchElementException(String.format("Unknown vertex %d", vertex));
        }
        return position;
    }

    /**
     * Returns the code of the vertex. Bit {@code i} of the code, counting from 1, corresponds to the
     * propositional variable {@code x@i} of a variable {@code x}; in the returned set it is stored at
     * index {@code i - 1}.
     */
    public BitSet code(int vertex) {
        return (BitSet) codes.get(position(vertex)).clone();
    }

    /** Returns the constant symbol representing the vertex. */
    public int vertexToConstant(int vertex) {
        checkValid();
        return constants[position(vertex)];
    }

    /** Returns the vertex represented by the constant symbol. */
    public int constantToVertex(int constant) {
        checkValid();
        Integer vertex = vertexOfConstant.get(constant);
        if (vertex == null) {
            throw new NoSuchElementException(String.format("Symbol %d is not a constant of this encoding", constant));
        }
        return vertex;
    }

    public boolean hasConstant(int constant) {
        checkValid();
        return vertexOfConstant.containsKey(constant);
    }

    /**
     * Returns the propositional variable representing the given bit of the given variable.
     *
     * @throws NameException
     *     If {@code variable} is not a variable.
     */
    public Prop bitVariable(int variable, int bit) {
        checkValid();
        checkArgument(1 <= bit && bit <= codeLength, "Bit %d out of range", bit);
        SymbolTable symbols = context.symbols();
        checkVariable(variable);
        return context.prop().variable(symbols.lookupName(variable) + BIT_SEPARATOR + bit);
    }

    /**
     * Returns the bits of a term: the bit variables of a variable, or the constant truth values of the
     * code of a constant.
     *
     * @throws NameException
     *     If the term is a constant not belonging to this encoding.
     */
    public List<Prop> codeLiterals(int term) {
        checkValid();
        SymbolTable symbols = context.symbols();
        PropLanguage prop = context.prop();
        List<Prop> literals = new ArrayList<>(codeLength);
        if (symbols.hasIndex(term) && symbols.isConstant(term)) {
            if (!hasConstant(term)) {
                throw new NameException(
                        String.format("Constant %s does not denote a vertex", symbols.lookupName(term)));
            }
            BitSet code = codes.get(position(constantToVertex(term)));
            for (int bit = 1; bit <= codeLength; bit++) {
                literals.add(prop.constant(code.get(bit - 1)));
            }
        } else {
            for (int bit = 1; bit <= codeLength; bit++) {
                literals.add(bitVariable(term, bit));
            }
        }
        return literals;
    }

    private Prop codeMatch(List<Prop> bits, BitSet code) {
        PropLanguage prop = context.prop();
        List<Prop> literals = new ArrayList<>(bits.size());
        for (int i = 0; i < bits.size(); i++) {
            literals.add(code.get(i) ? bits.get(i) : prop.not(bits.get(i)));
        }
        return prop.fold(Tag.AND, literals);
    }

    /** Bitwise equality of the codes of two terms. */
    public Prop equalityGate(int first, int second) {
        return equalityGate(codeLiterals(first), codeLiterals(second));
    }

    private Prop equalityGate(List<Prop> first, List<Prop> second) {
        PropLanguage prop = context.prop();
        List<Prop> equivalences = new ArrayList<>(codeLength);
        for (int i = 0; i < codeLength; i++) {
            equivalences.add(prop.iff(first.get(i), second.get(i)));
        }
        return prop.fold(Tag.AND, equivalences);
    }

    /**
     * Adjacency of the vertices denoted by two terms. For edge and clique codes this holds iff the
     * codes differ and share a set bit; for direct and log codes it is a disjunction over the edges.
     */
    public Prop adjacencyGate(int first, int second) {
        PropLanguage prop = context.prop();
        List<Prop> x = codeLiterals(first);
        List<Prop> y = codeLiterals(second);
        List<Prop> disjuncts = new ArrayList<>();
        switch (scheme) {
            case EDGE:
            case CLIQUE: {
                for (int i = 0; i < codeLength; i++) {
                    disjuncts.add(prop.and(x.get(i), y.get(i)));
                }
                return prop.and(prop.fold(Tag.OR, disjuncts), prop.not(equalityGate(x, y)));
            }
            case DIRECT:
                for (List<Integer> edge : graph.edges()) {
                    int u = position(edge.get(0));
                    int v = position(edge.get(1));
                    disjuncts.add(prop.or(prop.and(x.get(u), y.get(v)), prop.and(x.get(v), y.get(u))));
                }
                return prop.fold(Tag.OR, disjuncts);
            case LOG:
                for (List<Integer> edge : graph.edges()) {
                    BitSet u = codes.get(position(edge.get(0)));
                    BitSet v = codes.get(position(edge.get(1)));
                    disjuncts.add(prop.or(
                            prop.and(codeMatch(x, u), codeMatch(y, v)), prop.and(codeMatch(x, v), codeMatch(y, u))));
                }
                return prop.fold(Tag.OR, disjuncts);
            default:
                throw new AssertionError();
        }
    }

    /** Whether the vertex denoted by the first term precedes the one of the second in the vertex list. */
    public Prop orderGate(int first, int second) {
        PropLanguage prop = context.prop();
        List<Prop> x = codeLiterals(first);
        List<Prop> y = codeLiterals(second);
        switch (scheme) {
            case LOG: {
                // Codes are increasing in the position, compare from the least significant bit upwards
                Prop less = prop.falseFormula();
                for (int i = 0; i < codeLength; i++) {
                    Prop strictly = prop.and(prop.not(x.get(i)), y.get(i));
                    less = i == 0 ? strictly : prop.or(strictly, prop.and(prop.iff(x.get(i), y.get(i)), less));
                }
                return less;
            }
            case DIRECT: {
                List<Prop> disjuncts = new ArrayList<>();
                Prop anyBefore = null;
                for (int j = 0; j < codeLength; j++) {
                    if (anyBefore != null) {
                        disjuncts.add(prop.and(y.get(j), anyBefore));
                    }
                    anyBefore = anyBefore == null ? x.get(j) : prop.or(anyBefore, x.get(j));
                }
                return prop.fold(Tag.OR, disjuncts);
            }
            case EDGE:
            case CLIQUE: {
                // x = c_k & (y = c_m for some m > k), sharing the suffix disjunctions
                List<Prop> disjuncts = new ArrayList<>();
                Prop anyAfter = null;
                for (int k = codes.size() - 1; k >= 0; k--) {
                    if (anyAfter != null) {
                        disjuncts.add(0, prop.and(codeMatch(x, codes.get(k)), anyAfter));
                    }
                    Prop match = codeMatch(y, codes.get(k));
                    anyAfter = anyAfter == null ? match : prop.or(match, anyAfter);
                }
                return prop.fold(Tag.OR, disjuncts);
            }
            default:
                throw new AssertionError();
        }
    }

    /** Returns the gate of the given relation. */
    public Prop relationGate(Tag relation, int first, int second) {
        switch (relation) {
            case EQUAL:
                return equalityGate(first, second);
            case ADJACENT:
                return adjacencyGate(first, second);
            case LESS:
                return orderGate(first, second);
            default:
                throw new IllegalArgumentException(relation + " is not a relation");
        }
    }

    /**
     * Restricts the bits of the variable to the code of some vertex. For direct encoding this states
     * that exactly one bit is set, for the other schemes it is a disjunction over all codes.
     *
     * @throws NameException
     *     If {@code variable} is not a variable.
     */
    public Prop domainConstraint(int variable) {
        checkVariable(variable);
        PropLanguage prop = context.prop();
        List<Prop> bits = codeLiterals(variable);
        if (scheme == Scheme.DIRECT) {
            List<Prop> exclusions = new ArrayList<>();
            for (int i = 0; i < codeLength; i++) {
                for (int j = i + 1; j < codeLength; j++) {
                    exclusions.add(prop.or(prop.not(bits.get(i)), prop.not(bits.get(j))));
                }
            }
            Prop atLeastOne = prop.fold(Tag.OR, bits);
            return exclusions.isEmpty() ? atLeastOne : prop.and(atLeastOne, prop.fold(Tag.AND, exclusions));
        }
        List<Prop> matches = new ArrayList<>(codes.size());
        for (BitSet code : codes) {
            matches.add(codeMatch(bits, code));
        }
        return prop.fold(Tag.OR, matches);
    }

    /**
     * Reconstructs the vertices assigned to first-order variables from an assignment of their bits.
     *
     * @param literals
     *     Signed symbol indices; literals not referring to bits {@code x@i} are ignored.
     * @return For each variable with bits in the assignment, in order of first occurrence, the constant
     *     of its vertex.
     * @throws DecodeException
     *     If a literal refers to an unknown symbol or a bit beyond the code length, if the literals
     *     conflict, or if the bits of a variable are incomplete or do not form a valid code.
     */
    public Map<Integer, Integer> decodeAssignment(int[] literals) {
        checkValid();
        SymbolTable symbols = context.symbols();
        Map<Integer, BitSet> assigned = new LinkedHashMap<>();
        Map<Integer, BitSet> values = new HashMap<>();
        for (int literal : literals) {
            int index = Math.abs(literal);
            if (!symbols.hasIndex(index)) {
                throw new DecodeException(String.format("Unknown symbol index %d", index));
            }
            String name = symbols.lookupName(index);
            int separator = name.lastIndexOf(BIT_SEPARATOR);
            if (separator < 0
                    || !symbols.hasName(name.substring(0, separator))
                    || !BIT_NUMBER.matcher(name.substring(separator + 1)).matches()) {
                continue;
            }
            int variable = symbols.lookupIndex(name.substring(0, separator));
            int bit = Integer.parseInt(name.substring(separator + 1));
            if (bit < 1 || bit > codeLength) {
                throw new DecodeException(String.format("Bit %s exceeds the code length %d", name, codeLength));
            }
            BitSet known = assigned.computeIfAbsent(variable, k -> new BitSet(codeLength));
            BitSet value = values.computeIfAbsent(variable, k -> new BitSet(codeLength));
            if (known.get(bit - 1) && value.get(bit - 1) != (literal > 0)) {
                throw new DecodeException(String.format("Conflicting values for %s", name));
            }
            known.set(bit - 1);
            value.set(bit - 1, literal > 0);
        }

        ImmutableMap.Builder<Integer, Integer> result = ImmutableMap.builder();
        for (Map.Entry<Integer, BitSet> entry : assigned.entrySet()) {
            int variable = entry.getKey();
            if (entry.getValue().cardinality() != codeLength) {
                throw new DecodeException(
                        String.format("Incomplete assignment of %s", symbols.lookupName(variable)));
            }
            Integer vertex = vertexOfCode.get(values.get(variable));
            if (vertex == null) {
                throw new DecodeException(String.format("Bits of %s do not form the code of a vertex: %s",
                        symbols.lookupName(variable), values.get(variable)));
            }
            result.put(variable, vertexToConstant(vertex));
        }
        return result.build();
    }

    private void checkVariable(int variable) {
        SymbolTable symbols = context.symbols();
        if (!symbols.hasIndex(variable) || !symbols.isVariable(variable)) {
            throw new NameException(String.format("Symbol %d is not a variable", variable));
        }
    }

    private void checkValid() {
        context.checkGeneration(generation);
    }

    @Override
    public String toString() {
        return String.format("DomainEncoding(%s, %d vertices, %d bits)", scheme, codes.size(), codeLength);
    }
}

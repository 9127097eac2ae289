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
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Conjunctive normal form of a conjunction of propositional formulas, obtained by the Tseitin
 * transformation.
 *
 * <p>Each input is {@link Formulas#reduce(Formula) reduced} first. Every distinct inner node of the
 * inputs then receives an auxiliary variable {@code a} together with clauses stating {@code a <->
 * op(b, c)}, and each input contributes a unit clause of its root. Internally, variables are the
 * symbol indices of the propositional variables and auxiliary variables are numbered from {@link
 * #baseIndex()} {@code + 1} on. Clauses use external indices {@code 1..N} instead: the variables of
 * the inputs in increasing order of their symbol index, followed by the auxiliary variables.
 */
public final class Cnf {
    private static final Logger logger = Logger.getLogger(Cnf.class.getName());

    private final List<Prop> formulas;
    @Nullable
    private final DomainEncoding encoding;
    private final SymbolTable symbols;
    private final int baseIndex;
    private final int[] internalOfExternal;
    private final Map<Integer, Integer> externalOfInternal;
    private final List<int[]> clauses;

    public Cnf(List<Prop> formulas) {
        this(formulas, null);
    }

    /**
     * Converts the conjunction of the given formulas.
     *
     * @param formulas
     *     A non-empty list of formulas of the same context.
     * @param encoding
     *     If present, the codes of the vertices are added as comments to the output of {@link
     *     #write(Writer)}.
     */
    public Cnf(List<Prop> formulas, @Nullable DomainEncoding encoding) {
        checkArgument(!formulas.isEmpty(), "No formula given");
        FormulaContext context = formulas.get(0).context();
        for (Prop formula : formulas) {
            checkArgument(formula.context() == context, "Formulas belong to different contexts");
        }
        checkArgument(encoding == null || encoding.context() == context,
                "Encoding belongs to a different context");
        this.formulas = ImmutableList.copyOf(formulas);
        this.encoding = encoding;
        this.symbols = context.symbols();

        List<Prop> reduced = new ArrayList<>(formulas.size());
        for (Prop formula : formulas) {
            reduced.add(Formulas.reduce(formula));
        }

        // Variables removed by reduction still bound the auxiliary range
        int largestVariable = 0;
        for (Prop formula : formulas) {
            largestVariable = Math.max(largestVariable, Formulas.<Prop, Integer>fold(formula, f -> true,
                    (node, children) -> {
                        int largest = node.isVariable() ? node.variable() : 0;
                        for (int child : children) {
                            largest = Math.max(largest, child);
                        }
                        return largest;
                    }));
        }
        this.baseIndex = largestVariable;

        List<int[]> internalClauses = new ArrayList<>();
        TreeSet<Integer> baseVariables = new TreeSet<>();
        if (reduced.stream().anyMatch(Formula::isFalse)) {
            internalClauses.add(new int[0]);
        } else {
            for (Prop formula : reduced) {
                Formulas.<Prop, Boolean>fold(formula, f -> true, (node, children) -> {
                    if (node.isVariable()) {
                        baseVariables.add(node.variable());
                    }
                    return Boolean.TRUE;
                });
            }
            Tseitin tseitin = new Tseitin(baseIndex, internalClauses);
            for (Prop formula : reduced) {
                if (formula.isTrue()) {
                    continue;
                }
                internalClauses.add(new int[] {tseitin.literal(formula)});
            }
        }

        // Base variables keep their relative order, auxiliary variables follow
        int auxiliaryCount = internalClauses.stream()
                .flatMapToInt(Arrays::stream)
                .map(Math::abs)
                .filter(variable -> variable > baseIndex)
                .max()
                .orElse(baseIndex) - baseIndex;
        this.internalOfExternal = new int[baseVariables.size() + auxiliaryCount + 1];
        this.externalOfInternal = new HashMap<>();
        int external = 0;
        for (int variable : baseVariables) {
            external += 1;
            internalOfExternal[external] = variable;
            externalOfInternal.put(variable, external);
        }
        for (int auxiliary = baseIndex + 1; auxiliary <= baseIndex + auxiliaryCount; auxiliary++) {
            external += 1;
            internalOfExternal[external] = auxiliary;
            externalOfInternal.put(auxiliary, external);
        }

        ImmutableList.Builder<int[]> renumbered = ImmutableList.builder();
        for (int[] clause : internalClauses) {
            int[] result = new int[clause.length];
            for (int i = 0; i < clause.length; i++) {
                int variable = externalOfInternal.get(Math.abs(clause[i]));
                result[i] = clause[i] > 0 ? variable : -variable;
            }
            renumbered.add(result);
        }
        this.clauses = renumbered.build();
        logger.log(Level.FINE, "Created CNF with {0} variables ({1} auxiliary) and {2} clauses", new Object[] {
            numberOfVariables(), auxiliaryCount, clauses.size()
        });
    }

    /** Number of external variables, which are numbered {@code 1..N}. */
    public int numberOfVariables() {
        return internalOfExternal.length - 1;
    }

    public int numberOfClauses() {
        return clauses.size();
    }

    /** Returns a copy of the clause at the given position, in external indices. */
    public int[] clause(int position) {
        return clauses.get(position).clone();
    }

    /**
     * The largest symbol index of a variable occurring in the inputs, or 0 if there is none. Variables
     * removed by reduction count as well but have no external index.
     */
    public int baseIndex() {
        return baseIndex;
    }

    /**
     * Returns the external index of an internal variable.
     *
     * @throws IllegalArgumentException
     *     If the variable does not occur in the CNF.
     */
    public int externalIndex(int internal) {
        Integer external = externalOfInternal.get(internal);
        checkArgument(external != null, "Variable %d does not occur", internal);
        return external;
    }

    /**
     * Returns the internal index of an external variable.
     *
     * @throws IllegalArgumentException
     *     If the index is not in {@code 1..N}.
     */
    public int internalIndex(int external) {
        checkArgument(1 <= external && external <= numberOfVariables(), "Invalid external index %d", external);
        return internalOfExternal[external];
    }

    /**
     * Translates an assignment of external variables back to the symbols of the inputs. Literals of
     * auxiliary variables are dropped.
     *
     * @throws DecodeException
     *     If a literal is 0 or exceeds the number of variables.
     */
    public int[] decodeAssignment(int[] literals) {
        int[] result = new int[literals.length];
        int size = 0;
        for (int literal : literals) {
            int external = Math.abs(literal);
            if (external == 0 || external > numberOfVariables()) {
                throw new DecodeException(String.format("Invalid literal %d", literal));
            }
            int internal = internalOfExternal[external];
            if (internal <= baseIndex) {
                result[size] = literal > 0 ? internal : -internal;
                size += 1;
            }
        }
        return Arrays.copyOf(result, size);
    }

    /** Writes the CNF in DIMACS format, annotated with the inputs, the vertex codes and variable names. */
    public void write(Writer writer) throws IOException {
        writer.write(String.format("p cnf %d %d%n", numberOfVariables(), numberOfClauses()));
        for (Prop formula : formulas) {
            writer.write("c expr " + formula + System.lineSeparator());
        }
        if (encoding != null) {
            for (int vertex : encoding.vertices()) {
                StringBuilder line = new StringBuilder(32);
                line.append("c dom ").append(symbols.lookupName(encoding.vertexToConstant(vertex))).append(':');
                BitSet code = encoding.code(vertex);
                for (int bit = 0; bit < encoding.codeLength(); bit++) {
                    line.append(' ').append(code.get(bit) ? 1 : 0);
                }
                writer.write(line.append(System.lineSeparator()).toString());
            }
        }
        for (int external = 1; external <= numberOfVariables(); external++) {
            int internal = internalOfExternal[external];
            if (internal <= baseIndex) {
                writer.write(String.format("c enc %d %s%n", external, symbols.lookupName(internal)));
            }
        }
        for (int[] clause : clauses) {
            StringBuilder line = new StringBuilder(clause.length * 4 + 2);
            for (int literal : clause) {
                line.append(literal).append(' ');
            }
            writer.write(line.append('0').append(System.lineSeparator()).toString());
        }
        writer.flush();
    }

    @Override
    public String toString() {
        return String.format("Cnf(%d variables, %d clauses)", numberOfVariables(), numberOfClauses());
    }

    private static final class Tseitin {
        private final List<int[]> clauses;
        private final Map<Prop, Integer> literals = new HashMap<>();
        private int nextAuxiliary;

        Tseitin(int baseIndex, List<int[]> clauses) {
            this.nextAuxiliary = baseIndex + 1;
            this.clauses = clauses;
        }

        int literal(Prop formula) {
            return Formulas.<Prop, Integer>fold(formula, f -> !literals.containsKey(f), (node, children) -> {
                Integer known = literals.get(node);
                if (known != null) {
                    return known;
                }
                int literal = define(node, children);
                literals.put(node, literal);
                return literal;
            });
        }

        private int define(Prop node, List<Integer> children) {
            if (node.isVariable()) {
                return node.variable();
            }
            int a = nextAuxiliary;
            nextAuxiliary += 1;
            switch (node.tag()) {
                case TRUE:
                    add(a);
                    break;
                case FALSE:
                    add(-a);
                    break;
                case NOT: {
                    int b = children.get(0);
                    add(-a, -b);
                    add(a, b);
                    break;
                }
                case AND: {
                    int b = children.get(0);
                    int c = children.get(1);
                    add(-a, b);
                    add(-a, c);
                    add(a, -b, -c);
                    break;
                }
                case OR:
                case IMPLIES: {
                    int b = node.tag() == Tag.IMPLIES ? -children.get(0) : children.get(0);
                    int c = children.get(1);
                    add(a, -b);
                    add(a, -c);
                    add(-a, b, c);
                    break;
                }
                case IFF: {
                    int b = children.get(0);
                    int c = children.get(1);
                    add(-a, -b, c);
                    add(-a, b, -c);
                    add(a, b, c);
                    add(a, -b, -c);
                    break;
                }
                default:
                    throw new AssertionError("Unexpected " + node.tag());
            }
            return a;
        }

        private void add(int... clause) {
            clauses.add(clause);
        }
    }
}

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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Encodings of cardinality constraints over propositional formulas. */
public final class CardinalityConstraints {
    private CardinalityConstraints() {}

    /**
     * Returns a formula stating that at most {@code bound} of the given formulas hold, following the
     * totalizer construction of Bailleux and Boufkhad.
     *
     * <p>The operands are the leaves of a complete binary tree, with node {@code k} having children
     * {@code 2k} and {@code 2k + 1}. For each inner node, auxiliary variables {@code b(k, i)}
     * express that at least {@code i} of the leaves below {@code k} hold; the counts are capped at
     * {@code bound + 1}. Auxiliary variables are fresh symbols of the context.
     *
     * @throws IllegalArgumentException
     *     If no operand is given.
     */
    public static Prop atMost(FormulaContext context, List<Prop> operands, int bound) {
        checkArgument(!operands.isEmpty(), "No operand given");
        PropLanguage prop = context.prop();
        int n = operands.size();
        if (bound < 0) {
            return prop.falseFormula();
        }
        if (bound >= n) {
            return prop.trueFormula();
        }
        if (bound == 0) {
            List<Prop> negations = new ArrayList<>(n);
            for (Prop operand : operands) {
                negations.add(prop.not(operand));
            }
            return prop.fold(Tag.AND, negations);
        }

        Totalizer totalizer = new Totalizer(context, operands, bound);
        // Capacity of each subtree, leaves hold one operand each
        int[] capacity = new int[2 * n];
        for (int k = 2 * n - 1; k >= n; k--) {
            capacity[k] = 1;
        }
        for (int k = n - 1; k >= 1; k--) {
            capacity[k] = Math.min(bound, capacity[2 * k] + capacity[2 * k + 1]);
        }

        List<Prop> clauses = new ArrayList<>();
        for (int k = 2; k < n; k++) {
            for (int i = 0; i <= capacity[2 * k]; i++) {
                for (int j = 0; j <= capacity[2 * k + 1]; j++) {
                    if (i + j < 1 || i + j > capacity[k] + 1) {
                        continue;
                    }
                    clauses.add(prop.or(
                            prop.or(prop.not(totalizer.count(2 * k, i)), prop.not(totalizer.count(2 * k + 1, j))),
                            totalizer.count(k, i + j)));
                }
            }
        }
        // At the root, bound + 1 leaves must not hold
        for (int i = 0; i <= capacity[2]; i++) {
            int j = bound + 1 - i;
            if (0 <= j && j <= capacity[3]) {
                clauses.add(prop.or(prop.not(totalizer.count(2, i)), prop.not(totalizer.count(3, j))));
            }
        }
        return prop.fold(Tag.AND, clauses);
    }

    private static final class Totalizer {
        private final FormulaContext context;
        private final List<Prop> operands;
        private final int bound;
        private final Map<Long, Prop> counts = new HashMap<>();

        Totalizer(FormulaContext context, List<Prop> operands, int bound) {
            this.context = context;
            this.operands = operands;
            this.bound = bound;
        }

        Prop count(int node, int atLeast) {
            PropLanguage prop = context.prop();
            if (atLeast == 0) {
                return prop.trueFormula();
            }
            if (atLeast == bound + 1) {
                return prop.falseFormula();
            }
            int n = operands.size();
            if (node >= n) {
                assert atLeast == 1;
                return operands.get(node - n);
            }
            long key = ((long) node << Integer.SIZE) | atLeast;
            return counts.computeIfAbsent(key, k -> prop.variable(context.symbols().newAuxiliaryIndex()));
        }
    }
}

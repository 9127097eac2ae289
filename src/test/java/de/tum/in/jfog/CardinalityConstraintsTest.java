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

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class CardinalityConstraintsTest {
    private static List<Prop> variables(FormulaContext context, int count) {
        List<Prop> variables = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            variables.add(context.prop().variable("p@" + i));
        }
        return variables;
    }

    @Test
    public void testTrivialBounds() {
        FormulaContext context = FormulaFactory.createContext();
        List<Prop> variables = variables(context, 3);
        assertThat(CardinalityConstraints.atMost(context, variables, -1).isFalse(), is(true));
        assertThat(CardinalityConstraints.atMost(context, variables, 3).isTrue(), is(true));
        assertThat(CardinalityConstraints.atMost(context, variables, 5).isTrue(), is(true));
        assertThat(CardinalityConstraints.atMost(context, variables, 0).toString(),
                is("(((~ p@1) & (~ p@2)) & (~ p@3))"));
        assertThat(CardinalityConstraints.atMost(context, variables.subList(0, 2), 1).toString(),
                is("((~ p@1) | (~ p@2))"));
        assertThrows(IllegalArgumentException.class, () -> CardinalityConstraints.atMost(context, List.of(), 1));
    }

    @Test
    public void testAuxiliaryVariables() {
        FormulaContext context = FormulaFactory.createContext();
        SymbolTable symbols = context.symbols();
        int before = symbols.size();
        CardinalityConstraints.atMost(context, variables(context, 6), 2);
        assertThat(symbols.size() > before + 6, is(true));
        for (int index = before + 7; index <= symbols.size(); index++) {
            assertThat(symbols.isAuxiliary(index), is(true));
        }
    }

    @Test
    public void testSemantics() {
        for (int size = 1; size <= 7; size++) {
            for (int bound = 0; bound < size; bound++) {
                FormulaContext context = FormulaFactory.createContext();
                List<Prop> variables = variables(context, size);
                Prop constraint = CardinalityConstraints.atMost(context, variables, bound);
                for (int assignment = 0; assignment < (1 << size); assignment++) {
                    List<Prop> inputs = new ArrayList<>();
                    inputs.add(constraint);
                    for (int i = 0; i < size; i++) {
                        boolean value = (assignment & (1 << i)) != 0;
                        inputs.add(value ? variables.get(i) : context.prop().not(variables.get(i)));
                    }
                    String message = String.format("%d of %d, assignment %s", bound, size,
                            Integer.toBinaryString(assignment));
                    assertThat(message, ModelCounter.isSatisfiable(new Cnf(inputs)),
                            is(Integer.bitCount(assignment) <= bound));
                }
            }
        }
    }
}

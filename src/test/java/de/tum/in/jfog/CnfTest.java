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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.jfog.DomainEncoding.Scheme;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class CnfTest {
    static Stream<String> formulas() {
        return Stream.of(
                "a@1",
                "(a@1 <-> b@1) | (c@1 & ~ a@1)",
                "a@1 -> b@1 -> c@1",
                "~ (a@1 & b@1) <-> (c@1 | ~ b@1)",
                "(a@1 | b@1) & (a@1 | ~ b@1) & (~ a@1 | c@1)");
    }

    private static String write(Cnf cnf) throws IOException {
        StringWriter writer = new StringWriter();
        cnf.write(writer);
        return writer.toString();
    }

    private static List<String> lines(Cnf cnf) throws IOException {
        return Arrays.asList(write(cnf).split("\\R"));
    }

    @Test
    public void testTseitin() throws FormulaSyntaxException, IOException {
        FormulaContext context = FormulaFactory.createContext();
        Cnf cnf = new Cnf(List.of(context.readProp("x@1 & ~ y@1")));
        assertThat(cnf.numberOfVariables(), is(4));
        assertThat(cnf.numberOfClauses(), is(6));
        assertThat(cnf.baseIndex(), is(2));
        assertThat(lines(cnf), contains(
                "p cnf 4 6",
                "c expr (x@1 & (~ y@1))",
                "c enc 1 x@1",
                "c enc 2 y@1",
                "-3 -2 0",
                "3 2 0",
                "-4 1 0",
                "-4 3 0",
                "4 -1 -3 0",
                "4 0"));
    }

    @Test
    public void testNumbering() throws FormulaSyntaxException {
        FormulaContext context = FormulaFactory.createContext();
        SymbolTable symbols = context.symbols();
        int a = symbols.lookupIndex("a@1");
        symbols.lookupIndex("b@1");
        int c = symbols.lookupIndex("c@1");
        Cnf cnf = new Cnf(List.of(context.readProp("c@1 | a@1")));
        assertThat(cnf.baseIndex(), is(c));
        assertThat(cnf.numberOfVariables(), is(3));
        assertThat(cnf.externalIndex(a), is(1));
        assertThat(cnf.externalIndex(c), is(2));
        assertThat(cnf.internalIndex(3), is(c + 1));
        assertThrows(IllegalArgumentException.class, () -> cnf.externalIndex(2));
        assertThrows(IllegalArgumentException.class, () -> cnf.internalIndex(4));
        assertThat(cnf.clause(0), is(new int[] {3, -2}));
        assertThat(cnf.clause(2), is(new int[] {-3, 2, 1}));
        assertThat(cnf.clause(3), is(new int[] {3}));

        // Clauses are copies
        cnf.clause(3)[0] = 0;
        assertThat(cnf.clause(3), is(new int[] {3}));

        assertThat(cnf.decodeAssignment(new int[] {1, -2, 3}), is(new int[] {a, -c}));
        assertThrows(DecodeException.class, () -> cnf.decodeAssignment(new int[] {0}));
        assertThrows(DecodeException.class, () -> cnf.decodeAssignment(new int[] {-4}));
    }

    @Test
    public void testReducedVariablesKeepTheirIndex() throws FormulaSyntaxException, IOException {
        FormulaContext context = FormulaFactory.createContext();
        Cnf cnf = new Cnf(List.of(context.readProp("(x@1 & z@1) & (y@1 | T)")));
        SymbolTable symbols = context.symbols();
        int y = symbols.lookupIndex("y@1");
        assertThat(y, is(3));
        assertThat(cnf.baseIndex(), is(y));
        assertThat(cnf.numberOfVariables(), is(3));
        assertThrows(IllegalArgumentException.class, () -> cnf.externalIndex(y));
        assertThat(cnf.internalIndex(3), is(y + 1));
        assertThat(cnf.decodeAssignment(new int[] {1, -2, 3}), is(new int[] {1, -2}));
        assertThat(lines(cnf), contains(
                "p cnf 3 4",
                "c expr ((x@1 & z@1) & (y@1 | T))",
                "c enc 1 x@1",
                "c enc 2 z@1",
                "-3 1 0",
                "-3 2 0",
                "3 -1 -2 0",
                "3 0"));
    }

    @Test
    public void testConstantInputs() throws FormulaSyntaxException, IOException {
        FormulaContext context = FormulaFactory.createContext();
        Cnf unsatisfiable = new Cnf(List.of(context.readProp("x@1"), context.readProp("x@1 & F")));
        assertThat(unsatisfiable.numberOfVariables(), is(0));
        assertThat(unsatisfiable.numberOfClauses(), is(1));
        assertThat(unsatisfiable.clause(0).length, is(0));
        assertThat(lines(unsatisfiable), contains("p cnf 0 1", "c expr x@1", "c expr (x@1 & F)", "0"));
        assertThat(ModelCounter.count(unsatisfiable), is(0L));

        Cnf valid = new Cnf(List.of(context.readProp("x@1 | T"), context.prop().trueFormula()));
        assertThat(valid.numberOfVariables(), is(0));
        assertThat(valid.numberOfClauses(), is(0));

        Cnf partial = new Cnf(List.of(context.readProp("T"), context.readProp("x@1")));
        assertThat(partial.numberOfClauses(), is(1));
        assertThat(partial.clause(0), is(new int[] {1}));

        assertThrows(IllegalArgumentException.class, () -> new Cnf(List.of()));
    }

    @Test
    public void testWriteWithEncoding() throws FormulaSyntaxException, IOException {
        FormulaContext context = FormulaFactory.createContext();
        DomainEncoding encoding = DomainEncoding.create(
                context, List.of(1, 2, 3), List.of(List.of(1, 2), List.of(2, 3)), Scheme.EDGE, "V");
        Prop formula = BooleanEncoder.encode(context.readFog("edg(x, V1)"), encoding);
        List<String> lines = lines(new Cnf(List.of(formula), encoding));
        assertThat(lines.subList(1, 6), contains(
                "c expr " + formula,
                "c dom V1: 1 0",
                "c dom V2: 1 1",
                "c dom V3: 0 1",
                "c enc 1 x@1"));
        assertThat(lines.get(6), is("c enc 2 x@2"));
    }

    @ParameterizedTest
    @MethodSource("formulas")
    public void testModelCount(String text) throws FormulaSyntaxException {
        FormulaContext context = FormulaFactory.createContext();
        Prop formula = context.readProp(text);
        Cnf cnf = new Cnf(List.of(formula));
        List<Integer> variables = new ArrayList<>();
        for (int external = 1; external <= cnf.numberOfVariables(); external++) {
            if (cnf.internalIndex(external) <= cnf.baseIndex()) {
                variables.add(cnf.internalIndex(external));
            }
        }

        long expected = 0;
        for (int assignment = 0; assignment < (1 << variables.size()); assignment++) {
            Set<Integer> model = new HashSet<>();
            for (int i = 0; i < variables.size(); i++) {
                if ((assignment & (1 << i)) != 0) {
                    model.add(variables.get(i));
                }
            }
            if (Evaluator.evaluate(formula, model)) {
                expected += 1;
            }
        }
        assertThat(ModelCounter.count(cnf), is(expected));
    }
}

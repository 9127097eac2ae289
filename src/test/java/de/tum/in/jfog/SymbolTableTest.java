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
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.lang.reflect.Modifier;
import org.junit.jupiter.api.Test;

public class SymbolTableTest {
    @Test
    public void testLookup() {
        SymbolTable symbols = FormulaFactory.createContext().symbols();
        int x = symbols.lookupIndex("x");
        int constant = symbols.lookupIndex("V1");
        assertThat(x, is(1));
        assertThat(constant, is(2));
        assertThat(symbols.lookupIndex("x"), is(x));
        assertThat(symbols.lookupName(constant), is("V1"));
        assertThat(symbols.isVariable(x), is(true));
        assertThat(symbols.isConstant(constant), is(true));
        assertThat(symbols.isConstant(x), is(false));
        assertThat(symbols.size(), is(2));
    }

    @Test
    public void testInvalidNames() {
        SymbolTable symbols = FormulaFactory.createContext().symbols();
        assertThrows(NameException.class, () -> symbols.lookupIndex(""));
        assertThrows(NameException.class, () -> symbols.lookupIndex("1x"));
        assertThrows(NameException.class, () -> symbols.lookupIndex("_1"));
        assertThrows(IndexOutOfBoundsException.class, () -> symbols.lookupName(1));
        assertThrows(IndexOutOfBoundsException.class, () -> symbols.lookupName(0));
    }

    @Test
    public void testAuxiliary() {
        SymbolTable symbols = FormulaFactory.createContext().symbols();
        int first = symbols.newAuxiliaryIndex();
        int second = symbols.newAuxiliaryIndex();
        assertThat(first == second, is(false));
        assertThat(symbols.isAuxiliary(first), is(true));
        assertThat(symbols.isVariable(first), is(false));
        assertThat(symbols.isConstant(first), is(false));
        assertThat(symbols.lookupName(first), startsWith("_"));
        // Registered auxiliary names can be looked up again
        assertThat(symbols.lookupIndex(symbols.lookupName(second)), is(second));
    }

    @Test
    public void testClear() {
        FormulaContext context = FormulaFactory.createContext();
        SymbolTable symbols = context.symbols();
        symbols.lookupIndex("x");
        symbols.newAuxiliaryIndex();
        context.clear();
        assertThat(symbols.size(), is(0));
        assertThat(symbols.hasName("x"), is(false));
        assertThat(symbols.lookupIndex("y"), is(1));
        assertThat(symbols.lookupName(symbols.newAuxiliaryIndex()), is("_1"));
    }

    @Test
    public void testClearOnlyThroughContext() throws NoSuchMethodException {
        assertThat(Modifier.isPublic(SymbolTable.class.getDeclaredMethod("clear").getModifiers()), is(false));
        assertThat(Modifier.isPublic(FormulaContext.class.getDeclaredMethod("clear").getModifiers()), is(true));
    }
}

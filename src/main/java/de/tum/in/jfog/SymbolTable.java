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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interns symbol names as dense positive indices.
 *
 * <p>The kind of a symbol is determined by the first character of its name: a lowercase letter
 * denotes a variable, an uppercase letter a constant, and the reserved marker {@value
 * #AUXILIARY_MARKER} an auxiliary symbol. Auxiliary symbols are only created through {@link
 * #newAuxiliaryIndex()}; looking up such a name which is not yet registered is an error.
 *
 * <p>Indices are assigned in order of first lookup, starting at 1. The table is not thread-safe.
 */
public final class SymbolTable {
    public static final char AUXILIARY_MARKER = '_';

    private final Map<String, Integer> indices = new HashMap<>();
    private final List<String> names = new ArrayList<>();
    private int auxiliaryCounter = 0;

    SymbolTable() {}

    /**
     * Returns the index of the given name, registering the name if necessary.
     *
     * @throws NameException
     *     If the name does not start with a letter, or is an auxiliary name which was not minted
     *     by this table.
     */
    public int lookupIndex(String name) {
        Integer index = indices.get(name);
        if (index != null) {
            return index;
        }
        if (name.isEmpty()) {
            throw new NameException("Empty symbol name");
        }
        char first = name.charAt(0);
        if (first == AUXILIARY_MARKER) {
            throw new NameException(String.format("Auxiliary name %s is not registered", name));
        }
        if (!isAsciiLetter(first)) {
            throw new NameException(String.format("Symbol name %s has to start with a letter", name));
        }
        return register(name);
    }

    /**
     * Returns the name of the given index.
     *
     * @throws IndexOutOfBoundsException
     *     If the index is not registered.
     */
    public String lookupName(int index) {
        if (!hasIndex(index)) {
            throw new IndexOutOfBoundsException(String.format("Unknown symbol index %d", index));
        }
        return names.get(index - 1);
    }

    public boolean hasIndex(int index) {
        return 1 <= index && index <= names.size();
    }

    public boolean hasName(String name) {
        return indices.containsKey(name);
    }

    public boolean isVariable(int index) {
        return Character.isLowerCase(lookupName(index).charAt(0));
    }

    public boolean isConstant(int index) {
        return Character.isUpperCase(lookupName(index).charAt(0));
    }

    public boolean isAuxiliary(int index) {
        return lookupName(index).charAt(0) == AUXILIARY_MARKER;
    }

    /** Mints a fresh auxiliary symbol whose name has never been used in this table. */
    public int newAuxiliaryIndex() {
        String name;
        do {
            auxiliaryCounter += 1;
            name = AUXILIARY_MARKER + Integer.toString(auxiliaryCounter);
        } while (indices.containsKey(name));
        return register(name);
    }

    /** Number of registered symbols, which is also the largest issued index. */
    public int size() {
        return names.size();
    }

    /** Drops all symbols. Only called through {@link FormulaContext#clear()}, which also drops the formulas. */
    void clear() {
        indices.clear();
        names.clear();
        auxiliaryCounter = 0;
    }

    private int register(String name) {
        names.add(name);
        int index = names.size();
        indices.put(name, index);
        return index;
    }

    private static boolean isAsciiLetter(char c) {
        return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z');
    }

    @Override
    public String toString() {
        return String.format("SymbolTable(%d symbols)", names.size());
    }
}

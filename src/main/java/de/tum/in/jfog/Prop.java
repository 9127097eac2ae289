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

/** A propositional formula: constants, variables and the Boolean connectives. */
public final class Prop extends Formula<Prop> {
    Prop(PropLanguage language, int node) {
        super(language, node);
    }

    public boolean isVariable() {
        return tag() == Tag.VARIABLE;
    }

    /** The symbol index of a propositional variable. */
    public int variable() {
        checkValid();
        if (tag() != Tag.VARIABLE) {
            throw new IllegalStateException(tag() + " is not a variable");
        }
        return first();
    }
}

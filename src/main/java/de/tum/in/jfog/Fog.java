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

/**
 * A formula of the first-order logic of graphs, built from equality, adjacency and order atoms over
 * variables and constants, the Boolean connectives and quantifiers.
 */
public final class Fog extends Formula<Fog> {
    Fog(FogLanguage language, int node) {
        super(language, node);
    }

    public boolean isRelation() {
        return tag().isRelation();
    }

    /** The first term of a relation atom. */
    public int firstTerm() {
        checkRelation();
        return first();
    }

    /** The second term of a relation atom. */
    public int secondTerm() {
        checkRelation();
        return second();
    }

    /** The variable bound by a quantifier. */
    public int boundVariable() {
        checkValid();
        if (!tag().isQuantifier()) {
            throw new IllegalStateException(tag() + " is not a quantifier");
        }
        return first();
    }

    private void checkRelation() {
        checkValid();
        if (!tag().isRelation()) {
            throw new IllegalStateException(tag() + " is not a relation atom");
        }
    }
}

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

/** The node kinds of all formula languages. */
public enum Tag {
    TRUE("T"),
    FALSE("F"),
    /** Propositional variable, refers to a symbol. */
    VARIABLE(""),
    EQUAL("="),
    ADJACENT("edg"),
    LESS("<"),
    NOT("~"),
    AND("&"),
    OR("|"),
    IMPLIES("->"),
    IFF("<->"),
    FORALL("!"),
    EXISTS("?");

    private final String symbol;

    Tag(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isConstant() {
        return this == TRUE || this == FALSE;
    }

    /** Whether nodes of this kind have no formula children. */
    public boolean isLeaf() {
        return ordinal() <= LESS.ordinal();
    }

    /** Whether nodes of this kind relate two terms. */
    public boolean isRelation() {
        return this == EQUAL || this == ADJACENT || this == LESS;
    }

    public boolean isBinary() {
        return this == AND || this == OR || this == IMPLIES || this == IFF;
    }

    public boolean isQuantifier() {
        return this == FORALL || this == EXISTS;
    }

    /** The dual connective with respect to negation, defined for AND, OR and the quantifiers. */
    public Tag dual() {
        switch (this) {
            case AND:
                return OR;
            case OR:
                return AND;
            case FORALL:
                return EXISTS;
            case EXISTS:
                return FORALL;
            case TRUE:
                return FALSE;
            case FALSE:
                return TRUE;
            default:
                throw new IllegalStateException("No dual of " + this);
        }
    }
}

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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A hash-consed formula node.
 *
 * <p>Formulas are immutable and canonical: every structurally identical formula of the same
 * language and context is represented by the same object, hence equality is reference equality.
 * Equality is purely syntactic, re-associated but logically equivalent formulas are distinct.
 *
 * <p>A formula stays usable until its context is {@link FormulaContext#clear() cleared}. Afterwards
 * every access throws an {@link IllegalStateException}.
 *
 * @param <F>
 *     The concrete formula class.
 */
public abstract class Formula<F extends Formula<F>> {
    private final AbstractLanguage<F> language;
    private final int node;
    private final Tag tag;
    private final int generation;

    Formula(AbstractLanguage<F> language, int node) {
        this.language = language;
        this.node = node;
        this.tag = language.table().tag(node);
        this.generation = language.context().generation();
    }

    /** The language this formula belongs to. */
    public TermLanguage<F> language() {
        return language;
    }

    public FormulaContext context() {
        return language.context();
    }

    public Tag tag() {
        return tag;
    }

    /** The handle of this node in the term table of its context. */
    public int node() {
        return node;
    }

    public boolean isLeaf() {
        return tag.isLeaf();
    }

    public boolean isTrue() {
        return tag == Tag.TRUE;
    }

    public boolean isFalse() {
        return tag == Tag.FALSE;
    }

    public boolean isNegation() {
        return tag == Tag.NOT;
    }

    public boolean isBinary() {
        return tag.isBinary();
    }

    public boolean isQuantifier() {
        return tag.isQuantifier();
    }

    /** The operand of a negation or the body of a quantifier. */
    public F operand() {
        checkValid();
        if (tag == Tag.NOT) {
            return language.formula(first());
        }
        if (tag.isQuantifier()) {
            return language.formula(second());
        }
        throw new IllegalStateException(tag + " has no single operand");
    }

    public F left() {
        checkBinary();
        return language.formula(first());
    }

    public F right() {
        checkBinary();
        return language.formula(second());
    }

    /** The sub-formulas of this node, in left-to-right order. */
    public List<F> children() {
        checkValid();
        if (tag.isLeaf()) {
            return ImmutableList.of();
        }
        if (tag.isBinary()) {
            return ImmutableList.of(language.formula(first()), language.formula(second()));
        }
        return ImmutableList.of(operand());
    }

    int first() {
        return language.table().first(node);
    }

    int second() {
        return language.table().second(node);
    }

    final void checkValid() {
        if (generation != language.context().generation()) {
            throw new IllegalStateException("Formula was created before its context was cleared");
        }
    }

    private void checkBinary() {
        checkValid();
        if (!tag.isBinary()) {
            throw new IllegalStateException(tag + " is not a binary connective");
        }
    }

    @Override
    public String toString() {
        checkValid();
        return Formulas.toString(this);
    }
}

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

import java.util.List;
import javax.annotation.Nullable;

/**
 * A formula language, i.e. a fixed set of node kinds together with canonical constructors.
 *
 * <p>This interface is all the generic algorithms in {@link Formulas} need to know about a
 * language: which nodes are leaves, what the children of a node are, and how to rebuild a node with
 * new children. All constructors are pure and return canonical objects, calling a constructor twice
 * with the same arguments yields the identical object.
 *
 * @param <F>
 *     The formula class of this language.
 */
public interface TermLanguage<F extends Formula<F>> {
    /** The context which owns all formulas of this language. */
    FormulaContext context();

    /**
     * Determines whether the given formula is a leaf of this language, i.e. has no sub-formulas.
     *
     * @param formula
     *     The formula to be checked.
     * @return If the formula is a constant or an atom.
     */
    boolean isLeaf(F formula);

    /**
     * Returns the sub-formulas of the given formula, in left-to-right order.
     *
     * @param formula
     *     The formula whose children are obtained.
     * @return The children, empty for leaves.
     */
    List<F> children(F formula);

    /**
     * Creates a formula with the same node kind and non-formula data (e.g. bound variable) as the
     * given template, but with the given children.
     *
     * @param template
     *     The formula whose kind is copied.
     * @param children
     *     The new children, of the same number as the children of {@code template}.
     * @return The canonical rebuilt formula, which is {@code template} itself if the children are
     *     unchanged.
     */
    default F rebuild(F template, List<F> children) {
        return rebuild(template.tag(), template, children);
    }

    /**
     * Creates a formula of the given kind with the non-formula data of the template and the given
     * children. This is used to switch between dual connectives or quantifiers.
     *
     * @param tag
     *     The kind of the new node, which needs the same arity as the template.
     * @param template
     *     The formula whose non-formula data is copied.
     * @param children
     *     The new children.
     * @return The canonical rebuilt formula.
     */
    F rebuild(Tag tag, F template, List<F> children);

    /**
     * Simplifies a leaf with the atom-level identities of this language.
     *
     * @param leaf
     *     The leaf to simplify.
     * @param structure
     *     The structure in which atoms over constants are evaluated, may be {@code null}.
     * @return The simplified leaf, or {@code leaf} itself if no rule applies.
     */
    F simplifyLeaf(F leaf, @Nullable DomainEncoding structure);

    F trueFormula();

    F falseFormula();

    /** Returns the constant formula of the given truth value. */
    default F constant(boolean value) {
        return value ? trueFormula() : falseFormula();
    }

    F not(F formula);

    /**
     * Creates a binary connective.
     *
     * @param tag
     *     One of {@link Tag#AND}, {@link Tag#OR}, {@link Tag#IMPLIES}, {@link Tag#IFF}.
     */
    F binary(Tag tag, F left, F right);

    default F and(F left, F right) {
        return binary(Tag.AND, left, right);
    }

    default F or(F left, F right) {
        return binary(Tag.OR, left, right);
    }

    default F implies(F left, F right) {
        return binary(Tag.IMPLIES, left, right);
    }

    default F iff(F left, F right) {
        return binary(Tag.IFF, left, right);
    }

    /**
     * Combines the given operands with a binary connective, folding to the left: {@code [a, b, c]}
     * becomes {@code ((a op b) op c)}. An empty list of conjuncts yields {@code T}, an empty list of
     * disjuncts {@code F}.
     */
    F leftFold(Tag tag, List<F> operands);

    /**
     * Combines the given operands with a binary connective by recursive bisection: {@code [a, b,
     * c]} becomes {@code (a op (b op c))} and {@code [a, b, c, d]} becomes {@code ((a op b) op (c op
     * d))}. Empty lists are treated as in {@link #leftFold(Tag, List)}.
     */
    F balanced(Tag tag, List<F> operands);

    /**
     * Combines the given operands with a binary connective according to the association mode of
     * the context.
     *
     * @see FormulaConfiguration#balancedAssociation()
     */
    default F fold(Tag tag, List<F> operands) {
        return context().configuration().balancedAssociation()
                ? balanced(tag, operands)
                : leftFold(tag, operands);
    }

    /** Returns the formula with the given handle. */
    F formula(int node);
}

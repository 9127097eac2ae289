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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates first-order formulas over a graph into propositional formulas over the bits of the
 * domain encoding.
 *
 * <p>Quantifiers are unfolded over the constants of the encoding, {@code ! [x] : f} becoming the
 * conjunction of {@code f[c/x]} and {@code ? [x] : f} the disjunction, in vertex order. The atoms of
 * the resulting quantifier-free formula are then replaced by the gates of the encoding. A model of
 * the result together with the {@link DomainEncoding#domainConstraint(int) domain constraints} of
 * the free variables corresponds to an assignment of vertices satisfying the formula.
 */
public final class BooleanEncoder {
    private static final Logger logger = Logger.getLogger(BooleanEncoder.class.getName());

    private BooleanEncoder() {}

    /** Unfolds all quantifiers of the formula over the constants of the encoding. */
    public static Fog eliminateQuantifiers(Fog formula, DomainEncoding encoding) {
        checkContext(formula, encoding);
        FogLanguage fog = formula.context().fog();
        List<Integer> constants = new ArrayList<>(encoding.vertices().size());
        for (int vertex : encoding.vertices()) {
            constants.add(encoding.vertexToConstant(vertex));
        }
        return Formulas.fold(formula, f -> true, (node, children) -> {
            if (node.isLeaf()) {
                return node;
            }
            if (!node.isQuantifier()) {
                return fog.rebuild(node, children);
            }
            // The body is already quantifier-free
            Fog body = children.get(0);
            int variable = node.boundVariable();
            List<Fog> instances = new ArrayList<>(constants.size());
            for (int constant : constants) {
                instances.add(Formulas.substitute(body, constant, variable));
            }
            return fog.fold(node.tag() == Tag.FORALL ? Tag.AND : Tag.OR, instances);
        });
    }

    /**
     * Replaces the atoms of a quantifier-free formula by the corresponding gates of the encoding.
     *
     * @throws IllegalArgumentException
     *     If the formula contains a quantifier.
     */
    public static Prop propositionalize(Fog formula, DomainEncoding encoding) {
        checkContext(formula, encoding);
        PropLanguage prop = formula.context().prop();
        return Formulas.<Fog, Prop>fold(formula, f -> true, (node, children) -> {
            switch (node.tag()) {
                case TRUE:
                    return prop.trueFormula();
                case FALSE:
                    return prop.falseFormula();
                case EQUAL:
                case ADJACENT:
                case LESS:
                    return encoding.relationGate(node.tag(), node.firstTerm(), node.secondTerm());
                case NOT:
                    return prop.not(children.get(0));
                case AND:
                case OR:
                case IMPLIES:
                case IFF:
                    return prop.binary(node.tag(), children.get(0), children.get(1));
                default:
                    throw new IllegalArgumentException("Formula " + formula + " is not quantifier-free");
            }
        });
    }

    /**
     * Encodes the formula into a propositional formula over the bits of its free variables.
     * Constants are replaced by their codes. A warning is logged if the unfolding is expected to
     * exceed {@link FormulaConfiguration#unfoldingWarningThreshold()} nodes.
     */
    public static Prop encode(Fog formula, DomainEncoding encoding) {
        long estimate = estimateUnfoldingSize(formula, encoding);
        if (estimate > formula.context().configuration().unfoldingWarningThreshold()) {
            logger.log(Level.WARNING, "Unfolding quantifiers of formula with {0} nodes over {1} vertices may "
                    + "create up to {2} nodes", new Object[] {
                Formulas.size(formula), encoding.vertices().size(), estimate
            });
        }
        Prop result = propositionalize(eliminateQuantifiers(formula, encoding), encoding);
        logger.log(Level.FINE, "Encoded formula into {0} nodes", Formulas.size(result));
        return result;
    }

    /**
     * Encodes the formula and adds the domain constraint of each free variable.
     *
     * @return The encoded formula, followed by one domain constraint per free variable in order of
     *     first occurrence.
     */
    public static List<Prop> encodeWithDomainConstraints(Fog formula, DomainEncoding encoding) {
        ImmutableList.Builder<Prop> result = ImmutableList.builder();
        result.add(encode(formula, encoding));
        for (int variable : Formulas.freeVariables(formula)) {
            result.add(encoding.domainConstraint(variable));
        }
        return result.build();
    }

    /**
     * Upper bound on the number of nodes created by unfolding the quantifiers of the formula, namely
     * the number of vertices raised to the quantifier depth times the size of the formula. Saturates
     * at {@link Long#MAX_VALUE}.
     */
    public static long estimateUnfoldingSize(Fog formula, DomainEncoding encoding) {
        checkContext(formula, encoding);
        int depth = Formulas.<Fog, Integer>fold(formula, f -> true, (node, children) -> {
            int maximum = 0;
            for (int child : children) {
                maximum = Math.max(maximum, child);
            }
            return node.isQuantifier() ? maximum + 1 : maximum;
        });
        long estimate = Formulas.size(formula);
        long vertices = encoding.vertices().size();
        for (int i = 0; i < depth; i++) {
            estimate = Util.saturatedMultiply(estimate, vertices);
        }
        return estimate;
    }

    private static void checkContext(Fog formula, DomainEncoding encoding) {
        checkArgument(formula.context() == encoding.context(),
                "Formula and encoding belong to different contexts");
    }
}

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

import java.util.List;
import javax.annotation.Nullable;

/**
 * Formulas of the first-order logic of graphs.
 *
 * <p>Equality and adjacency are symmetric, their arguments are stored ordered by symbol name so that
 * {@code edg(y, x)} and {@code edg(x, y)} are the same formula. The order relation {@code x < y}
 * refers to the position of vertices in a {@link DomainEncoding} and keeps its argument order.
 */
public final class FogLanguage extends AbstractLanguage<Fog> {
    FogLanguage(FormulaContext context, int discriminant) {
        super(context, discriminant);
    }

    @Override
    Fog wrap(int node) {
        return new Fog(this, node);
    }

    @Override
    Class<Fog> formulaClass() {
        return Fog.class;
    }

    public Fog equal(int firstTerm, int secondTerm) {
        return relation(Tag.EQUAL, firstTerm, secondTerm);
    }

    public Fog adjacent(int firstTerm, int secondTerm) {
        return relation(Tag.ADJACENT, firstTerm, secondTerm);
    }

    public Fog less(int firstTerm, int secondTerm) {
        return relation(Tag.LESS, firstTerm, secondTerm);
    }

    /**
     * Creates a relation atom.
     *
     * @param tag
     *     One of {@link Tag#EQUAL}, {@link Tag#ADJACENT}, {@link Tag#LESS}.
     * @throws NameException
     *     If a term is neither a variable nor a constant.
     */
    public Fog relation(Tag tag, int firstTerm, int secondTerm) {
        checkArgument(tag.isRelation(), "%s is not a relation", tag);
        checkTerm(firstTerm);
        checkTerm(secondTerm);
        if (tag == Tag.LESS) {
            return make(tag, firstTerm, secondTerm);
        }
        SymbolTable symbols = context().symbols();
        if (symbols.lookupName(firstTerm).compareTo(symbols.lookupName(secondTerm)) > 0) {
            return make(tag, secondTerm, firstTerm);
        }
        return make(tag, firstTerm, secondTerm);
    }

    public Fog forall(int variable, Fog body) {
        return quantifier(Tag.FORALL, variable, body);
    }

    public Fog exists(int variable, Fog body) {
        return quantifier(Tag.EXISTS, variable, body);
    }

    /**
     * Creates a quantified formula.
     *
     * @throws NameException
     *     If {@code variable} is not a variable symbol.
     */
    public Fog quantifier(Tag tag, int variable, Fog body) {
        checkArgument(tag.isQuantifier(), "%s is not a quantifier", tag);
        SymbolTable symbols = context().symbols();
        if (!symbols.hasIndex(variable) || !symbols.isVariable(variable)) {
            throw new NameException(String.format("Symbol %d cannot be bound by a quantifier", variable));
        }
        return make(tag, variable, operandNode(body));
    }

    @Override
    Fog rebuildOther(Tag tag, Fog template, List<Fog> children) {
        checkArgument(
                tag.isQuantifier() && template.isQuantifier() && children.size() == 1,
                "Cannot rebuild %s as %s",
                template,
                tag);
        return quantifier(tag, template.boundVariable(), children.get(0));
    }

    @Override
    public Fog simplifyLeaf(Fog leaf, @Nullable DomainEncoding structure) {
        if (!leaf.isRelation()) {
            return leaf;
        }
        int first = leaf.firstTerm();
        int second = leaf.secondTerm();
        if (first == second) {
            return constant(leaf.tag() == Tag.EQUAL);
        }
        if (structure == null || !structure.hasConstant(first) || !structure.hasConstant(second)) {
            return leaf;
        }
        int firstVertex = structure.constantToVertex(first);
        int secondVertex = structure.constantToVertex(second);
        switch (leaf.tag()) {
            case EQUAL:
                return constant(firstVertex == secondVertex);
            case ADJACENT:
                return constant(structure.isAdjacent(firstVertex, secondVertex));
            case LESS:
                return constant(structure.position(firstVertex) < structure.position(secondVertex));
            default:
                throw new AssertionError();
        }
    }

    private void checkTerm(int term) {
        SymbolTable symbols = context().symbols();
        if (!symbols.hasIndex(term)) {
            throw new NameException(String.format("Unknown symbol index %d", term));
        }
        if (symbols.isAuxiliary(term)) {
            throw new NameException(String.format("Auxiliary symbol %s is not a term", symbols.lookupName(term)));
        }
    }
}

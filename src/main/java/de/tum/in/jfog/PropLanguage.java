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

import javax.annotation.Nullable;

/** Propositional formulas over the variables and auxiliary symbols of a context. */
public final class PropLanguage extends AbstractLanguage<Prop> {
    PropLanguage(FormulaContext context, int discriminant) {
        super(context, discriminant);
    }

    @Override
    Prop wrap(int node) {
        return new Prop(this, node);
    }

    @Override
    Class<Prop> formulaClass() {
        return Prop.class;
    }

    /**
     * Returns the propositional variable of the given symbol.
     *
     * @throws NameException
     *     If the symbol is unknown or a constant.
     */
    public Prop variable(int symbol) {
        SymbolTable symbols = context().symbols();
        if (!symbols.hasIndex(symbol)) {
            throw new NameException(String.format("Unknown symbol index %d", symbol));
        }
        if (symbols.isConstant(symbol)) {
            throw new NameException(
                    String.format("Constant %s cannot be a propositional variable", symbols.lookupName(symbol)));
        }
        return make(Tag.VARIABLE, symbol, 0);
    }

    public Prop variable(String name) {
        return variable(context().symbols().lookupIndex(name));
    }

    /** Returns {@code variable} if {@code positive} holds and its negation otherwise. */
    public Prop literal(int symbol, boolean positive) {
        Prop variable = variable(symbol);
        return positive ? variable : not(variable);
    }

    @Override
    public Prop simplifyLeaf(Prop leaf, @Nullable DomainEncoding structure) {
        return leaf;
    }
}

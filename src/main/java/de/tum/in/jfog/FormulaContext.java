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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A session owning a symbol table and the hash-consing table of all formulas built within it.
 *
 * <p>Formulas, domain encodings and CNFs of one context must not be mixed with those of another. A
 * context is not thread-safe; concurrent users should each create their own context.
 *
 * @see FormulaFactory
 */
public final class FormulaContext {
    private static final Logger logger = Logger.getLogger(FormulaContext.class.getName());

    private static final int PROPOSITIONAL = 0;
    private static final int FIRST_ORDER = 1;

    private final FormulaConfiguration configuration;
    private final SymbolTable symbols;
    private final TermTable table;
    private final PropLanguage prop;
    private final FogLanguage fog;
    private int generation = 0;

    FormulaContext(FormulaConfiguration configuration) {
        this.configuration = configuration;
        this.symbols = new SymbolTable();
        this.table = new TermTable(configuration.initialSize(), configuration.growthFactor());
        this.prop = new PropLanguage(this, PROPOSITIONAL);
        this.fog = new FogLanguage(this, FIRST_ORDER);
    }

    public FormulaConfiguration configuration() {
        return configuration;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    /** The propositional formulas of this context. */
    public PropLanguage prop() {
        return prop;
    }

    /** The first-order formulas of this context. */
    public FogLanguage fog() {
        return fog;
    }

    /**
     * Parses a propositional formula, e.g. {@code (x@1 & ~ y@2)}.
     *
     * @throws FormulaSyntaxException
     *     If the text is not a well-formed propositional formula.
     */
    public Prop readProp(String text) throws FormulaSyntaxException {
        return FormulaReader.readProp(this, text);
    }

    /**
     * Parses a first-order formula, e.g. {@code ! [x] : ? [y] : edg(x, y)}.
     *
     * @throws FormulaSyntaxException
     *     If the text is not a well-formed first-order formula.
     */
    public Fog readFog(String text) throws FormulaSyntaxException {
        return FormulaReader.readFog(this, text);
    }

    /**
     * Drops all symbols and formulas. Formulas and encodings created before are invalid afterwards
     * and throw an {@link IllegalStateException} when used.
     */
    public void clear() {
        if (configuration.logStatisticsOnClear() && logger.isLoggable(Level.INFO)) {
            logger.log(Level.INFO, "Statistics before clearing:\n{0}", getStatistics());
        }
        symbols.clear();
        table.clear();
        generation += 1;
    }

    public String getStatistics() {
        return String.format("Symbols: %d%n%s", symbols.size(), table.getStatistics());
    }

    int generation() {
        return generation;
    }

    void checkGeneration(int expected) {
        if (expected != generation) {
            throw new IllegalStateException("Object was created before its context was cleared");
        }
    }

    TermTable table() {
        return table;
    }
}

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

import de.tum.in.jfog.parser.FormulaBaseVisitor;
import de.tum.in.jfog.parser.FormulaLexer;
import de.tum.in.jfog.parser.FormulaParser;
import de.tum.in.jfog.parser.FormulaParser.AdjacencyContext;
import de.tum.in.jfog.parser.FormulaParser.AtomicContext;
import de.tum.in.jfog.parser.FormulaParser.ConjunctionContext;
import de.tum.in.jfog.parser.FormulaParser.DisjunctionContext;
import de.tum.in.jfog.parser.FormulaParser.EqualityContext;
import de.tum.in.jfog.parser.FormulaParser.EquivalenceContext;
import de.tum.in.jfog.parser.FormulaParser.FalsityContext;
import de.tum.in.jfog.parser.FormulaParser.ImplicationContext;
import de.tum.in.jfog.parser.FormulaParser.NegationContext;
import de.tum.in.jfog.parser.FormulaParser.OrderContext;
import de.tum.in.jfog.parser.FormulaParser.ParenthesizedContext;
import de.tum.in.jfog.parser.FormulaParser.PropositionContext;
import de.tum.in.jfog.parser.FormulaParser.QuantifiedContext;
import de.tum.in.jfog.parser.FormulaParser.TruthContext;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Reads formulas in the textual format produced by {@link Formula#toString()}.
 *
 * <p>Precedence from highest to lowest is quantifiers, {@code ~}, {@code &}, {@code |}, {@code ->},
 * {@code <->}; binary operators associate to the left. Chains of {@code &} and {@code |} are
 * bisected instead if the context uses {@link FormulaConfiguration#balancedAssociation() balanced
 * association}.
 */
abstract class FormulaReader<F extends Formula<F>> extends FormulaBaseVisitor<F> {
    private static final BaseErrorListener THROWING_LISTENER = new BaseErrorListener() {
        @Override
        public void syntaxError(
                Recognizer<?, ?> recognizer,
                Object offendingSymbol,
                int line,
                int charPositionInLine,
                String msg,
                RecognitionException e) {
            throw new ParseCancellationException(
                    String.format("Syntax error at position %d: %s", charPositionInLine, msg), e);
        }
    };

    private final TermLanguage<F> language;

    FormulaReader(TermLanguage<F> language) {
        this.language = language;
    }

    static Prop readProp(FormulaContext context, String text) throws FormulaSyntaxException {
        return new PropReader(context.prop()).read(text);
    }

    static Fog readFog(FormulaContext context, String text) throws FormulaSyntaxException {
        return new FogReader(context.fog()).read(text);
    }

    F read(String text) throws FormulaSyntaxException {
        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(THROWING_LISTENER);
        FormulaParser parser = new FormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(THROWING_LISTENER);
        try {
            return visit(parser.formula());
        } catch (ParseCancellationException e) {
            throw new FormulaSyntaxException(String.format("Cannot parse '%s': %s", text, e.getMessage()), e);
        }
    }

    static ParseCancellationException error(ParserRuleContext context, String message) {
        return new ParseCancellationException(
                String.format("%s at position %d", message, context.getStart().getCharPositionInLine()));
    }

    TermLanguage<F> language() {
        return language;
    }

    private <C extends ParserRuleContext> F chain(Tag tag, List<C> operands, boolean foldLeft) {
        List<F> formulas = new ArrayList<>(operands.size());
        for (C operand : operands) {
            formulas.add(visit(operand));
        }
        return foldLeft ? language.leftFold(tag, formulas) : language.fold(tag, formulas);
    }

    @Override
    public F visitFormula(FormulaParser.FormulaContext ctx) {
        return visit(ctx.equivalence());
    }

    @Override
    public F visitEquivalence(EquivalenceContext ctx) {
        return chain(Tag.IFF, ctx.implication(), true);
    }

    @Override
    public F visitImplication(ImplicationContext ctx) {
        return chain(Tag.IMPLIES, ctx.disjunction(), true);
    }

    @Override
    public F visitDisjunction(DisjunctionContext ctx) {
        return chain(Tag.OR, ctx.conjunction(), false);
    }

    @Override
    public F visitConjunction(ConjunctionContext ctx) {
        return chain(Tag.AND, ctx.unary(), false);
    }

    @Override
    public F visitNegation(NegationContext ctx) {
        return language.not(visit(ctx.unary()));
    }

    @Override
    public F visitParenthesized(ParenthesizedContext ctx) {
        return visit(ctx.equivalence());
    }

    @Override
    public F visitAtomic(AtomicContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public F visitTruth(TruthContext ctx) {
        return language.trueFormula();
    }

    @Override
    public F visitFalsity(FalsityContext ctx) {
        return language.falseFormula();
    }

    private static final class PropReader extends FormulaReader<Prop> {
        PropReader(PropLanguage language) {
            super(language);
        }

        @Override
        public Prop visitProposition(PropositionContext ctx) {
            return ((PropLanguage) language()).variable(ctx.getText());
        }

        @Override
        public Prop visitQuantified(QuantifiedContext ctx) {
            throw error(ctx, "Quantifiers are not allowed in propositional formulas");
        }

        @Override
        public Prop visitAdjacency(AdjacencyContext ctx) {
            throw error(ctx, "Relations are not allowed in propositional formulas");
        }

        @Override
        public Prop visitEquality(EqualityContext ctx) {
            throw error(ctx, "Relations are not allowed in propositional formulas");
        }

        @Override
        public Prop visitOrder(OrderContext ctx) {
            throw error(ctx, "Relations are not allowed in propositional formulas");
        }
    }

    private static final class FogReader extends FormulaReader<Fog> {
        private final FogLanguage fog;
        private final Function<String, Integer> symbols;

        FogReader(FogLanguage language) {
            super(language);
            this.fog = language;
            this.symbols = language.context().symbols()::lookupIndex;
        }

        @Override
        public Fog visitProposition(PropositionContext ctx) {
            throw error(ctx, "Propositional variables are not allowed in first-order formulas");
        }

        @Override
        public Fog visitQuantified(QuantifiedContext ctx) {
            Tag tag = ctx.quantifier.getType() == FormulaLexer.FORALL ? Tag.FORALL : Tag.EXISTS;
            int variable = symbols.apply(ctx.VARIABLE().getText());
            return fog.quantifier(tag, variable, visit(ctx.unary()));
        }

        @Override
        public Fog visitAdjacency(AdjacencyContext ctx) {
            return fog.adjacent(symbols.apply(ctx.term(0).getText()), symbols.apply(ctx.term(1).getText()));
        }

        @Override
        public Fog visitEquality(EqualityContext ctx) {
            return fog.equal(symbols.apply(ctx.term(0).getText()), symbols.apply(ctx.term(1).getText()));
        }

        @Override
        public Fog visitOrder(OrderContext ctx) {
            return fog.less(symbols.apply(ctx.term(0).getText()), symbols.apply(ctx.term(1).getText()));
        }
    }
}

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

abstract class AbstractLanguage<F extends Formula<F>> implements TermLanguage<F> {
    private final FormulaContext context;
    private final int discriminant;

    AbstractLanguage(FormulaContext context, int discriminant) {
        this.context = context;
        this.discriminant = discriminant;
    }

    /** Creates the wrapper object for a freshly created node. */
    abstract F wrap(int node);

    abstract Class<F> formulaClass();

    @Override
    public FormulaContext context() {
        return context;
    }

    TermTable table() {
        return context.table();
    }

    @Override
    public F formula(int node) {
        TermTable table = table();
        checkArgument(table.isNodeValid(node), "Invalid node %d", node);
        checkArgument(
                TermTable.languageOfKind(table.kind(node)) == discriminant,
                "Node %d belongs to a different language",
                node);
        Formula<?> term = table.term(node);
        if (term == null) {
            F formula = wrap(node);
            table.setTerm(node, formula);
            return formula;
        }
        return formulaClass().cast(term);
    }

    final F make(Tag tag, int first, int second) {
        return formula(table().findOrCreate(TermTable.kind(discriminant, tag), first, second));
    }

    final int operandNode(F formula) {
        checkArgument(formula.language() == this, "Formula %s belongs to a different language", formula);
        formula.checkValid();
        return formula.node();
    }

    @Override
    public boolean isLeaf(F formula) {
        return formula.isLeaf();
    }

    @Override
    public List<F> children(F formula) {
        return formula.children();
    }

    @Override
    public F rebuild(Tag tag, F template, List<F> children) {
        if (tag.isLeaf()) {
            checkArgument(tag == template.tag() && children.isEmpty(), "Cannot rebuild %s as %s", template, tag);
            return template;
        }
        if (tag == Tag.NOT) {
            checkArgument(children.size() == 1, "Negation needs one child");
            return not(children.get(0));
        }
        if (tag.isBinary()) {
            checkArgument(children.size() == 2, "%s needs two children", tag);
            return binary(tag, children.get(0), children.get(1));
        }
        return rebuildOther(tag, template, children);
    }

    /** Rebuilds nodes which are neither leaves nor Boolean connectives. */
    F rebuildOther(Tag tag, F template, List<F> children) {
        throw new IllegalArgumentException("Unsupported node " + tag);
    }

    @Override
    public F trueFormula() {
        return make(Tag.TRUE, 0, 0);
    }

    @Override
    public F falseFormula() {
        return make(Tag.FALSE, 0, 0);
    }

    @Override
    public F not(F formula) {
        return make(Tag.NOT, operandNode(formula), 0);
    }

    @Override
    public F binary(Tag tag, F left, F right) {
        checkArgument(tag.isBinary(), "%s is not a binary connective", tag);
        return make(tag, operandNode(left), operandNode(right));
    }

    @Override
    public F leftFold(Tag tag, List<F> operands) {
        if (operands.isEmpty()) {
            return neutral(tag);
        }
        F result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = binary(tag, result, operands.get(i));
        }
        return result;
    }

    @Override
    public F balanced(Tag tag, List<F> operands) {
        if (operands.isEmpty()) {
            return neutral(tag);
        }
        return balanced(tag, operands, 0, operands.size());
    }

    private F balanced(Tag tag, List<F> operands, int begin, int end) {
        assert begin < end;
        if (end - begin == 1) {
            return operands.get(begin);
        }
        // The recursion depth is logarithmic in the number of operands
        int middle = (begin + end) / 2;
        return binary(tag, balanced(tag, operands, begin, middle), balanced(tag, operands, middle, end));
    }

    private F neutral(Tag tag) {
        if (tag == Tag.AND) {
            return trueFormula();
        }
        if (tag == Tag.OR) {
            return falseFormula();
        }
        throw new IllegalArgumentException("No operands given for " + tag);
    }
}

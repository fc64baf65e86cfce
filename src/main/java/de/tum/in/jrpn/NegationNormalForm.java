/*
 * This file is part of JRPN (https://github.com/incaseoftrouble/jrpn).
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JRPN is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JRPN is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JRPN. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jrpn;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites formulas into negation normal form: only conjunctions, disjunctions and leaves remain,
 * and negations only occur directly on variables.
 *
 * <ul>
 *   <li>{@code A ^ B} becomes {@code (A & !B) | (!A & B)}</li>
 *   <li>{@code A > B} becomes {@code !A | B}</li>
 *   <li>{@code A = B} becomes {@code (A & B) | (!A & !B)}</li>
 *   <li>negated conjunctions and disjunctions are pushed inwards (De Morgan)</li>
 *   <li>double negations cancel, negated constants are folded</li>
 * </ul>
 */
public final class NegationNormalForm {
    private NegationNormalForm() {}

    public static Formula of(Formula formula) {
        return Formula.of(of(formula.root()));
    }

    public static Node of(Node node) {
        return rewrite(node, node.isNegated());
    }

    /**
     * Returns the negation normal form of {@code node}'s literal, negated if {@code negate} is set.
     * The negation count of {@code node} itself is already folded into {@code negate}.
     */
    private static Node rewrite(Node node, boolean negate) {
        Literal literal = node.literal();
        if (literal instanceof Literal.Constant) {
            return Node.constant(((Literal.Constant) literal).value() ^ negate);
        }
        if (literal instanceof Literal.Variable) {
            Node variable = Node.variable(((Literal.Variable) literal).index());
            return negate ? variable.negate() : variable;
        }
        Literal.Operation operation = (Literal.Operation) literal;
        BinaryOperator operator = operation.operator();
        if (operator.isAssociative()) {
            BinaryOperator target = negate ? dual(operator) : operator;
            List<Node> children = new ArrayList<>(operation.arity());
            for (Node child : operation.children()) {
                children.add(rewrite(child, child.isNegated() ^ negate));
            }
            return Node.operation(target, children);
        }

        // Non-associative connectives are folded pairwise from the left
        List<Node> children = operation.children();
        Node expanded = children.get(0);
        for (int i = 1; i < children.size(); i++) {
            expanded = expand(operator, expanded, children.get(i));
        }
        return rewrite(expanded, negate);
    }

    private static Node expand(BinaryOperator operator, Node left, Node right) {
        switch (operator) {
            case XOR:
                return Node.or(Node.and(left, right.negate()), Node.and(left.negate(), right));
            case IMPLICATION:
                return Node.or(left.negate(), right);
            case EQUIVALENCE:
                return Node.or(Node.and(left, right), Node.and(left.negate(), right.negate()));
            default:
                throw new IllegalArgumentException("Not a derived connective: " + operator);
        }
    }

    private static BinaryOperator dual(BinaryOperator operator) {
        return operator == BinaryOperator.AND ? BinaryOperator.OR : BinaryOperator.AND;
    }

    /**
     * Checks whether {@code node} is in negation normal form.
     */
    public static boolean isNegationNormalForm(Node node) {
        if (node.isConstant()) {
            return node.negations() == 0;
        }
        if (node.isVariable()) {
            return node.negations() <= 1;
        }
        if (node.negations() != 0 || !node.operation().operator().isAssociative()) {
            return false;
        }
        for (Node child : node.children()) {
            if (!isNegationNormalForm(child)) {
                return false;
            }
        }
        return true;
    }
}

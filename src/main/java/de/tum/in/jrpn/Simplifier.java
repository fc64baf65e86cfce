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
 * Bottom-up simplification of formula trees by constant folding, idempotence, contradiction and
 * tautology detection, and flattening of nested conjunctions and disjunctions. The result is
 * equivalent to the input, every negation count is reduced to zero or one, and exclusive or,
 * implication and equivalence nodes are binary.
 */
public final class Simplifier {
    private Simplifier() {}

    public static Formula simplify(Formula formula) {
        return Formula.of(simplify(formula.root()));
    }

    public static Node simplify(Node node) {
        Literal literal = node.literal();
        if (literal instanceof Literal.Constant) {
            return Node.constant(node.constantValue());
        }
        if (literal instanceof Literal.Variable) {
            return node.normalized();
        }

        Literal.Operation operation = (Literal.Operation) literal;
        BinaryOperator operator = operation.operator();
        List<Node> children = new ArrayList<>(operation.arity());
        for (Node child : operation.children()) {
            Node simplified = simplify(child);
            if (operator.isAssociative() && simplified.isOperation(operator)
                && simplified.negations() == 0) {
                children.addAll(simplified.children());
            } else {
                children.add(simplified);
            }
        }

        Node result;
        if (operator.isAssociative()) {
            result = simplifyAssociative(operator, children);
        } else {
            result = children.get(0);
            for (int i = 1; i < children.size(); i++) {
                result = simplifyBinary(operator, result, children.get(i));
            }
        }
        return node.isNegated() ? not(result) : result;
    }

    private static Node not(Node node) {
        return node.isConstant() ? Node.constant(!node.constantValue()) : node.complement();
    }

    private static Node simplifyAssociative(BinaryOperator operator, List<Node> children) {
        // The neutral element of the conjunction is true, the absorbing one false; and vice versa
        boolean neutral = operator == BinaryOperator.AND;
        List<Node> kept = new ArrayList<>(children.size());
        for (Node child : children) {
            if (child.isConstant()) {
                if (child.constantValue() == neutral) {
                    continue;
                }
                return Node.constant(!neutral);
            }
            if (kept.contains(child)) {
                continue;
            }
            if (kept.contains(child.complement())) {
                return Node.constant(!neutral);
            }
            kept.add(child);
        }
        switch (kept.size()) {
            case 0:
                return Node.constant(neutral);
            case 1:
                return kept.get(0);
            default:
                return Node.operation(operator, kept);
        }
    }

    private static Node simplifyBinary(BinaryOperator operator, Node left, Node right) {
        switch (operator) {
            case XOR:
                return simplifyExclusiveOr(left, right);
            case EQUIVALENCE:
                return equivalence(simplifyExclusiveOr(left, right), left, right);
            case IMPLICATION:
                return simplifyImplication(left, right);
            default:
                throw new IllegalArgumentException("Not a binary connective: " + operator);
        }
    }

    private static Node simplifyExclusiveOr(Node left, Node right) {
        if (left.isConstant() && right.isConstant()) {
            return Node.constant(left.constantValue() ^ right.constantValue());
        }
        if (left.isConstant()) {
            return left.constantValue() ? not(right) : right;
        }
        if (right.isConstant()) {
            return right.constantValue() ? not(left) : left;
        }
        if (left.equals(right)) {
            return Node.constant(false);
        }
        if (left.equals(right.complement())) {
            return Node.constant(true);
        }
        return Node.binary(BinaryOperator.XOR, left, right);
    }

    /**
     * Turns a simplified exclusive or of {@code left} and {@code right} into the simplified
     * equivalence of the two operands.
     */
    private static Node equivalence(Node exclusiveOr, Node left, Node right) {
        if (exclusiveOr.isOperation(BinaryOperator.XOR) && exclusiveOr.negations() == 0) {
            return Node.binary(BinaryOperator.EQUIVALENCE, left, right);
        }
        return not(exclusiveOr);
    }

    private static Node simplifyImplication(Node left, Node right) {
        if (left.isConstant()) {
            return left.constantValue() ? right : Node.constant(true);
        }
        if (right.isConstant()) {
            return right.constantValue() ? Node.constant(true) : not(left);
        }
        if (left.equals(right)) {
            return Node.constant(true);
        }
        if (left.equals(right.complement())) {
            // A > !A is !A, and !A > A is A
            return right;
        }
        return Node.binary(BinaryOperator.IMPLICATION, left, right);
    }
}

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

import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * A node of a formula tree: a {@link Literal} together with the number of pending negations.
 * Only the parity of the negation count is semantically relevant; the count itself is kept so
 * that the printed form of a parsed formula reproduces its input.
 *
 * <p>Nodes are immutable. Rewriters build new nodes instead of modifying existing ones.</p>
 */
public final class Node {
    private final int negations;
    private final Literal literal;

    Node(int negations, Literal literal) {
        assert negations >= 0;
        this.negations = negations;
        this.literal = literal;
    }

    public static Node constant(boolean value) {
        return new Node(0, Literal.Constant.of(value));
    }

    public static Node variable(int index) {
        return new Node(0, new Literal.Variable(index));
    }

    public static Node variable(char name) {
        return variable(VariableTable.index(name));
    }

    public static Node binary(BinaryOperator operator, Node left, Node right) {
        return new Node(0, new Literal.Operation(operator, List.of(left, right)));
    }

    public static Node operation(BinaryOperator operator, List<Node> children) {
        return new Node(0, new Literal.Operation(operator, children));
    }

    public static Node and(Node left, Node right) {
        return binary(BinaryOperator.AND, left, right);
    }

    public static Node or(Node left, Node right) {
        return binary(BinaryOperator.OR, left, right);
    }

    public int negations() {
        return negations;
    }

    public boolean isNegated() {
        return negations % 2 == 1;
    }

    public Literal literal() {
        return literal;
    }

    /**
     * Returns the node with one more pending negation.
     */
    public Node negate() {
        return new Node(negations + 1, literal);
    }

    /**
     * Returns an equivalent node whose negation count is reduced to its parity.
     */
    public Node normalized() {
        return negations < 2 ? this : new Node(negations % 2, literal);
    }

    /**
     * Returns the complement of this node with a negation count of at most one.
     */
    public Node complement() {
        return new Node(isNegated() ? 0 : 1, literal);
    }

    public boolean isConstant() {
        return literal instanceof Literal.Constant;
    }

    public boolean isVariable() {
        return literal instanceof Literal.Variable;
    }

    public boolean isOperation() {
        return literal instanceof Literal.Operation;
    }

    public boolean isOperation(BinaryOperator operator) {
        return literal instanceof Literal.Operation
            && ((Literal.Operation) literal).operator() == operator;
    }

    /**
     * Whether this node is a leaf, i.e. a possibly negated constant or variable.
     */
    public boolean isLeaf() {
        return !isOperation();
    }

    /**
     * Returns the truth value of a constant node, taking pending negations into account.
     *
     * @throws IllegalStateException if this node is not a constant.
     */
    public boolean constantValue() {
        if (!(literal instanceof Literal.Constant)) {
            throw new IllegalStateException("Not a constant: " + this);
        }
        return ((Literal.Constant) literal).value() ^ isNegated();
    }

    public Literal.Operation operation() {
        if (!(literal instanceof Literal.Operation)) {
            throw new IllegalStateException("Not an operation: " + this);
        }
        return (Literal.Operation) literal;
    }

    public ImmutableList<Node> children() {
        return isOperation() ? operation().children() : ImmutableList.of();
    }

    public boolean evaluate(VariableTable table) {
        return literal.evaluate(table) ^ isNegated();
    }

    /**
     * Returns the indices of all variables occurring below this node.
     */
    public BitSet variables() {
        BitSet set = new BitSet(VariableTable.SIZE);
        literal.gatherVariables(set);
        return set;
    }

    /**
     * Returns the number of leaf occurrences (constants and variables) of this node.
     */
    public int literalCount() {
        return literal.literalCount();
    }

    void appendTo(StringBuilder builder) {
        literal.appendTo(builder);
        for (int i = 0; i < negations; i++) {
            builder.append('!');
        }
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Node)) {
            return false;
        }
        Node that = (Node) object;
        return negations == that.negations && literal.equals(that.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(negations, literal);
    }

    /**
     * Returns the canonical RPN form of this node.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        appendTo(builder);
        return builder.toString();
    }
}

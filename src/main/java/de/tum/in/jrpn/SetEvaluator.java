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
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;

/**
 * Evaluates formulas over sets of integers: conjunction is intersection, disjunction is union,
 * negation is the complement with respect to the universe, the union of all bound sets.
 *
 * <pre>
 *   A ^ B  =  (A | B) - (A &amp; B)
 *   A &gt; B  =  !A | B
 *   A = B  =  (A &amp; B) | (!A &amp; !B)
 * </pre>
 *
 * <p>{@code 1} denotes the universe and {@code 0} the empty set. Unbound variables denote the empty
 * set.</p>
 */
public final class SetEvaluator {
    private SetEvaluator() {}

    /**
     * Returns the sorted elements of the set denoted by {@code formula} under the sets bound in its
     * variable table.
     */
    public static ImmutableList<Integer> evaluate(Formula formula) {
        ImmutableSortedSet<Integer> universe = formula.table().universe();
        return evaluate(formula.root(), formula.table()).materialize(universe).asList();
    }

    public static SignedSet evaluate(Node node, VariableTable table) {
        SignedSet result = evaluateLiteral(node.literal(), table);
        return node.isNegated() ? result.complement() : result;
    }

    private static SignedSet evaluateLiteral(Literal literal, VariableTable table) {
        if (literal instanceof Literal.Constant) {
            return ((Literal.Constant) literal).value() ? SignedSet.universe() : SignedSet.empty();
        }
        if (literal instanceof Literal.Variable) {
            return SignedSet.positive(table.set(((Literal.Variable) literal).index()));
        }
        Literal.Operation operation = (Literal.Operation) literal;
        List<Node> children = operation.children();
        SignedSet result = evaluate(children.get(0), table);
        for (int i = 1; i < children.size(); i++) {
            result = apply(operation.operator(), result, evaluate(children.get(i), table));
        }
        return result;
    }

    private static SignedSet apply(BinaryOperator operator, SignedSet left, SignedSet right) {
        switch (operator) {
            case AND:
                return left.intersection(right);
            case OR:
                return left.union(right);
            case XOR:
                return left.union(right).difference(left.intersection(right));
            case IMPLICATION:
                return left.complement().union(right);
            case EQUIVALENCE:
                return left.intersection(right).union(left.complement().intersection(right.complement()));
            default:
                throw new AssertionError(operator);
        }
    }
}

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Algebraic conversion into conjunctive normal form. The formula is first brought into
 * {@link NegationNormalForm negation normal form}, then disjunctions are distributed over
 * conjunctions:
 *
 * <pre>
 *   (A &amp; B) | C  becomes  (A | C) &amp; (B | C)
 *   A | (B &amp; C)  becomes  (A | B) &amp; (A | C)
 * </pre>
 *
 * <p>The distribution is carried out on clause sets. Repeated literals inside a clause and
 * repeated clauses are merged, and clauses containing a literal together with its complement are
 * dropped since they are always satisfied. The size of the result is exponential in the worst
 * case.</p>
 */
public final class ConjunctiveNormalForm {
    private ConjunctiveNormalForm() {}

    public static Formula of(Formula formula) {
        return Formula.of(of(formula.root()));
    }

    public static Node of(Node node) {
        return build(clauses(NegationNormalForm.of(node)));
    }

    /**
     * Computes the clauses of a formula in negation normal form. A clause is a set of literal
     * nodes. An empty set of clauses denotes {@code true}, an empty clause denotes {@code false}.
     */
    private static Set<Set<Node>> clauses(Node node) {
        Set<Set<Node>> result = new LinkedHashSet<>();
        if (node.isLeaf()) {
            if (node.isConstant()) {
                if (!node.constantValue()) {
                    result.add(new LinkedHashSet<>());
                }
                return result;
            }
            Set<Node> clause = new LinkedHashSet<>();
            clause.add(node.normalized());
            result.add(clause);
            return result;
        }

        BinaryOperator operator = node.operation().operator();
        if (operator == BinaryOperator.AND) {
            for (Node child : node.children()) {
                result.addAll(clauses(child));
            }
            return result;
        }
        assert operator == BinaryOperator.OR : "Not in negation normal form: " + node;

        // Start with the neutral element of the disjunction: the single empty clause
        result.add(new LinkedHashSet<>());
        for (Node child : node.children()) {
            Set<Set<Node>> childClauses = clauses(child);
            Set<Set<Node>> product = new LinkedHashSet<>();
            for (Set<Node> clause : result) {
                for (Set<Node> childClause : childClauses) {
                    Set<Node> merged = new LinkedHashSet<>(clause);
                    merged.addAll(childClause);
                    if (!isTautology(merged)) {
                        product.add(merged);
                    }
                }
            }
            result = product;
        }
        return result;
    }

    private static boolean isTautology(Set<Node> clause) {
        for (Node literal : clause) {
            if (literal.isNegated() && clause.contains(literal.complement())) {
                return true;
            }
        }
        return false;
    }

    private static Node build(Set<Set<Node>> clauses) {
        if (clauses.isEmpty()) {
            return Node.constant(true);
        }
        List<Node> conjuncts = new ArrayList<>(clauses.size());
        for (Set<Node> clause : clauses) {
            if (clause.isEmpty()) {
                return Node.constant(false);
            }
            conjuncts.add(clause.size() == 1
                ? clause.iterator().next()
                : Node.operation(BinaryOperator.OR, new ArrayList<>(clause)));
        }
        return conjuncts.size() == 1 ? conjuncts.get(0) : Node.operation(BinaryOperator.AND, conjuncts);
    }

    /**
     * Checks whether {@code node} is a conjunction of disjunctions of literals. Single clauses and
     * single literals count as degenerate conjunctions, and nested conjunctions or disjunctions
     * are treated as if they were flattened.
     */
    public static boolean isConjunctiveNormalForm(Node node) {
        if (node.isOperation(BinaryOperator.AND) && !node.isNegated()) {
            for (Node child : node.children()) {
                if (!isConjunctiveNormalForm(child)) {
                    return false;
                }
            }
            return true;
        }
        return isClause(node);
    }

    private static boolean isClause(Node node) {
        if (node.isLeaf()) {
            return true;
        }
        if (node.isNegated() || !node.isOperation(BinaryOperator.OR)) {
            return false;
        }
        for (Node child : node.children()) {
            if (!isClause(child)) {
                return false;
            }
        }
        return true;
    }
}

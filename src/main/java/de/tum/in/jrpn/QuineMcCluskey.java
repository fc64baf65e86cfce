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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes a minimal conjunctive normal form of a formula from its truth table. The zero rows of
 * the table are merged into prime implicants, the essential ones are selected and the remaining
 * rows are covered by {@link PetrickMethod Petrick's method}. Every selected implicant becomes one
 * clause: a {@code 0} position yields the positive variable, a {@code 1} position the negated
 * variable.
 */
public final class QuineMcCluskey {
    private static final Logger logger = Logger.getLogger(QuineMcCluskey.class.getName());

    private static final Comparator<Clause> CLAUSE_ORDER = Comparator
        .comparing((Clause clause) -> clause.variables, QuineMcCluskey::compareLexicographic)
        .thenComparing(clause -> clause.node.toString());

    private QuineMcCluskey() {}

    public static Formula minimize(Formula formula) {
        return Formula.of(minimize(TruthTable.of(formula)));
    }

    public static Node minimize(TruthTable table) {
        int[] zeroRows = table.zeroRows();
        logger.log(Level.FINE, "Minimizing {0} with {1} zero rows",
            new Object[] {table, zeroRows.length});
        if (zeroRows.length == 0) {
            return Node.constant(true);
        }
        if (zeroRows.length == table.size()) {
            return Node.constant(false);
        }

        List<Implicant> primes = primeImplicants(zeroRows, table.variables().size());
        List<Implicant> cover = selectCover(primes, zeroRows);
        List<Clause> clauses = new ArrayList<>(cover.size());
        for (Implicant implicant : cover) {
            clauses.add(clause(implicant, table.variables()));
        }
        clauses.sort(CLAUSE_ORDER);

        Node result = clauses.get(0).node;
        for (int i = 1; i < clauses.size(); i++) {
            result = Node.and(result, clauses.get(i).node);
        }
        return result;
    }

    /**
     * Computes all prime implicants of the given zero rows of a table of the given width.
     */
    public static List<Implicant> primeImplicants(int[] zeroRows, int width) {
        Set<Implicant> current = new LinkedHashSet<>();
        for (int row : zeroRows) {
            current.add(Implicant.ofRow(row, width));
        }

        Set<Implicant> primes = new LinkedHashSet<>();
        int round = 0;
        while (!current.isEmpty()) {
            List<Implicant> candidates = new ArrayList<>(current);
            boolean[] merged = new boolean[candidates.size()];
            Set<Implicant> next = new LinkedHashSet<>();
            for (int i = 0; i < candidates.size(); i++) {
                Implicant left = candidates.get(i);
                for (int j = i + 1; j < candidates.size(); j++) {
                    Implicant right = candidates.get(j);
                    if (left.canMerge(right)) {
                        next.add(left.merge(right));
                        merged[i] = true;
                        merged[j] = true;
                    }
                }
            }
            for (int i = 0; i < candidates.size(); i++) {
                if (!merged[i]) {
                    primes.add(candidates.get(i));
                }
            }
            round += 1;
            logger.log(Level.FINEST, "Round {0}: {1} merged implicants",
                new Object[] {round, next.size()});
            current = next;
        }
        logger.log(Level.FINER, "Prime implicants: {0}", primes);
        return new ArrayList<>(primes);
    }

    private static List<Implicant> selectCover(List<Implicant> primes, int[] zeroRows) {
        BitSet selected = new BitSet(primes.size());
        for (int row : zeroRows) {
            int coveredBy = -1;
            for (int i = 0; i < primes.size(); i++) {
                if (primes.get(i).covers(row)) {
                    if (coveredBy >= 0) {
                        coveredBy = -1;
                        break;
                    }
                    coveredBy = i;
                }
            }
            if (coveredBy >= 0) {
                selected.set(coveredBy);
            }
        }
        logger.log(Level.FINER, "Essential implicants: {0}", selected);

        int[] remaining = new int[zeroRows.length];
        int count = 0;
        for (int row : zeroRows) {
            if (!isCovered(primes, selected, row)) {
                remaining[count] = row;
                count += 1;
            }
        }
        if (count > 0) {
            int[] uncovered = new int[count];
            System.arraycopy(remaining, 0, uncovered, 0, count);
            selected.or(PetrickMethod.cover(primes, uncovered));
        }

        List<Implicant> cover = new ArrayList<>(selected.cardinality());
        for (int i = selected.nextSetBit(0); i >= 0; i = selected.nextSetBit(i + 1)) {
            cover.add(primes.get(i));
        }
        return cover;
    }

    private static boolean isCovered(List<Implicant> primes, BitSet selected, int row) {
        for (int i = selected.nextSetBit(0); i >= 0; i = selected.nextSetBit(i + 1)) {
            if (primes.get(i).covers(row)) {
                return true;
            }
        }
        return false;
    }

    private static Clause clause(Implicant implicant, List<Character> variables) {
        Node node = null;
        ImmutableList.Builder<Integer> indices = ImmutableList.builder();
        for (int position = 0; position < implicant.width(); position++) {
            Implicant.Bit bit = implicant.bit(position);
            if (bit == Implicant.Bit.DONT_CARE) {
                continue;
            }
            char name = variables.get(position);
            indices.add(VariableTable.index(name));
            Node literal = bit == Implicant.Bit.FALSE
                ? Node.variable(name)
                : Node.variable(name).negate();
            node = node == null ? literal : Node.or(node, literal);
        }
        // Prime implicants of a table that is not constantly false always have a cared position
        assert node != null : implicant;
        return new Clause(node, indices.build());
    }

    /**
     * Returns the canonical maxterm form of the table: one clause with every variable for each
     * zero row.
     */
    public static Node canonicalForm(TruthTable table) {
        int[] zeroRows = table.zeroRows();
        if (zeroRows.length == 0) {
            return Node.constant(true);
        }
        if (table.variables().isEmpty()) {
            return Node.constant(false);
        }
        Node result = null;
        for (int row : zeroRows) {
            Node clause = clause(Implicant.ofRow(row, table.variables().size()), table.variables()).node;
            result = result == null ? clause : Node.and(result, clause);
        }
        return result;
    }

    public static Formula canonicalForm(Formula formula) {
        return Formula.of(canonicalForm(TruthTable.of(formula)));
    }

    private static int compareLexicographic(List<Integer> left, List<Integer> right) {
        int length = Math.min(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            int comparison = Integer.compare(left.get(i), right.get(i));
            if (comparison != 0) {
                return comparison;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static final class Clause {
        final Node node;
        final ImmutableList<Integer> variables;

        Clause(Node node, ImmutableList<Integer> variables) {
            this.node = node;
            this.variables = variables;
        }
    }
}

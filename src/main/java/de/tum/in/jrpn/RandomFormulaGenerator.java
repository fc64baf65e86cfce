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
import java.security.SecureRandom;
import java.util.Random;

/**
 * Generates random formula trees and random integer sets, e.g. for the command line {@code -r}
 * option and for property tests.
 */
public final class RandomFormulaGenerator {
    /**
     * From this depth on, the root of a generated subtree is never a bare variable.
     */
    private static final int FORCED_OPERATION_DEPTH = 5;
    private static final int SET_ELEMENT_BOUND = 256;

    private static final BinaryOperator[] OPERATORS = {
        BinaryOperator.AND, BinaryOperator.OR, BinaryOperator.XOR,
        BinaryOperator.IMPLICATION, BinaryOperator.EQUIVALENCE
    };

    private final Random random;

    public RandomFormulaGenerator(Random random) {
        this.random = random;
    }

    public static RandomFormulaGenerator fromEntropy() {
        return new RandomFormulaGenerator(new SecureRandom());
    }

    /**
     * Generates a tree of depth at most {@code maxDepth} over the first {@code k} letters, where
     * {@code k} is drawn uniformly from {@code [1, maxVariables]}.
     */
    public Node generate(int maxDepth, int maxVariables) {
        if (maxDepth < 0 || maxVariables < 1 || maxVariables > VariableTable.SIZE) {
            throw new IllegalArgumentException(
                String.format("Invalid bounds: depth %d, variables %d", maxDepth, maxVariables));
        }
        int variables = 1 + random.nextInt(maxVariables);
        return generateNode(maxDepth, variables);
    }

    public Formula generateFormula(int maxDepth, int maxVariables) {
        return Formula.of(generate(maxDepth, maxVariables));
    }

    private Node generateNode(int depth, int variables) {
        if (depth == 0) {
            return Node.variable(random.nextInt(variables));
        }
        // 0 is a variable, 1 a negation and everything above a binary operator
        int choice = depth >= FORCED_OPERATION_DEPTH ? random.nextInt(6) + 1 : random.nextInt(7);
        if (choice == 0) {
            return Node.variable(random.nextInt(variables));
        }
        if (choice == 1) {
            return generateNode(depth - 1, variables).negate();
        }
        Node left = generateNode(depth - 1, variables);
        Node right = generateNode(depth - 1, variables);
        return Node.binary(OPERATORS[choice - 2], left, right);
    }

    /**
     * Generates a set of less than {@code maxSize} integers in {@code [0, 256)}.
     */
    public ImmutableSortedSet<Integer> randomSet(int maxSize) {
        int size = random.nextInt(maxSize);
        ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
        for (int i = 0; i < size; i++) {
            builder.add(random.nextInt(SET_ELEMENT_BOUND));
        }
        return builder.build();
    }

    public ImmutableList<ImmutableSortedSet<Integer>> randomSets(int count, int maxSize) {
        ImmutableList.Builder<ImmutableSortedSet<Integer>> builder = ImmutableList.builder();
        for (int i = 0; i < count; i++) {
            builder.add(randomSet(maxSize));
        }
        return builder.build();
    }
}

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

import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binding storage of a formula: one cell per letter {@code A} to {@code Z}. Every occurrence of a
 * letter in a tree refers to its cell by index, so updating a cell is visible to all occurrences.
 * A cell holds a truth value for boolean evaluation and a set of integers for set evaluation.
 */
public final class VariableTable {
    public static final int SIZE = 26;

    private final boolean[] values = new boolean[SIZE];
    private final List<ImmutableSortedSet<Integer>> sets =
        new ArrayList<>(Collections.nCopies(SIZE, ImmutableSortedSet.of()));

    VariableTable() {}

    public static char name(int index) {
        checkIndex(index);
        return (char) ('A' + index);
    }

    public static int index(char name) {
        if (name < 'A' || name > 'Z') {
            throw new IllegalArgumentException("Not a variable name: " + name);
        }
        return name - 'A';
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= SIZE) {
            throw new IllegalArgumentException("Variable index out of range: " + index);
        }
    }

    public boolean value(int index) {
        checkIndex(index);
        return values[index];
    }

    public void setValue(int index, boolean value) {
        checkIndex(index);
        values[index] = value;
    }

    public void setValue(char name, boolean value) {
        values[index(name)] = value;
    }

    public ImmutableSortedSet<Integer> set(int index) {
        checkIndex(index);
        return sets.get(index);
    }

    public void setSet(int index, Iterable<Integer> elements) {
        checkIndex(index);
        sets.set(index, ImmutableSortedSet.copyOf(elements));
    }

    public void setSet(char name, Iterable<Integer> elements) {
        setSet(index(name), elements);
    }

    /**
     * Returns the union of all sets currently bound in this table.
     */
    public ImmutableSortedSet<Integer> universe() {
        ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
        for (ImmutableSortedSet<Integer> set : sets) {
            builder.addAll(set);
        }
        return builder.build();
    }
}

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
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * The truth table of a formula over an ordered list of variables. Row {@code i} corresponds to the
 * assignment in which the first variable is the most significant bit of {@code i} and the last
 * variable the least significant one.
 */
public final class TruthTable {
    /**
     * Tables are materialized as arrays; more variables than this are not sensible for exhaustive
     * enumeration anyway.
     */
    public static final int MAX_VARIABLES = 24;

    private final ImmutableList<Character> variables;
    private final boolean[] values;

    private TruthTable(ImmutableList<Character> variables, boolean[] values) {
        this.variables = variables;
        this.values = values;
    }

    public static TruthTable of(Formula formula) {
        return of(formula, formula.variables());
    }

    /**
     * Computes the table of {@code formula} over the given variables, which must include every
     * variable of the formula. Variables not occurring in the formula simply do not influence the
     * result.
     */
    public static TruthTable of(Formula formula, List<Character> variables) {
        BitSet occurring = formula.root().variables();
        for (char name : variables) {
            occurring.clear(VariableTable.index(name));
        }
        if (!occurring.isEmpty()) {
            throw new IllegalArgumentException(
                String.format("Variables %s do not cover formula %s", variables, formula));
        }
        if (variables.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Too many variables: " + variables.size());
        }

        ImmutableList<Character> order = ImmutableList.copyOf(variables);
        boolean[] values = new boolean[1 << order.size()];
        for (int row = 0; row < values.length; row++) {
            assign(formula.table(), order, row);
            values[row] = formula.evaluate();
        }
        return new TruthTable(order, values);
    }

    /**
     * Sets the variables of {@code table} to the assignment of row {@code row} over {@code order}.
     */
    static void assign(VariableTable table, List<Character> order, int row) {
        int width = order.size();
        for (int position = 0; position < width; position++) {
            int bit = width - position - 1;
            table.setValue(order.get(position), ((row >>> bit) & 1) == 1);
        }
    }

    public ImmutableList<Character> variables() {
        return variables;
    }

    public int size() {
        return values.length;
    }

    public boolean get(int row) {
        return values[row];
    }

    public boolean[] values() {
        return values.clone();
    }

    /**
     * Returns the indices of all rows evaluating to false, in ascending order.
     */
    public int[] zeroRows() {
        int count = 0;
        for (boolean value : values) {
            if (!value) {
                count += 1;
            }
        }
        int[] rows = new int[count];
        int pos = 0;
        for (int row = 0; row < values.length; row++) {
            if (!values[row]) {
                rows[pos] = row;
                pos += 1;
            }
        }
        return rows;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof TruthTable)) {
            return false;
        }
        TruthTable that = (TruthTable) object;
        return variables.equals(that.variables) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(variables.size() + values.length + 2);
        for (char variable : variables) {
            builder.append(variable);
        }
        builder.append(':');
        for (boolean value : values) {
            builder.append(value ? '1' : '0');
        }
        return builder.toString();
    }
}

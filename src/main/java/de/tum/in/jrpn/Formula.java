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

/**
 * A parsed formula: the root node of the expression tree together with the variable table that
 * all variable leaves of the tree refer to.
 */
public final class Formula {
    private final Node root;
    private final VariableTable variables;

    Formula(Node root, VariableTable variables) {
        this.root = root;
        this.variables = variables;
    }

    /**
     * Creates a formula with the given root and a fresh variable table.
     */
    public static Formula of(Node root) {
        return new Formula(root, new VariableTable());
    }

    public static Formula parse(String rpn) throws RpnParser.ParseException {
        return RpnParser.parse(rpn);
    }

    public Node root() {
        return root;
    }

    public VariableTable table() {
        return variables;
    }

    /**
     * Returns the letters occurring in this formula, in alphabetical order.
     */
    public ImmutableList<Character> variables() {
        BitSet set = root.variables();
        ImmutableList.Builder<Character> builder = ImmutableList.builder();
        for (int i = set.nextSetBit(0); i >= 0; i = set.nextSetBit(i + 1)) {
            builder.add(VariableTable.name(i));
        }
        return builder.build();
    }

    public void assign(char variable, boolean value) {
        variables.setValue(variable, value);
    }

    /**
     * Binds the given sets to the variables of this formula in alphabetical order. Variables
     * without a corresponding set keep their current binding.
     */
    public void assignSets(List<? extends Iterable<Integer>> sets) {
        List<Character> names = variables();
        if (sets.size() > names.size()) {
            throw new IllegalArgumentException(String.format(
                "Got %d sets for %d variables %s", sets.size(), names.size(), names));
        }
        for (int i = 0; i < sets.size(); i++) {
            variables.setSet(names.get(i), sets.get(i));
        }
    }

    /**
     * Evaluates the formula under the current truth values of the variable table.
     */
    public boolean evaluate() {
        return root.evaluate(variables);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}

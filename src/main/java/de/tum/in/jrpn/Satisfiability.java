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

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brute-force satisfiability check by enumerating all assignments in truth table order.
 */
public final class Satisfiability {
    private static final Logger logger = Logger.getLogger(Satisfiability.class.getName());

    private Satisfiability() {}

    public static boolean isSatisfiable(Formula formula) {
        return satisfyingRow(formula) >= 0;
    }

    /**
     * Returns the first truth table row under which {@code formula} is true, or {@code -1} if it
     * is unsatisfiable. The variable table of the formula is left at the last examined assignment.
     */
    public static int satisfyingRow(Formula formula) {
        List<Character> variables = formula.variables();
        if (variables.size() > TruthTable.MAX_VARIABLES) {
            throw new IllegalArgumentException("Too many variables: " + variables.size());
        }
        int rows = 1 << variables.size();
        for (int row = 0; row < rows; row++) {
            TruthTable.assign(formula.table(), variables, row);
            if (formula.evaluate()) {
                logger.log(Level.FINER, "{0} satisfied by row {1}", new Object[] {formula, row});
                return row;
            }
        }
        logger.log(Level.FINER, "{0} is unsatisfiable", formula);
        return -1;
    }
}

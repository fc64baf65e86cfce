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

import javax.annotation.Nullable;

/**
 * The binary connectives of the RPN alphabet together with their wire symbol.
 */
public enum BinaryOperator {
    AND('&'),
    OR('|'),
    XOR('^'),
    IMPLICATION('>'),
    EQUIVALENCE('=');

    private final char symbol;

    BinaryOperator(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the operator encoded by {@code symbol}, or {@code null} if the character is not an
     * operator symbol.
     */
    @Nullable
    public static BinaryOperator fromSymbol(char symbol) {
        switch (symbol) {
            case '&':
                return AND;
            case '|':
                return OR;
            case '^':
                return XOR;
            case '>':
                return IMPLICATION;
            case '=':
                return EQUIVALENCE;
            default:
                return null;
        }
    }

    public char symbol() {
        return symbol;
    }

    public boolean apply(boolean left, boolean right) {
        switch (this) {
            case AND:
                return left && right;
            case OR:
                return left || right;
            case XOR:
                return left ^ right;
            case IMPLICATION:
                return !left || right;
            case EQUIVALENCE:
                return left == right;
            default:
                throw new IllegalStateException("Unknown type");
        }
    }

    /**
     * Whether nested occurrences of this operator may be collapsed into a single n-ary node.
     */
    public boolean isAssociative() {
        return this == AND || this == OR;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}

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
import java.util.List;

/**
 * Integer arithmetic built from bitwise operations only. All operations wrap around on overflow
 * like the corresponding {@code int} operations.
 */
public final class BitArithmetic {
    private BitArithmetic() {}

    /**
     * Adds by repeatedly combining the carry-less sum with the shifted carry.
     */
    public static int add(int left, int right) {
        int sum = left;
        int carry = right;
        while (carry != 0) {
            int shiftedCarry = (sum & carry) << 1;
            sum ^= carry;
            carry = shiftedCarry;
        }
        return sum;
    }

    public static int multiply(int left, int right) {
        int product = 0;
        int multiplicand = left;
        int multiplier = right;
        while (multiplier != 0) {
            if ((multiplier & 1) != 0) {
                product = add(product, multiplicand);
            }
            multiplicand <<= 1;
            multiplier >>>= 1;
        }
        return product;
    }

    public static int grayCode(int value) {
        return value ^ (value >>> 1);
    }

    /**
     * Returns all subsets of {@code elements}, ordered by size and, within the same size, by
     * enumeration order. Elements of each subset keep their order in {@code elements}.
     */
    public static <T> ImmutableList<ImmutableList<T>> powerSet(List<T> elements) {
        if (elements.size() >= Integer.SIZE - 1) {
            throw new IllegalArgumentException("Too many elements: " + elements.size());
        }
        List<ImmutableList<T>> subsets = new ArrayList<>(1 << elements.size());
        PowerSetIterator iterator = new PowerSetIterator(elements.size());
        while (iterator.hasNext()) {
            BitSet selection = iterator.next();
            ImmutableList.Builder<T> subset = ImmutableList.builder();
            for (int i = selection.nextSetBit(0); i >= 0; i = selection.nextSetBit(i + 1)) {
                subset.add(elements.get(i));
            }
            subsets.add(subset.build());
        }
        // Stable, so equally sized subsets keep their enumeration order
        subsets.sort(Comparator.comparingInt(List::size));
        return ImmutableList.copyOf(subsets);
    }
}

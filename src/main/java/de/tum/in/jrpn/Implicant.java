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
import java.util.Arrays;
import java.util.BitSet;

/**
 * A row of the Quine-McCluskey table: a cube over {@code width} variables, each position being
 * {@code 0}, {@code 1} or don't care, together with the sorted indices of the truth table rows
 * it covers.
 */
public final class Implicant {
    private final Bit[] bits;
    private final ImmutableSortedSet<Integer> rows;

    private Implicant(Bit[] bits, ImmutableSortedSet<Integer> rows) {
        this.bits = bits;
        this.rows = rows;
    }

    /**
     * Creates the implicant of a single truth table row, the first variable being the most
     * significant bit of {@code row}.
     */
    public static Implicant ofRow(int row, int width) {
        assert 0 <= row && (width >= Integer.SIZE - 1 || row < (1 << width));
        Bit[] bits = new Bit[width];
        for (int position = 0; position < width; position++) {
            bits[position] = ((row >>> (width - position - 1)) & 1) == 1 ? Bit.TRUE : Bit.FALSE;
        }
        return new Implicant(bits, ImmutableSortedSet.of(row));
    }

    public int width() {
        return bits.length;
    }

    public Bit bit(int position) {
        return bits[position];
    }

    public ImmutableList<Bit> bits() {
        return ImmutableList.copyOf(bits);
    }

    public ImmutableSortedSet<Integer> rows() {
        return rows;
    }

    public boolean covers(int row) {
        return rows.contains(row);
    }

    /**
     * Returns the positions which are not don't care.
     */
    public BitSet careMask() {
        BitSet mask = new BitSet(bits.length);
        for (int position = 0; position < bits.length; position++) {
            if (bits[position] != Bit.DONT_CARE) {
                mask.set(position);
            }
        }
        return mask;
    }

    /**
     * Two implicants can be merged if they have the same care mask and differ in exactly one of
     * the cared positions.
     */
    public boolean canMerge(Implicant other) {
        if (other.bits.length != bits.length) {
            return false;
        }
        int differences = 0;
        for (int position = 0; position < bits.length; position++) {
            Bit bit = bits[position];
            Bit otherBit = other.bits[position];
            if ((bit == Bit.DONT_CARE) != (otherBit == Bit.DONT_CARE)) {
                return false;
            }
            if (bit != otherBit) {
                differences += 1;
                if (differences > 1) {
                    return false;
                }
            }
        }
        return differences == 1;
    }

    public Implicant merge(Implicant other) {
        if (!canMerge(other)) {
            throw new IllegalArgumentException(String.format("Cannot merge %s and %s", this, other));
        }
        Bit[] merged = bits.clone();
        for (int position = 0; position < bits.length; position++) {
            if (bits[position] != other.bits[position]) {
                merged[position] = Bit.DONT_CARE;
            }
        }
        ImmutableSortedSet<Integer> mergedRows = ImmutableSortedSet.<Integer>naturalOrder()
            .addAll(rows).addAll(other.rows).build();
        return new Implicant(merged, mergedRows);
    }

    /**
     * Returns the sum of the {@link Bit#cost() costs} of all positions.
     */
    public int cost() {
        int cost = 0;
        for (Bit bit : bits) {
            cost += bit.cost();
        }
        return cost;
    }

    /**
     * Two implicants are equal if they describe the same cube and cover the same rows.
     */
    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Implicant)) {
            return false;
        }
        Implicant that = (Implicant) object;
        return Arrays.equals(bits, that.bits) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bits) + rows.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(bits.length + 16);
        for (Bit bit : bits) {
            builder.append(bit.symbol());
        }
        return builder.append(' ').append(rows).toString();
    }

    public enum Bit {
        FALSE('0', 2),
        TRUE('1', 1),
        DONT_CARE('-', 0);

        private final char symbol;
        private final int cost;

        Bit(char symbol, int cost) {
            this.symbol = symbol;
            this.cost = cost;
        }

        public char symbol() {
            return symbol;
        }

        /**
         * Tie-breaking weight used when choosing between covers of equal size.
         */
        public int cost() {
            return cost;
        }
    }
}

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

import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates all subsets of {@code {0, ..., size - 1}} in binary counting order, starting with the
 * empty set. The returned set is reused between calls to {@link #next()}.
 */
final class PowerSetIterator implements Iterator<BitSet> {
    private final int size;
    private final BitSet current;
    private int cardinality = -1;

    PowerSetIterator(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative size " + size);
        }
        this.size = size;
        this.current = new BitSet(size);
    }

    @Override
    public boolean hasNext() {
        return cardinality < size;
    }

    @SuppressWarnings("AssignmentOrReturnOfFieldWithMutableType")
    @Override
    public BitSet next() {
        if (cardinality == -1) {
            cardinality = 0;
            return current;
        }
        if (cardinality == size) {
            throw new NoSuchElementException("No next subset");
        }

        // Binary increment: clear the trailing ones, set the first zero
        int zero = current.nextClearBit(0);
        current.clear(0, zero);
        current.set(zero);
        cardinality += 1 - zero;
        return current;
    }
}

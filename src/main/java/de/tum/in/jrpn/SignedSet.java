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
import com.google.common.collect.Sets;
import java.util.Objects;

/**
 * A set of integers that is either given by its elements ({@link #positive(Iterable) positive})
 * or as the complement of its elements ({@link #negative(Iterable) negative}) with respect to a
 * universe that is only fixed on {@link #materialize(ImmutableSortedSet) materialization}.
 */
public final class SignedSet {
    private static final SignedSet EMPTY = new SignedSet(false, ImmutableSortedSet.of());
    private static final SignedSet UNIVERSE = new SignedSet(true, ImmutableSortedSet.of());

    private final boolean negative;
    private final ImmutableSortedSet<Integer> elements;

    private SignedSet(boolean negative, ImmutableSortedSet<Integer> elements) {
        this.negative = negative;
        this.elements = elements;
    }

    public static SignedSet empty() {
        return EMPTY;
    }

    public static SignedSet universe() {
        return UNIVERSE;
    }

    public static SignedSet positive(Iterable<Integer> elements) {
        return new SignedSet(false, ImmutableSortedSet.copyOf(elements));
    }

    public static SignedSet negative(Iterable<Integer> elements) {
        return new SignedSet(true, ImmutableSortedSet.copyOf(elements));
    }

    public boolean isNegative() {
        return negative;
    }

    public ImmutableSortedSet<Integer> elements() {
        return elements;
    }

    public SignedSet complement() {
        return new SignedSet(!negative, elements);
    }

    public SignedSet union(SignedSet other) {
        if (!negative && !other.negative) {
            return of(false, Sets.union(elements, other.elements));
        }
        if (!negative) {
            return of(true, Sets.difference(other.elements, elements));
        }
        if (!other.negative) {
            return of(true, Sets.difference(elements, other.elements));
        }
        return of(true, Sets.intersection(elements, other.elements));
    }

    public SignedSet intersection(SignedSet other) {
        if (!negative && !other.negative) {
            return of(false, Sets.intersection(elements, other.elements));
        }
        if (!negative) {
            return of(false, Sets.difference(elements, other.elements));
        }
        if (!other.negative) {
            return of(false, Sets.difference(other.elements, elements));
        }
        return of(true, Sets.union(elements, other.elements));
    }

    public SignedSet difference(SignedSet other) {
        return intersection(other.complement());
    }

    private static SignedSet of(boolean negative, Sets.SetView<Integer> elements) {
        return new SignedSet(negative, ImmutableSortedSet.copyOf(elements));
    }

    /**
     * Returns the elements of this set within {@code universe}.
     */
    public ImmutableSortedSet<Integer> materialize(ImmutableSortedSet<Integer> universe) {
        return negative
            ? ImmutableSortedSet.copyOf(Sets.difference(universe, elements))
            : elements;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof SignedSet)) {
            return false;
        }
        SignedSet that = (SignedSet) object;
        return negative == that.negative && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(negative, elements);
    }

    @Override
    public String toString() {
        return (negative ? "!" : "") + elements;
    }
}

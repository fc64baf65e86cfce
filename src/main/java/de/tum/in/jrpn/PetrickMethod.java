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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Petrick's method: selects a minimum set of prime implicants covering the given rows. For every
 * row the disjunction of the implicants covering it is formed. Sums containing another sum are
 * dropped, the conjunction of the remaining sums is multiplied out and absorbed
 * ({@code x + xy = x}) after every step, and the product with the fewest factors is chosen. Ties
 * are broken by the total {@link Implicant#cost() cost} and then by the order in which the
 * products were produced.
 */
public final class PetrickMethod {
    private static final Logger logger = Logger.getLogger(PetrickMethod.class.getName());

    private PetrickMethod() {}

    /**
     * Returns the indices into {@code primes} of a minimum cover of {@code rows}.
     *
     * @throws IllegalArgumentException if some row is not covered by any implicant.
     */
    public static BitSet cover(List<Implicant> primes, int[] rows) {
        List<BitSet> sums = new ArrayList<>(rows.length);
        for (int row : rows) {
            BitSet sum = new BitSet(primes.size());
            for (int i = 0; i < primes.size(); i++) {
                if (primes.get(i).covers(row)) {
                    sum.set(i);
                }
            }
            if (sum.isEmpty()) {
                throw new IllegalArgumentException("Row " + row + " is not covered by " + primes);
            }
            sums.add(sum);
        }
        sums = minimalSums(sums);
        logger.log(Level.FINEST, "Petrick sums: {0}", sums);

        List<BitSet> products = new ArrayList<>();
        products.add(new BitSet(primes.size()));
        for (BitSet sum : sums) {
            products = multiply(products, sum);
        }
        logger.log(Level.FINEST, "Petrick products: {0}", products);

        BitSet best = null;
        int bestCost = Integer.MAX_VALUE;
        for (BitSet product : products) {
            int cost = cost(primes, product);
            if (best == null || product.cardinality() < best.cardinality()
                || (product.cardinality() == best.cardinality() && cost < bestCost)) {
                best = product;
                bestCost = cost;
            }
        }
        assert best != null;
        logger.log(Level.FINER, "Selected cover {0} with cost {1}", new Object[] {best, bestCost});
        return best;
    }

    /**
     * Removes every sum which contains another sum. Any product satisfying the contained sum also
     * satisfies the larger one, so the set of minimal products is unchanged.
     */
    static List<BitSet> minimalSums(List<BitSet> sums) {
        List<BitSet> result = new ArrayList<>(sums.size());
        for (BitSet sum : sums) {
            absorb(result, sum);
        }
        return result;
    }

    private static List<BitSet> multiply(List<BitSet> products, BitSet sum) {
        List<BitSet> result = new ArrayList<>(products.size() * sum.cardinality());
        for (BitSet product : products) {
            for (int i = sum.nextSetBit(0); i >= 0; i = sum.nextSetBit(i + 1)) {
                BitSet extended = (BitSet) product.clone();
                extended.set(i);
                absorb(result, extended);
            }
        }
        return result;
    }

    /**
     * Adds {@code product} to {@code products} unless it contains an existing element, and removes
     * all existing elements containing it.
     */
    private static void absorb(List<BitSet> products, BitSet product) {
        for (BitSet existing : products) {
            if (isSubset(existing, product)) {
                return;
            }
        }
        Iterator<BitSet> iterator = products.iterator();
        while (iterator.hasNext()) {
            if (isSubset(product, iterator.next())) {
                iterator.remove();
            }
        }
        products.add(product);
    }

    private static boolean isSubset(BitSet subset, BitSet superset) {
        BitSet difference = (BitSet) subset.clone();
        difference.andNot(superset);
        return difference.isEmpty();
    }

    private static int cost(List<Implicant> primes, BitSet product) {
        int cost = 0;
        for (int i = product.nextSetBit(0); i >= 0; i = product.nextSetBit(i + 1)) {
            cost += primes.get(i).cost();
        }
        return cost;
    }
}

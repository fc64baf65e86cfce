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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableSortedSet;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class RandomFormulaGeneratorTest {
    private static int depth(Node node) {
        int depth = 0;
        for (Node child : node.children()) {
            depth = Math.max(depth, depth(child) + 1);
        }
        return depth + node.negations();
    }

    @Test
    public void testReproducible() {
        RandomFormulaGenerator first = new RandomFormulaGenerator(new Random(42));
        RandomFormulaGenerator second = new RandomFormulaGenerator(new Random(42));
        for (int i = 0; i < 50; i++) {
            assertThat(first.generate(6, 8), is(second.generate(6, 8)));
        }
    }

    @Test
    public void testBounds() throws RpnParser.ParseException {
        RandomFormulaGenerator generator = new RandomFormulaGenerator(new Random(0));
        for (int i = 0; i < 200; i++) {
            Node node = generator.generate(5, 3);
            assertThat(depth(node), lessThanOrEqualTo(5));
            assertThat(node.variables().length(), lessThanOrEqualTo(3));
            assertThat(Formula.parse(node.toString()).root(), is(node));
        }
        assertThat(generator.generate(0, 1), is(Node.variable('A')));
    }

    @Test
    public void testDeepRootIsNoVariable() {
        RandomFormulaGenerator generator = new RandomFormulaGenerator(new Random(1));
        for (int i = 0; i < 100; i++) {
            Node node = generator.generate(5, 4);
            assertThat(node.isVariable() && node.negations() == 0, is(false));
        }
    }

    @Test
    public void testRandomSets() {
        RandomFormulaGenerator generator = new RandomFormulaGenerator(new Random(0));
        for (ImmutableSortedSet<Integer> set : generator.randomSets(100, 10)) {
            assertThat(set.size(), lessThan(10));
            for (int element : set) {
                assertThat(element, lessThan(256));
            }
        }
    }

    @Test
    public void testInvalidBounds() {
        RandomFormulaGenerator generator = new RandomFormulaGenerator(new Random(0));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(-1, 3));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(3, 0));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(3, 27));
    }
}

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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class TruthTableTest {
    @Test
    public void testConjunction() throws RpnParser.ParseException {
        TruthTable table = TruthTable.of(Formula.parse("AB&"));
        assertThat(table.values(), is(new boolean[] {false, false, false, true}));
        assertThat(table.variables(), is(List.of('A', 'B')));
        assertThat(table.zeroRows(), is(new int[] {0, 1, 2}));
    }

    @Test
    public void testRowOrder() throws RpnParser.ParseException {
        // The first variable is the most significant bit
        assertThat(TruthTable.of(Formula.parse("AB>")).values(),
            is(new boolean[] {true, true, false, true}));
        assertThat(TruthTable.of(Formula.parse("BA&!A&")).toString(), is("AB:0010"));
    }

    @Test
    public void testWithoutVariables() throws RpnParser.ParseException {
        TruthTable table = TruthTable.of(Formula.parse("1011||="));
        assertThat(table.size(), is(1));
        assertThat(table.get(0), is(true));
        assertThat(table.zeroRows().length, is(0));
    }

    @Test
    public void testExplicitVariables() throws RpnParser.ParseException {
        TruthTable table = TruthTable.of(Formula.parse("A"), List.of('A', 'B'));
        assertThat(table.values(), is(new boolean[] {false, false, true, true}));
        assertThat(TruthTable.of(Formula.parse("B"), List.of('A', 'B')),
            is(TruthTable.of(Formula.parse("AA!|B&"))));
        assertThrows(IllegalArgumentException.class,
            () -> TruthTable.of(Formula.parse("AB&"), List.of('A')));
    }
}

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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class SimplifierTest {
    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "A1&, A", "A0&, 0", "A0|, A", "A1|, 1", "0A|, A",
        "A0^, A", "A1^, A!", "1A^, A!",
        "A1>, 1", "0A>, 1", "1A>, A", "A0>, A!",
        "A1=, A", "A0=, A!", "1A=, A",
        "AA&, A", "AA|, A", "AA^, 0", "AA=, 1", "AA>, 1",
        "AA!&, 0", "AA!|, 1", "AA!^, 1", "AA!=, 0", "AA!>, A!", "A!A>, A",
        "A!!, A", "AB&!!, AB&", "AB&!!!, AB&!",
        "AB&C&, ABC&&", "AB|CD||, ABCD|||", "AB&C&D|, ABC&&D|",
        "AB=, AB=", "AB^C^, AB^C^", "AB>, AB>",
        "AB&B&A1&&, AB&", "AB&!C&, AB&!C&"
    })
    public void testSimplify(String input, String expected) throws RpnParser.ParseException {
        Formula formula = Formula.parse(input);
        Formula simplified = Simplifier.simplify(formula);
        assertThat(simplified.toString(), is(expected));
        assertThat(TruthTable.of(simplified, formula.variables()), is(TruthTable.of(formula)));
    }
}

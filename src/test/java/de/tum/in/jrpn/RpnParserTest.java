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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class RpnParserTest {
    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"0", "1", "A", "AB&", "AB&!C!|", "AB!!!&", "1011||=", "AB>C=D^",
        "111&!!!1|01=|=11>^0|0!1^11>1|0>1^>10^1|>10^>^"})
    public void testRoundTrip(String rpn) throws RpnParser.ParseException {
        assertThat(RpnParser.parse(rpn).toString(), is(rpn));
    }

    @Test
    public void testEvaluateConstants() throws RpnParser.ParseException {
        assertThat(RpnParser.parse("1011||=").evaluate(), is(true));
        assertThat(RpnParser.parse("111&!!!1|01=|=11>^0|0!1^11>1|0>1^>10^1|>10^>^").evaluate(), is(true));
        assertThat(RpnParser.parse("10>").evaluate(), is(false));
        assertThat(RpnParser.parse("01>").evaluate(), is(true));
        assertThat(RpnParser.parse("10^").evaluate(), is(true));
        assertThat(RpnParser.parse("00=").evaluate(), is(true));
        assertThat(RpnParser.parse("1!").evaluate(), is(false));
        assertThat(RpnParser.parse("1!!").evaluate(), is(true));
    }

    @Test
    public void testMissingOperand() {
        RpnParser.ParseException exception =
            assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse("1&"));
        assertThat(exception.reason(), is(RpnParser.ParseException.Reason.MISSING_OPERAND));
        assertThat(exception.character(), is('&'));
        assertThat(exception.position(), is(1));

        exception = assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse("!"));
        assertThat(exception.reason(), is(RpnParser.ParseException.Reason.MISSING_OPERAND));
        assertThat(exception.position(), is(0));
    }

    @Test
    public void testInvalidCharacter() {
        RpnParser.ParseException exception =
            assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse("1x|"));
        assertThat(exception.reason(), is(RpnParser.ParseException.Reason.INVALID_CHARACTER));
        assertThat(exception.character(), is('x'));
        assertThat(exception.position(), is(1));
        assertThat(exception.getMessage(), is("Invalid character: 'x' at position 1"));

        exception = assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse("1x!"));
        assertThat(exception.reason(), is(RpnParser.ParseException.Reason.INVALID_CHARACTER));

        // The character is checked before the operands
        exception = assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse("1+"));
        assertThat(exception.reason(), is(RpnParser.ParseException.Reason.INVALID_CHARACTER));

        exception = assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse("A B&"));
        assertThat(exception.character(), is(' '));
        exception = assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse("ab&"));
        assertThat(exception.character(), is('a'));
    }

    @Test
    public void testUnbalanced() {
        RpnParser.ParseException exception =
            assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse("00&1"));
        assertThat(exception.reason(), is(RpnParser.ParseException.Reason.UNBALANCED_EXPRESSION));
        assertThat(exception.position(), is(-1));

        exception = assertThrows(RpnParser.ParseException.class, () -> RpnParser.parse(""));
        assertThat(exception.reason(), is(RpnParser.ParseException.Reason.UNBALANCED_EXPRESSION));
    }

    @Test
    public void testSharedVariables() throws RpnParser.ParseException {
        Formula formula = RpnParser.parse("AA!|B&");
        formula.assign('A', true);
        formula.assign('B', true);
        assertThat(formula.evaluate(), is(true));
        formula.assign('B', false);
        assertThat(formula.evaluate(), is(false));

        Formula conjunction = RpnParser.parse("AA&");
        conjunction.assign('A', true);
        assertThat(conjunction.evaluate(), is(true));
        conjunction.assign('A', false);
        assertThat(conjunction.evaluate(), is(false));
    }

    @Test
    public void testVariables() throws RpnParser.ParseException {
        List<Character> variables = RpnParser.parse("DB&A|B^").variables();
        assertThat(variables, contains('A', 'B', 'D'));
        assertThat(RpnParser.parse("10&").variables().isEmpty(), is(true));
    }

    @Test
    public void testStructure() throws RpnParser.ParseException {
        Node root = RpnParser.parse("AB>!!").root();
        assertThat(root.negations(), is(2));
        assertThat(root.isNegated(), is(false));
        assertThat(root.isOperation(BinaryOperator.IMPLICATION), is(true));
        assertThat(root.children().get(0), is(Node.variable('A')));
        assertThat(root.children().get(1), is(Node.variable('B')));
        assertThat(root.literalCount(), is(2));
    }
}

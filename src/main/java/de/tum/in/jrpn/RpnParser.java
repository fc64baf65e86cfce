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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Parser for propositional formulas in reverse polish notation over the alphabet {@code 0},
 * {@code 1}, {@code A-Z}, {@code !} and the binary operator symbols of {@link BinaryOperator}.
 */
public final class RpnParser {
    private RpnParser() {}

    public static Formula parse(String input) throws ParseException {
        VariableTable variables = new VariableTable();
        Deque<Node> stack = new ArrayDeque<>(input.length());

        for (int position = 0; position < input.length(); position++) {
            char character = input.charAt(position);
            if (character == '0' || character == '1') {
                stack.push(Node.constant(character == '1'));
            } else if ('A' <= character && character <= 'Z') {
                stack.push(Node.variable(character));
            } else if (character == '!') {
                if (stack.isEmpty()) {
                    throw ParseException.missingOperand(position, character);
                }
                stack.push(stack.pop().negate());
            } else {
                BinaryOperator operator = BinaryOperator.fromSymbol(character);
                if (operator == null) {
                    throw ParseException.invalidCharacter(position, character);
                }
                if (stack.size() < 2) {
                    throw ParseException.missingOperand(position, character);
                }
                // Right operand is on top, the order matters for implication
                Node right = stack.pop();
                Node left = stack.pop();
                stack.push(Node.binary(operator, left, right));
            }
        }

        if (stack.size() != 1) {
            throw ParseException.unbalanced(stack.size());
        }
        return new Formula(stack.pop(), variables);
    }

    public static class ParseException extends Exception {
        private static final long serialVersionUID = 1L;

        private final Reason reason;
        private final int position;
        private final char character;

        ParseException(String message, Reason reason, int position, char character) {
            super(message);
            this.reason = reason;
            this.position = position;
            this.character = character;
        }

        static ParseException invalidCharacter(int position, char character) {
            return new ParseException(
                String.format("Invalid character: '%c' at position %d", character, position),
                Reason.INVALID_CHARACTER, position, character);
        }

        static ParseException missingOperand(int position, char character) {
            return new ParseException(
                String.format("Missing operand for '%c' at position %d", character, position),
                Reason.MISSING_OPERAND, position, character);
        }

        static ParseException unbalanced(int remaining) {
            return new ParseException(
                String.format("Unbalanced expression: %d nodes left on the stack", remaining),
                Reason.UNBALANCED_EXPRESSION, -1, '\0');
        }

        public Reason reason() {
            return reason;
        }

        /**
         * Returns the offending character, or {@code '\0'} for an unbalanced expression.
         */
        public char character() {
            return character;
        }

        /**
         * Returns the input position of the offending character, or {@code -1} for an
         * unbalanced expression.
         */
        public int position() {
            return position;
        }

        public enum Reason {
            INVALID_CHARACTER,
            MISSING_OPERAND,
            UNBALANCED_EXPRESSION
        }
    }
}

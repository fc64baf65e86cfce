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
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * The payload of a {@link Node}: a constant, a reference into the {@link VariableTable} of the
 * owning formula, or an operator applied to an ordered list of child nodes.
 */
@SuppressWarnings({"AccessingNonPublicFieldOfAnotherObject", "checkstyle:javadoc"})
public abstract class Literal {
    Literal() {
        // Closed hierarchy
    }

    abstract boolean evaluate(VariableTable table);

    abstract void gatherVariables(BitSet set);

    abstract int literalCount();

    abstract void appendTo(StringBuilder builder);

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        appendTo(builder);
        return builder.toString();
    }

    public static final class Constant extends Literal {
        static final Constant FALSE = new Constant(false);
        static final Constant TRUE = new Constant(true);

        private final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        static Constant of(boolean value) {
            return value ? TRUE : FALSE;
        }

        public boolean value() {
            return value;
        }

        @Override
        boolean evaluate(VariableTable table) {
            return value;
        }

        @Override
        void gatherVariables(BitSet set) {
            // No variables in this leaf
        }

        @Override
        int literalCount() {
            return 1;
        }

        @Override
        void appendTo(StringBuilder builder) {
            builder.append(value ? '1' : '0');
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Constant)) {
                return false;
            }
            return value == ((Constant) object).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }
    }

    public static final class Variable extends Literal {
        private final int index;

        Variable(int index) {
            assert 0 <= index && index < VariableTable.SIZE;
            this.index = index;
        }

        public int index() {
            return index;
        }

        public char name() {
            return VariableTable.name(index);
        }

        @Override
        boolean evaluate(VariableTable table) {
            return table.value(index);
        }

        @Override
        void gatherVariables(BitSet set) {
            set.set(index);
        }

        @Override
        int literalCount() {
            return 1;
        }

        @Override
        void appendTo(StringBuilder builder) {
            builder.append(name());
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Variable)) {
                return false;
            }
            return index == ((Variable) object).index;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(index);
        }
    }

    public static final class Operation extends Literal {
        private final BinaryOperator operator;
        private final ImmutableList<Node> children;

        Operation(BinaryOperator operator, List<Node> children) {
            if (children.size() < 2) {
                throw new IllegalArgumentException(
                    String.format("Operator %s needs at least two operands, got %d", operator,
                        children.size()));
            }
            this.operator = operator;
            this.children = ImmutableList.copyOf(children);
        }

        public BinaryOperator operator() {
            return operator;
        }

        public ImmutableList<Node> children() {
            return children;
        }

        public int arity() {
            return children.size();
        }

        @Override
        boolean evaluate(VariableTable table) {
            // Left-associative fold, also for the non-associative connectives
            boolean result = children.get(0).evaluate(table);
            for (int i = 1; i < children.size(); i++) {
                result = operator.apply(result, children.get(i).evaluate(table));
            }
            return result;
        }

        @Override
        void gatherVariables(BitSet set) {
            for (Node child : children) {
                child.literal().gatherVariables(set);
            }
        }

        @Override
        int literalCount() {
            int count = 0;
            for (Node child : children) {
                count += child.literalCount();
            }
            return count;
        }

        @Override
        void appendTo(StringBuilder builder) {
            for (Node child : children) {
                child.appendTo(builder);
            }
            for (int i = 1; i < children.size(); i++) {
                builder.append(operator.symbol());
            }
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Operation)) {
                return false;
            }
            Operation that = (Operation) object;
            return operator == that.operator && children.equals(that.children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, children);
        }
    }
}

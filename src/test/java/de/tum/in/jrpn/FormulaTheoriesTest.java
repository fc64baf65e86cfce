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
import static org.hamcrest.Matchers.lessThanOrEqualTo;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks the relations between the evaluator, the rewriters and the minimizer on random formulas.
 */
@SuppressWarnings({
    "checkstyle:javadoc",
    "NewClassNamingConvention",
    "PMD.ClassNamingConventions"
})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class FormulaTheoriesTest {
    private static final Logger logger = Logger.getLogger(FormulaTheoriesTest.class.getName());

    private static final int formulaCount = 300;
    private static final int maxDepth = 4;
    private static final int maxVariables = 4;
    private static final int setCount = 100;

    private static final List<Node> formulas;
    private static final List<SetDataPoint> setDataPoints;

    static {
        // Generated once with a fixed seed so that failures are reproducible
        RandomFormulaGenerator generator = new RandomFormulaGenerator(new Random(0L));
        List<Node> nodes = new ArrayList<>(formulaCount);
        for (int i = 0; i < formulaCount; i++) {
            nodes.add(generator.generate(maxDepth, maxVariables));
        }
        formulas = ImmutableList.copyOf(nodes);

        List<SetDataPoint> points = new ArrayList<>(setCount);
        for (int i = 0; i < setCount; i++) {
            Node node = generator.generate(maxDepth, maxVariables);
            int variables = Formula.of(node).variables().size();
            points.add(new SetDataPoint(node, generator.randomSets(variables, 10)));
        }
        setDataPoints = ImmutableList.copyOf(points);
        logger.log(Level.INFO, "Generated {0} formulas and {1} set data points",
            new Object[] {formulas.size(), setDataPoints.size()});
    }

    public static Stream<Node> formulas() {
        return formulas.stream();
    }

    public static Stream<SetDataPoint> setDataPoints() {
        return setDataPoints.stream();
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testRoundTrip(Node node) throws RpnParser.ParseException {
        String rpn = node.toString();
        assertThat(RpnParser.parse(rpn).toString(), is(rpn));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testNegationNormalForm(Node node) {
        Formula formula = Formula.of(node);
        Node nnf = NegationNormalForm.of(node);
        assertThat(NegationNormalForm.isNegationNormalForm(nnf), is(true));
        assertThat(TruthTable.of(Formula.of(nnf), formula.variables()), is(TruthTable.of(formula)));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testConjunctiveNormalForm(Node node) {
        Formula formula = Formula.of(node);
        Node cnf = ConjunctiveNormalForm.of(node);
        assertThat(ConjunctiveNormalForm.isConjunctiveNormalForm(cnf), is(true));
        assertThat(TruthTable.of(Formula.of(cnf), formula.variables()), is(TruthTable.of(formula)));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testSimplify(Node node) {
        Formula formula = Formula.of(node);
        Node simplified = Simplifier.simplify(node);
        assertThat(TruthTable.of(Formula.of(simplified), formula.variables()), is(TruthTable.of(formula)));
        assertThat(simplified.negations(), lessThanOrEqualTo(1));
        assertThat(Simplifier.simplify(simplified), is(simplified));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testMinimize(Node node) {
        Formula formula = Formula.of(node);
        TruthTable table = TruthTable.of(formula);
        Node minimized = QuineMcCluskey.minimize(table);
        assertThat(TruthTable.of(Formula.of(minimized), formula.variables()), is(table));
        assertThat(ConjunctiveNormalForm.isConjunctiveNormalForm(minimized), is(true));
        assertThat(minimized.literalCount(),
            lessThanOrEqualTo(QuineMcCluskey.canonicalForm(table).literalCount()));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testSatisfiability(Node node) {
        Formula formula = Formula.of(node);
        boolean satisfiable = false;
        for (boolean value : TruthTable.of(formula).values()) {
            satisfiable |= value;
        }
        assertThat(Satisfiability.isSatisfiable(formula), is(satisfiable));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("setDataPoints")
    public void testSetDuality(SetDataPoint point) {
        Formula formula = Formula.of(point.node);
        formula.assignSets(point.sets);
        List<Integer> result = SetEvaluator.evaluate(formula);

        List<Character> variables = formula.variables();
        for (int element : formula.table().universe()) {
            for (char variable : variables) {
                int index = VariableTable.index(variable);
                formula.assign(variable, formula.table().set(index).contains(element));
            }
            assertThat("Element " + element, result.contains(element), is(formula.evaluate()));
        }
    }

    static final class SetDataPoint {
        final Node node;
        final ImmutableList<ImmutableSortedSet<Integer>> sets;

        SetDataPoint(Node node, ImmutableList<ImmutableSortedSet<Integer>> sets) {
            this.node = node;
            this.sets = sets;
        }

        @Override
        public String toString() {
            return node + " " + sets;
        }
    }
}
